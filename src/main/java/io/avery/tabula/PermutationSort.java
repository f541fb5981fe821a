/*
 * MIT License
 *
 * Copyright (c) 2022 Daniel Avery
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package io.avery.tabula;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static io.avery.tabula.Utils.quote;

/**
 * Sorts the rows of a single table by a tuple of columns, by stably sorting a row permutation and then applying it to
 * every column.
 */
class PermutationSort {
    private static final Logger LOG = LoggerFactory.getLogger(PermutationSort.class);
    
    private PermutationSort() {} // Prevent instantiation
    
    static Table sort(Table t, String[] cols) {
        List<RowOrder> keys = new ArrayList<>(cols.length);
        for (String col : cols) {
            Column<?> c = t.mustColumn(col);
            RowOrder key = c.rowOrder();
            if (key == null)
                throw new ColumnTypeException(c.type(), null, "for column " + quote(col) + " has no total order");
            // A constant column cannot change the order.
            if (!t.isConstant(col))
                keys.add(key);
        }
        
        int size = t.size();
        if (keys.isEmpty() || size < 2)
            return t;
        RowOrder order = RowOrder.lexicographic(keys);
        if (order.isSorted(size)) {
            // Avoid shuffling everything by the identity permutation.
            LOG.debug("Rows already ordered by {}", Arrays.asList(cols));
            return t;
        }
        
        // Arrays.sort on objects is stable.
        Integer[] boxed = new Integer[size];
        for (int i = 0; i < size; i++)
            boxed[i] = i;
        Arrays.sort(boxed, order::compare);
        int[] perm = new int[size];
        for (int i = 0; i < size; i++)
            perm[i] = boxed[i];
        
        return t.selectRows(perm);
    }
}
