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

import java.util.List;

/**
 * An ordering over the rows of a column, addressed by row index.
 */
@FunctionalInterface
interface RowOrder {
    int compare(int i, int j);
    
    /**
     * Orders rows by the first key, falling through to the next key on ties. The last key decides the remaining ties.
     */
    static RowOrder lexicographic(List<RowOrder> keys) {
        if (keys.size() == 1)
            return keys.get(0);
        RowOrder[] arr = keys.toArray(new RowOrder[0]);
        return (i, j) -> {
            for (RowOrder key : arr) {
                int v = key.compare(i, j);
                if (v != 0)
                    return v;
            }
            return 0;
        };
    }
    
    /**
     * Returns {@code true} if rows {@code [0, size)} are already in this order.
     */
    default boolean isSorted(int size) {
        for (int i = 1; i < size; i++)
            if (compare(i - 1, i) > 0)
                return false;
        return true;
    }
}
