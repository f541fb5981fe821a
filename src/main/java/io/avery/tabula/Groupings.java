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

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Operations that transform every group of a {@link Grouping grouping}.
 */
public class Groupings {
    private Groupings() {} // Prevent instantiation
    
    /**
     * Returns a grouping in which each table of the given grouping has been replaced by the result of applying the
     * given function to its group identifier and table. Groups keep their order. A function result of {@code null} or
     * the empty table drops the group.
     *
     * <p>The resulting tables must have the same set of columns with identical element types, like any grouping.
     *
     * @param g the grouping
     * @param mapper a function from group identifier and table to the new table for that group
     * @return a new grouping
     * @throws ColumnTypeException if the resulting tables disagree on a column's element type
     * @throws IllegalArgumentException if the resulting tables disagree on the set of columns
     */
    public static Grouping mapTables(Grouping g, BiFunction<? super GroupID, ? super Table, ? extends Table> mapper) {
        Objects.requireNonNull(mapper);
        GroupingBuilder out = new GroupingBuilder();
        for (GroupID gid : g.tables())
            out.add(gid, mapper.apply(gid, g.table(gid)));
        return out.build();
    }
    
    /**
     * Returns a grouping in which the rows of each group are sorted by the named columns. If more than one column is
     * given, rows are sorted by the tuple of the columns; that is, rows that are equal in the first column are sorted
     * by the second column, and so on. The sort is stable: rows that are equal in every named column keep their
     * relative order. Every column of the table, named or not, is re-ordered the same way.
     *
     * <p>Each named column is ordered by its {@link Column#comparator() comparator}. Groups whose rows are already in
     * order, including groups of fewer than two rows, are carried over as the same table object. If no columns are
     * named, the given grouping is returned.
     *
     * @param g the grouping
     * @param cols the names of the columns to sort by, most significant first
     * @return a new grouping
     * @throws java.util.NoSuchElementException if a group has no column with one of the given names
     * @throws ColumnTypeException if one of the named columns has no order
     */
    public static Grouping sortBy(Grouping g, String... cols) {
        for (String col : cols)
            Objects.requireNonNull(col);
        if (cols.length == 0)
            return g;
        GroupingBuilder out = new GroupingBuilder();
        for (GroupID gid : g.tables())
            out.add(gid, PermutationSort.sort(g.table(gid), cols));
        return out.build();
    }
}
