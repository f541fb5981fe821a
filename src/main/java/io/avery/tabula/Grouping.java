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
 * A set of {@link Table tables} with identical sets of columns, each identified by a distinct {@link GroupID}.
 *
 * <p>Visually, a grouping can be thought of as follows:
 *
 * <pre>{@code
 *        Col A  Col B  Col C
 *     ------ group /a ------
 *     0   5.4    "x"     90
 *     1   -.2    "y"     30
 *     ------ group /b ------
 *     0   9.3    "a"     10
 * }</pre>
 *
 * <p>Every table in a grouping has the same set of column names, and each column has the same element type in every
 * table (a constant column's type is the class of its value). Column order is not required to agree between tables.
 *
 * <p>Like a table, a grouping's structure is immutable. To construct a grouping, start with a table (typically
 * {@link Table#empty() the empty table}, which is also the empty grouping) and add tables to it using
 * {@link #addTable(GroupID, Table)}. A table is itself a grouping of at most one group, {@link GroupID#ROOT}.
 */
public interface Grouping {
    /**
     * Returns the names of the columns in this grouping, or an empty list if there are no tables. Every table in this
     * grouping has this set of columns.
     *
     * @return the names of the columns in this grouping
     */
    List<String> columns();
    
    /**
     * Returns the group identifiers of the tables in this grouping, in the order the groups were added.
     *
     * @return the group identifiers of this grouping
     */
    List<GroupID> tables();
    
    /**
     * Returns the table in the given group, or {@code null} if there is no such group.
     *
     * @param gid the group identifier
     * @return the table in the given group, or {@code null}
     */
    Table table(GroupID gid);
    
    /**
     * Returns a new grouping with table {@code t} bound to group {@code gid}.
     *
     * <p>If {@code t} is {@link Table#empty() the empty table}, this is a no-op, because the empty table contains no
     * groups. If {@code t} is {@code null}, the result is this grouping with group {@code gid} removed. Otherwise, any
     * existing group {@code gid} is first removed, and then {@code t} is added as a new group. Unless it is the only
     * group, {@code t} must have the same set of columns as the existing tables, with identical element types.
     *
     * @param gid the group identifier
     * @param t the table, or {@code null} to remove the group
     * @return a new grouping
     * @throws ColumnTypeException if a column of {@code t} has a different element type than in this grouping
     * @throws IllegalArgumentException if {@code t} is missing a column of this grouping, or has an extra column
     */
    Grouping addTable(GroupID gid, Table t);
}
