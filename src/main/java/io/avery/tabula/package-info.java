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

/**
 * Grouped, immutable, columnar tables. For example:
 *
 * <pre>{@code
 *     Table scores = Table.empty()
 *         .add("points", new double[]{ 3.0, 1.0, 2.0 })
 *         .add("player", new String[]{ "c", "a", "b" })
 *         .addConst("season", 2022);
 *
 *     Grouping byLeague = Table.empty()
 *         .addTable(GroupID.ROOT.extend("east"), scores)
 *         .addTable(GroupID.ROOT.extend("west"), otherScores);
 *
 *     Grouping ranked = Groupings.sortBy(byLeague, "points", "player");
 * }</pre>
 *
 * <h2><a id="Tables">Tables and Columns</a></h2>
 *
 * <p>A {@code Table} is a set of named columns. A regular column is a {@code Column}: an immutable sequence of values
 * with a runtime element type. A constant column is a single value, repeated to the table's row count when read. All
 * regular columns of a table have the same length. Tables are never modified; {@code add()} and {@code addConst()}
 * return new tables that share unmodified columns with the original.
 *
 * <h2><a id="Groupings">Groupings</a></h2>
 *
 * <p>A {@code Grouping} maps {@code GroupID}s to tables that share a schema: the same column names, with the same
 * element type per column. A table is itself a grouping of at most one group, {@code GroupID.ROOT}, and the empty
 * table is also the empty grouping. Transformations over groupings, such as {@code Groupings.sortBy()} or the
 * estimators in {@code io.avery.tabula.stat}, read each group's columns and build a new grouping, leaving their input
 * untouched.
 */
package io.avery.tabula;
