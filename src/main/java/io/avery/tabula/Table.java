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

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Consumer;
import java.util.stream.Collector;

import static io.avery.tabula.Utils.quote;

/**
 * An ordered two-dimensional relation. A table consists of a set of named columns. Each column is either a regular
 * {@link Column column} of values of a consistent type, or a constant value. All regular columns have the same
 * length.
 *
 * <p>{@link #empty() The empty table} has no rows and no columns. A table may have one or more columns but no rows;
 * such a table is <em>not</em> considered empty.
 *
 * <p>A table is also a trivial {@link Grouping grouping}. The empty table has no groups, and hence is also the empty
 * grouping. Any other table consists only of the root group, {@link GroupID#ROOT}.
 *
 * <p>A table's structure is immutable. To construct a table, start with the empty table and add columns to it using
 * {@link #add(String, Column)} and {@link #addConst(String, Object)}. Each call returns a new table that shares the
 * unmodified columns with its predecessor.
 *
 * <p>A table with no regular columns (only constants) has zero rows. A constant column has no inherent length; when
 * read through {@link #column(String)} it is repeated to the table's row count.
 */
public final class Table implements Grouping {
    private static final Table EMPTY = new Table(Map.of(), Map.of(), List.of(), 0);
    
    final Map<String, Column<?>> cols;
    final Map<String, Object> consts;
    final List<String> colNames;
    final int len;
    
    // Constant expansions, computed on first read.
    private final ConcurrentMap<String, Column<?>> expanded = new ConcurrentHashMap<>();
    
    private Table(Map<String, Column<?>> cols, Map<String, Object> consts, List<String> colNames, int len) {
        this.cols = cols;
        this.consts = consts;
        this.colNames = colNames;
        this.len = len;
    }
    
    /**
     * Returns the empty table, which has no rows, no columns, and no groups.
     *
     * @return the empty table
     */
    public static Table empty() {
        return EMPTY;
    }
    
    /**
     * Returns a {@code Collector} that accumulates the input elements into a new table, mapping each input element to
     * a row as configured by the given configurator consumer. If the configurator defines no columns, the result is
     * the empty table.
     *
     * @param config a consumer that configures the table columns
     * @return a {@code Collector} which collects all the input elements into a table, in encounter order
     * @param <T> the type of the input elements
     */
    public static <T> Collector<T, ?, Table> collector(Consumer<IntoAPI<T>> config) {
        return new IntoAPI<T>().collector(config);
    }
    
    /**
     * Returns a new table with column {@code name} bound to the given data, or with column {@code name} removed if the
     * data is {@code null}.
     *
     * <p>If this table already has a column with the given name (regular or constant), it is removed first. Removing
     * the only column of a table results in the empty table. Removing a column that does not exist returns this
     * table.
     *
     * <p>If this table has no regular columns, the new column determines the table's row count. Otherwise the new
     * column must have as many elements as the table has rows.
     *
     * @param name the column name
     * @param data the column data, or {@code null} to remove the column
     * @return a new table
     * @throws IllegalArgumentException if the data has a different length than the table
     */
    public Table add(String name, Column<?> data) {
        Objects.requireNonNull(name);
        if (data == null) {
            if (!hasColumn(name))
                return this; // Nothing to remove
            if (colNames.size() == 1)
                return EMPTY;
            return cloneSans(name);
        }
        
        Table nt = cloneSans(name);
        int dataLen = data.size();
        if (nt.cols.isEmpty())
            return nt.with(name, data, null, dataLen);
        if (nt.len != dataLen)
            throw new IllegalArgumentException(String.format(
                "cannot add column %s with %d elements to table with %d rows", quote(name), dataLen, nt.len));
        return nt.with(name, data, null, nt.len);
    }
    
    /**
     * Returns a new table with column {@code name} bound to the given data, or with column {@code name} removed if the
     * data is {@code null}. The data must be a {@link Column} or an array, as accepted by {@link Column#from(Object)}.
     *
     * @param name the column name
     * @param data a column or an array, or {@code null} to remove the column
     * @return a new table
     * @throws ColumnTypeException if the data is not a sequence
     * @throws IllegalArgumentException if the data has a different length than the table
     * @see #add(String, Column)
     */
    public Table add(String name, Object data) {
        return add(name, data == null ? null : Column.from(data));
    }
    
    /**
     * Returns a new table with a constant column {@code name} whose value is {@code value}, or with column
     * {@code name} removed if the value is {@code null}. If this table already has a column with the given name, it is
     * removed first.
     *
     * <p>A constant column has the same value in every row of the table. It does not itself have a length, and does
     * not affect the table's row count.
     *
     * @param name the column name
     * @param value the constant value, or {@code null} to remove the column
     * @return a new table
     */
    public Table addConst(String name, Object value) {
        if (value == null)
            return add(name, (Column<?>) null);
        Objects.requireNonNull(name);
        Table nt = cloneSans(name);
        return nt.with(name, null, value, nt.len);
    }
    
    /**
     * Returns a copy of this table without column {@code name}. The row count resets to zero if no regular columns
     * remain. The copy's maps and name list are fresh, so {@link #with} may extend them before the copy escapes.
     */
    private Table cloneSans(String name) {
        Map<String, Column<?>> ncols = new HashMap<>();
        Map<String, Object> nconsts = new HashMap<>();
        List<String> nnames = new ArrayList<>(colNames.size() + 1);
        for (String name2 : colNames) {
            if (name.equals(name2))
                continue;
            Column<?> c = cols.get(name2);
            if (c != null)
                ncols.put(name2, c);
            else
                nconsts.put(name2, consts.get(name2));
            nnames.add(name2);
        }
        return new Table(ncols, nconsts, nnames, ncols.isEmpty() ? 0 : len);
    }
    
    /**
     * Appends a column to a table fresh from {@link #cloneSans}, which is discarded.
     */
    private Table with(String name, Column<?> data, Object value, int newLen) {
        if (data != null)
            cols.put(name, data);
        else
            consts.put(name, value);
        colNames.add(name);
        return new Table(cols, consts, colNames, newLen);
    }
    
    /**
     * Returns a table with the same columns as this table, in which every regular column has been re-ordered by the
     * given row indices. Constant columns are carried over unchanged.
     */
    Table selectRows(int[] indices) {
        Map<String, Column<?>> ncols = new HashMap<>();
        cols.forEach((name, c) -> ncols.put(name, c.select(indices)));
        return new Table(ncols, consts, colNames, indices.length);
    }
    
    /**
     * Returns the number of rows in this table. This is zero for the empty table, and for a table that has only
     * constant columns.
     *
     * @return the number of rows in this table
     */
    public int size() {
        return len;
    }
    
    /**
     * Returns {@code true} if this is {@link #empty() the empty table}: it has no columns at all. A table with columns
     * but no rows is not empty.
     *
     * @return {@code true} if this table has no columns
     */
    public boolean isEmpty() {
        return colNames.isEmpty();
    }
    
    /**
     * Returns the names of the columns in this table, in the order they were added. Returns an empty list if this
     * table is empty.
     *
     * @return the names of the columns in this table
     */
    @Override
    public List<String> columns() {
        return Collections.unmodifiableList(colNames);
    }
    
    /**
     * Returns {@code true} if this table has a column (regular or constant) with the given name.
     *
     * @param name the column name
     * @return {@code true} if this table has the named column
     */
    public boolean hasColumn(String name) {
        return cols.containsKey(name) || consts.containsKey(name);
    }
    
    /**
     * Returns {@code true} if column {@code name} of this table is a constant column.
     *
     * @param name the column name
     * @return {@code true} if the named column is a constant column
     */
    public boolean isConstant(String name) {
        return consts.containsKey(name);
    }
    
    /**
     * Returns the column {@code name} of this table, or {@code null} if there is no such column. If {@code name} is a
     * constant column, this returns a column with the constant value repeated to the length of the table. The
     * expansion is computed once, and the same column object is returned on every subsequent call.
     *
     * @param name the column name
     * @return the named column, or {@code null}
     */
    public Column<?> column(String name) {
        Column<?> c = cols.get(name);
        if (c != null)
            return c;
        Object cv = consts.get(name);
        if (cv == null)
            return null;
        return expanded.computeIfAbsent(name, k -> Column.repeat(cv, len));
    }
    
    /**
     * Like {@link #column(String)}, but throws {@link NoSuchElementException} if there is no such column.
     *
     * @param name the column name
     * @return the named column
     * @throws NoSuchElementException if this table has no column with the given name
     */
    public Column<?> mustColumn(String name) {
        Column<?> c = column(name);
        if (c == null)
            throw new NoSuchElementException("unknown column " + quote(name));
        return c;
    }
    
    /**
     * Like {@link #mustColumn(String)}, but also checks that the column's element type is assignable to the given
     * type.
     *
     * @param name the column name
     * @param type the expected element type
     * @return the named column
     * @param <T> the expected element type
     * @throws NoSuchElementException if this table has no column with the given name
     * @throws ColumnTypeException if the column's element type is not assignable to the given type
     */
    public <T> Column<? extends T> mustColumn(String name, Class<T> type) {
        Column<?> c = mustColumn(name);
        if (!Utils.box(type).isAssignableFrom(c.type()))
            throw new ColumnTypeException(c.type(), type, "for column " + quote(name) + " is not assignable");
        return Utils.cast(c);
    }
    
    /**
     * Returns the value of constant column {@code name}, or an empty optional if this table has no such column or it
     * is not a constant column.
     *
     * @param name the column name
     * @return the constant value, if the column is a constant column
     */
    public Optional<Object> constant(String name) {
        return Optional.ofNullable(consts.get(name));
    }
    
    /**
     * Returns the element type of column {@code name}: the column's {@link Column#type() type} for a regular column,
     * or the class of the value for a constant column. Returns {@code null} if there is no such column.
     *
     * @param name the column name
     * @return the element type of the named column, or {@code null}
     */
    public Class<?> columnType(String name) {
        Column<?> c = cols.get(name);
        if (c != null)
            return c.type();
        Object cv = consts.get(name);
        return cv == null ? null : cv.getClass();
    }
    
    /**
     * Returns the group identifiers of this table: none if this table is empty, or else only {@link GroupID#ROOT}.
     *
     * @return the group identifiers of this table
     */
    @Override
    public List<GroupID> tables() {
        if (isEmpty())
            return List.of();
        return List.of(GroupID.ROOT);
    }
    
    /**
     * Returns this table if {@code gid} is {@link GroupID#ROOT} and this table is not empty; otherwise returns
     * {@code null}.
     *
     * @param gid the group identifier
     * @return this table, or {@code null}
     */
    @Override
    public Table table(GroupID gid) {
        if (GroupID.ROOT.equals(gid) && !isEmpty())
            return this;
        return null;
    }
    
    /**
     * Returns a grouping with up to two groups: first this table, if non-empty, bound to {@link GroupID#ROOT}; then
     * {@code t}, if non-empty, bound to {@code gid}. If {@code gid} is the root, {@code t} replaces this table.
     *
     * <p>Typically this is used to build up a grouping by starting with the empty table and adding tables to it.
     *
     * @param gid the group identifier
     * @param t the table, or {@code null} to remove the group
     * @return a new grouping
     */
    @Override
    public Grouping addTable(GroupID gid, Table t) {
        Objects.requireNonNull(gid);
        if (t == null)
            return gid.isRoot() ? EMPTY : this;
        if (t.isEmpty())
            return this;
        if (gid.isRoot())
            return t;
        return GroupedTable.EMPTY.addTable(GroupID.ROOT, this).addTable(gid, t);
    }
    
    /**
     * Returns {@code true} if and only if the given object is a table with the same set of column names as this
     * table (in any order), the same row count, and equal columns: regular columns equal as by
     * {@link Column#equals(Object)}, and constant columns with equal values.
     *
     * @param o the object to be compared for equality with this table
     * @return {@code true} if the given object is equal to this table
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Table))
            return false;
        Table other = (Table) o;
        return len == other.len && cols.equals(other.cols) && consts.equals(other.consts);
    }
    
    @Override
    public int hashCode() {
        return 31 * (31 * len + cols.hashCode()) + consts.hashCode();
    }
    
    /**
     * Returns a string representation of this table. The string representation consists of the characters
     * {@code "Table"}, followed by an array-of-arrays. The first inner array lists the column names in order,
     * comma-separated. The remaining inner arrays list each row's values in order, comma-separated. For example:
     *
     * <pre>{@code
     * Table[
     *     [x, y],
     *     [1.0, a],
     *     [2.0, b]
     * ]
     * }</pre>
     *
     * @return a string representation of this table
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Table[\n\t[");
        String delimiter = "";
        for (String name : colNames) {
            sb.append(delimiter).append(name);
            delimiter = ", ";
        }
        sb.append(']');
        for (int i = 0; i < len; i++) {
            sb.append(",\n\t[");
            delimiter = "";
            for (String name : colNames) {
                Column<?> c = cols.get(name);
                sb.append(delimiter).append(c != null ? c.get(i) : consts.get(name));
                delimiter = ", ";
            }
            sb.append(']');
        }
        return sb.append("\n]").toString();
    }
}
