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

import java.lang.reflect.Array;
import java.util.*;
import java.util.stream.Stream;

import static io.avery.tabula.Utils.cast;

/**
 * An immutable, homogeneous sequence of values: the storage behind each regular column of a {@link Table table}.
 *
 * <p>Every column carries a runtime element type token, {@link #type()}, which is always a reference type. Columns
 * backed by primitive arrays report the corresponding wrapper class, so a {@code double[]} column and a column of
 * {@code Double} objects have the same element type. Element types are what a {@link Grouping grouping} compares to
 * decide whether two tables have compatible columns.
 *
 * <p>Columns may be ordered, either by a comparator attached with {@link #orderedBy(Comparator)}, or by the natural
 * order (nulls first) of an element type that implements {@code Comparable}. Sorting a grouping by a column that is
 * neither fails with a {@link ColumnTypeException}.
 *
 * <p>Factory methods copy the values they are given. Once created, a column is never modified, and may be shared
 * freely between tables.
 *
 * @param <T> the element type of the column
 */
public abstract class Column<T> {
    final Class<T> type;
    final Comparator<? super T> order;
    
    Column(Class<T> type, Comparator<? super T> order) {
        this.type = type;
        this.order = order;
    }
    
    /**
     * Returns a column of the given element type, containing the given values in order.
     *
     * @param type the element type
     * @param values the values
     * @return a new column
     * @param <T> the element type
     * @throws ColumnTypeException if a value is not an instance of the element type
     */
    @SafeVarargs
    public static <T> Column<T> of(Class<T> type, T... values) {
        Class<T> boxed = Utils.box(type);
        Object[] copy = Arrays.copyOf(values, values.length, Object[].class);
        checkElements(boxed, copy);
        return new RefColumn<>(boxed, copy, null);
    }
    
    /**
     * Returns a column of the given element type, containing the values of the given list in order.
     *
     * @param type the element type
     * @param values the values
     * @return a new column
     * @param <T> the element type
     * @throws ColumnTypeException if a value is not an instance of the element type
     */
    public static <T> Column<T> of(Class<T> type, List<? extends T> values) {
        Class<T> boxed = Utils.box(type);
        Object[] copy = values.toArray();
        checkElements(boxed, copy);
        return new RefColumn<>(boxed, copy, null);
    }
    
    /**
     * Returns a {@code Double} column backed by a copy of the given values.
     *
     * @param values the values
     * @return a new column
     */
    public static Column<Double> ofDoubles(double... values) {
        return new DoubleColumn(values.clone(), null);
    }
    
    /**
     * Returns a {@code Long} column backed by a copy of the given values.
     *
     * @param values the values
     * @return a new column
     */
    public static Column<Long> ofLongs(long... values) {
        return new LongColumn(values.clone(), null);
    }
    
    /**
     * Returns an {@code Integer} column backed by a copy of the given values.
     *
     * @param values the values
     * @return a new column
     */
    public static Column<Integer> ofInts(int... values) {
        return new IntColumn(values.clone(), null);
    }
    
    /**
     * Returns a column of the given size, in which every element is the given value. The column does not store a copy
     * of the value per element.
     *
     * @param value the repeated value
     * @param size the number of elements
     * @return a new column
     * @param <T> the element type
     */
    public static <T> Column<T> repeat(T value, int size) {
        Objects.requireNonNull(value);
        if (size < 0)
            throw new IllegalArgumentException("negative column size " + size);
        Class<T> type = cast(value.getClass());
        return new RepeatColumn<>(type, value, size, null);
    }
    
    /**
     * Returns the given object as a column. Columns are returned as-is. Arrays (of primitive or reference component
     * type) are copied into a new column whose element type is the array's (boxed) component type.
     *
     * @param data a column or an array
     * @return the data as a column
     * @throws ColumnTypeException if the data is neither a column nor an array, including if it is a collection
     */
    public static Column<?> from(Object data) {
        Objects.requireNonNull(data);
        if (data instanceof Column)
            return (Column<?>) data;
        Class<?> cls = data.getClass();
        if (data instanceof Collection)
            throw new ColumnTypeException(cls, null, "has no runtime element type; use Column.of(type, list)");
        if (!cls.isArray())
            throw new ColumnTypeException(cls, null, "is not a sequence");
        if (data instanceof double[])
            return ofDoubles((double[]) data);
        if (data instanceof long[])
            return ofLongs((long[]) data);
        if (data instanceof int[])
            return ofInts((int[]) data);
        if (data instanceof Object[]) {
            Object[] arr = (Object[]) data;
            return new RefColumn<>(cls.getComponentType(), arr.clone(), null);
        }
        // Remaining primitive arrays (boolean, float, short, byte, char) are stored boxed.
        int length = Array.getLength(data);
        Object[] boxed = new Object[length];
        for (int i = 0; i < length; i++)
            boxed[i] = Array.get(data, i);
        return new RefColumn<>(Utils.box(cls.getComponentType()), boxed, null);
    }
    
    private static void checkElements(Class<?> type, Object[] values) {
        for (Object value : values)
            if (value != null && !type.isInstance(value))
                throw new ColumnTypeException(value.getClass(), type, "is not assignable to the column element type");
    }
    
    /**
     * Returns the element type of this column.
     *
     * @return the element type of this column
     */
    public Class<T> type() {
        return type;
    }
    
    /**
     * Returns the number of elements in this column.
     *
     * @return the number of elements in this column
     */
    public abstract int size();
    
    /**
     * Returns the element at the given index.
     *
     * @param index the index
     * @return the element at the given index
     * @throws IndexOutOfBoundsException if the index is out of range
     */
    public abstract T get(int index);
    
    /**
     * Returns a new column whose {@code i}th element is this column's element at {@code indices[i]}. The new column
     * has the same element type and order as this column. Indices may repeat or be omitted.
     *
     * @param indices the indices to select, in order
     * @return a new column
     * @throws IndexOutOfBoundsException if an index is out of range
     */
    public abstract Column<T> select(int[] indices);
    
    /**
     * Returns a column with the same elements as this column, ordered by the given comparator rather than by the
     * element type's natural order.
     *
     * @param comparator the total order of the column's elements
     * @return a new column, sharing this column's storage
     */
    public Column<T> orderedBy(Comparator<? super T> comparator) {
        return withOrder(Objects.requireNonNull(comparator));
    }
    
    abstract Column<T> withOrder(Comparator<? super T> order);
    
    /**
     * Returns the total order of this column's elements: the comparator attached with
     * {@link #orderedBy(Comparator)} if there is one, or else the natural order (nulls first) if the element type is
     * {@code Comparable}, or else an empty optional.
     *
     * @return the order of this column's elements, if it has one
     */
    public Optional<Comparator<? super T>> comparator() {
        return Optional.ofNullable(comparatorOrNull());
    }
    
    Comparator<? super T> comparatorOrNull() {
        if (order != null)
            return order;
        if (Comparable.class.isAssignableFrom(type))
            return cast(Utils.NATURAL_ORDER);
        return null;
    }
    
    /**
     * Row-index view of {@link #comparator()}, or {@code null} if this column has no order.
     */
    RowOrder rowOrder() {
        Comparator<? super T> cmp = comparatorOrNull();
        if (cmp == null)
            return null;
        return (i, j) -> cmp.compare(get(i), get(j));
    }
    
    /**
     * Returns an unmodifiable list view of this column.
     *
     * @return a list view of this column
     */
    public List<T> toList() {
        return new ListView();
    }
    
    /**
     * Returns a sequential {@code Stream} over the elements of this column.
     *
     * @return a stream over the elements of this column
     */
    public Stream<T> stream() {
        return toList().stream();
    }
    
    /**
     * Returns the elements of this column as a new array of {@code double}s.
     *
     * @return the elements of this column as {@code double}s
     * @throws ColumnTypeException if the element type is not a {@code Number}
     * @throws NullPointerException if the column contains a {@code null}
     */
    public double[] toDoubleArray() {
        if (!Number.class.isAssignableFrom(type))
            throw new ColumnTypeException(type, null, "is not numeric");
        int size = size();
        double[] out = new double[size];
        for (int i = 0; i < size; i++)
            out[i] = ((Number) get(i)).doubleValue();
        return out;
    }
    
    /**
     * Returns {@code true} if and only if the given object is a column with the same element type as this column, and
     * equal elements in the same order. Attached comparators do not participate in equality.
     *
     * @param o the object to be compared for equality with this column
     * @return {@code true} if the given object is equal to this column
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Column))
            return false;
        Column<?> other = (Column<?>) o;
        int size = size();
        if (!type.equals(other.type) || size != other.size())
            return false;
        for (int i = 0; i < size; i++)
            if (!Objects.equals(get(i), other.get(i)))
                return false;
        return true;
    }
    
    @Override
    public int hashCode() {
        return 31 * type.hashCode() + toList().hashCode();
    }
    
    /**
     * Returns a string representation of this column: the characters {@code "Column"}, followed by the elements in
     * order, as by {@link List#toString()}.
     *
     * @return a string representation of this column
     */
    @Override
    public String toString() {
        return "Column" + toList();
    }
    
    private class ListView extends AbstractList<T> implements RandomAccess {
        @Override
        public T get(int index) {
            return Column.this.get(index);
        }
        
        @Override
        public int size() {
            return Column.this.size();
        }
    }
    
    private static final class RefColumn<T> extends Column<T> {
        final Object[] values;
        
        RefColumn(Class<T> type, Object[] values, Comparator<? super T> order) {
            super(type, order);
            this.values = values;
        }
        
        @Override
        public int size() {
            return values.length;
        }
        
        @Override
        public T get(int index) {
            return cast(values[index]);
        }
        
        @Override
        public Column<T> select(int[] indices) {
            Object[] out = new Object[indices.length];
            for (int i = 0; i < indices.length; i++)
                out[i] = values[indices[i]];
            return new RefColumn<>(type, out, order);
        }
        
        @Override
        Column<T> withOrder(Comparator<? super T> order) {
            return new RefColumn<>(type, values, order);
        }
    }
    
    private static final class DoubleColumn extends Column<Double> {
        final double[] values;
        
        DoubleColumn(double[] values, Comparator<? super Double> order) {
            super(Double.class, order);
            this.values = values;
        }
        
        @Override
        public int size() {
            return values.length;
        }
        
        @Override
        public Double get(int index) {
            return values[index];
        }
        
        @Override
        public Column<Double> select(int[] indices) {
            double[] out = new double[indices.length];
            for (int i = 0; i < indices.length; i++)
                out[i] = values[indices[i]];
            return new DoubleColumn(out, order);
        }
        
        @Override
        Column<Double> withOrder(Comparator<? super Double> order) {
            return new DoubleColumn(values, order);
        }
        
        @Override
        RowOrder rowOrder() {
            if (order != null)
                return super.rowOrder();
            return (i, j) -> Double.compare(values[i], values[j]);
        }
        
        @Override
        public double[] toDoubleArray() {
            return values.clone();
        }
    }
    
    private static final class LongColumn extends Column<Long> {
        final long[] values;
        
        LongColumn(long[] values, Comparator<? super Long> order) {
            super(Long.class, order);
            this.values = values;
        }
        
        @Override
        public int size() {
            return values.length;
        }
        
        @Override
        public Long get(int index) {
            return values[index];
        }
        
        @Override
        public Column<Long> select(int[] indices) {
            long[] out = new long[indices.length];
            for (int i = 0; i < indices.length; i++)
                out[i] = values[indices[i]];
            return new LongColumn(out, order);
        }
        
        @Override
        Column<Long> withOrder(Comparator<? super Long> order) {
            return new LongColumn(values, order);
        }
        
        @Override
        RowOrder rowOrder() {
            if (order != null)
                return super.rowOrder();
            return (i, j) -> Long.compare(values[i], values[j]);
        }
    }
    
    private static final class IntColumn extends Column<Integer> {
        final int[] values;
        
        IntColumn(int[] values, Comparator<? super Integer> order) {
            super(Integer.class, order);
            this.values = values;
        }
        
        @Override
        public int size() {
            return values.length;
        }
        
        @Override
        public Integer get(int index) {
            return values[index];
        }
        
        @Override
        public Column<Integer> select(int[] indices) {
            int[] out = new int[indices.length];
            for (int i = 0; i < indices.length; i++)
                out[i] = values[indices[i]];
            return new IntColumn(out, order);
        }
        
        @Override
        Column<Integer> withOrder(Comparator<? super Integer> order) {
            return new IntColumn(values, order);
        }
        
        @Override
        RowOrder rowOrder() {
            if (order != null)
                return super.rowOrder();
            return (i, j) -> Integer.compare(values[i], values[j]);
        }
    }
    
    private static final class RepeatColumn<T> extends Column<T> {
        final T value;
        final int size;
        
        RepeatColumn(Class<T> type, T value, int size, Comparator<? super T> order) {
            super(type, order);
            this.value = value;
            this.size = size;
        }
        
        @Override
        public int size() {
            return size;
        }
        
        @Override
        public T get(int index) {
            Objects.checkIndex(index, size);
            return value;
        }
        
        @Override
        public Column<T> select(int[] indices) {
            for (int index : indices)
                Objects.checkIndex(index, size);
            return new RepeatColumn<>(type, value, indices.length, order);
        }
        
        @Override
        Column<T> withOrder(Comparator<? super T> order) {
            return new RepeatColumn<>(type, value, size, order);
        }
    }
}
