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
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;

/**
 * A configurator used to define a conversion from input elements to the rows of a {@link Table table}.
 *
 * <p>Columns defined on the configurator become columns of the resultant table, in order of definition. A column may
 * be redefined on the configurator, in which case its definition is replaced, but its original position is retained.
 *
 * @see Table#collector
 * @param <T> the type of input elements
 */
public class IntoAPI<T> {
    private final Map<String, Integer> indexByName = new HashMap<>();
    private final List<Mapper<T, ?>> definitions = new ArrayList<>();
    
    IntoAPI() {} // Prevent default public constructor
    
    /**
     * Defines (or redefines) the named column as the application of the given function to each input element.
     *
     * @param name the column name
     * @param type the column element type
     * @param mapper a function to apply to each input element
     * @return this configurator
     * @param <U> the element type of the column
     */
    public <U> IntoAPI<T> column(String name, Class<U> type, Function<? super T, ? extends U> mapper) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        Objects.requireNonNull(mapper);
        int index = indexByName.computeIfAbsent(name, k -> definitions.size());
        Mapper<T, U> def = new Mapper<>(name, index, type, mapper);
        if (index == definitions.size())
            definitions.add(def);
        else
            definitions.set(index, def);
        return this;
    }
    
    Collector<T, ?, Table> collector(Consumer<IntoAPI<T>> config) {
        config.accept(this);
        
        // Avoid picking up side-effects from bad-actor callbacks.
        List<Mapper<T, ?>> finalMappers = List.copyOf(definitions);
        
        int size = finalMappers.size();
        return Collector.of(
            () -> new ArrayList<Object[]>(),
            (a, t) -> {
                Object[] arr = new Object[size];
                for (Mapper<T, ?> mapper : finalMappers)
                    mapper.accept(t, arr);
                a.add(arr);
            },
            (a, b) -> {
                a.addAll(b);
                return a;
            },
            a -> {
                Table table = Table.empty();
                for (Mapper<T, ?> mapper : finalMappers)
                    table = table.add(mapper.name, mapper.column(a));
                return table;
            }
        );
    }
    
    private static class Mapper<T, U> {
        final String name;
        final int index;
        final Class<U> type;
        final Function<? super T, ? extends U> mapper;
        
        Mapper(String name, int index, Class<U> type, Function<? super T, ? extends U> mapper) {
            this.name = name;
            this.index = index;
            this.type = type;
            this.mapper = mapper;
        }
        
        void accept(T in, Object[] arr) {
            arr[index] = mapper.apply(in);
        }
        
        Column<U> column(List<Object[]> rows) {
            List<U> values = new ArrayList<>(rows.size());
            for (Object[] row : rows)
                values.add(Utils.cast(row[index]));
            return Column.of(type, values);
        }
    }
}
