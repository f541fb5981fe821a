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

/**
 * Thrown when a value does not have the type an operation requires: a non-sequence passed as column data, a column
 * whose element type disagrees with the other groups of a {@link Grouping grouping}, or a sort column whose element
 * type has no total order.
 *
 * <p>The message names the offending type, followed by the second type involved (if any), followed by a description
 * of the problem. For example: {@code "class java.lang.Double and class java.lang.String for column "x" are not the
 * same"}.
 */
public class ColumnTypeException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;
    
    private final Class<?> type1;
    private final Class<?> type2;
    
    /**
     * Creates a new {@code ColumnTypeException}.
     *
     * @param type1 the offending type
     * @param type2 the type it was checked against, or {@code null} if there is none
     * @param extra a description of the problem
     */
    public ColumnTypeException(Class<?> type1, Class<?> type2, String extra) {
        super(message(type1, type2, extra));
        this.type1 = type1;
        this.type2 = type2;
    }
    
    private static String message(Class<?> type1, Class<?> type2, String extra) {
        if (type2 == null)
            return type1 + " " + extra;
        return type1 + " and " + type2 + " " + extra;
    }
    
    /**
     * Returns the offending type.
     *
     * @return the offending type
     */
    public Class<?> type1() {
        return type1;
    }
    
    /**
     * Returns the type the offending type was checked against, or {@code null} if there is none.
     *
     * @return the second type involved, or {@code null}
     */
    public Class<?> type2() {
        return type2;
    }
}
