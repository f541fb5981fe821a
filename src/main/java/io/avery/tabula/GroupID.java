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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An identifier of a group in a {@link Grouping grouping}.
 *
 * <p>Group identifiers form a hierarchy: each identifier other than {@link #ROOT} has a parent and a label, and
 * {@link #extend(Object)} creates a child of an identifier. A grouping does not interpret this hierarchy; it simply
 * maps distinct identifiers to tables. The hierarchy is useful for sub-dividing groups, for example by the distinct
 * values of a column, while remembering the group that was sub-divided.
 *
 * <p>Two group identifiers are equal if they have equal labels at every level of the hierarchy. Group identifiers
 * are ordered parent-first, and then by label.
 */
public final class GroupID implements Comparable<GroupID> {
    /**
     * The root group identifier. A {@link Table table} used as a grouping has at most this one group.
     */
    public static final GroupID ROOT = new GroupID(null, null);
    
    private final GroupID parent;
    private final Object label;
    private final int depth;
    private final int hash;
    
    private GroupID(GroupID parent, Object label) {
        this.parent = parent;
        this.label = label;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.hash = parent == null ? 0 : 31 * parent.hash + label.hashCode();
    }
    
    /**
     * Returns a new group identifier that is a child of this one, with the given label.
     *
     * @param label the label of the child
     * @return a child of this group identifier
     */
    public GroupID extend(Object label) {
        return new GroupID(this, Objects.requireNonNull(label));
    }
    
    /**
     * Returns the parent of this group identifier, or {@code null} if this is {@link #ROOT}.
     *
     * @return the parent of this group identifier, or {@code null}
     */
    public GroupID parent() {
        return parent;
    }
    
    /**
     * Returns the label of this group identifier, or {@code null} if this is {@link #ROOT}.
     *
     * @return the label of this group identifier, or {@code null}
     */
    public Object label() {
        return label;
    }
    
    /**
     * Returns {@code true} if this is the {@link #ROOT} group identifier.
     *
     * @return {@code true} if this is the root group identifier
     */
    public boolean isRoot() {
        return parent == null;
    }
    
    private List<Object> path() {
        List<Object> path = new ArrayList<>(depth);
        for (GroupID g = this; g.parent != null; g = g.parent)
            path.add(g.label);
        Collections.reverse(path);
        return path;
    }
    
    /**
     * Compares this group identifier with another. Labels are compared level by level, from the root down, and an
     * identifier orders before its own children. Labels of the same class that are {@code Comparable} are compared by
     * their natural order; other labels are compared by their string forms, then by class name.
     *
     * @param o the group identifier to be compared
     * @return a negative integer, zero, or a positive integer as this identifier is less than, equal to, or greater
     * than the given identifier
     */
    @Override
    public int compareTo(GroupID o) {
        if (this == o)
            return 0;
        List<Object> a = path();
        List<Object> b = o.path();
        int n = Math.min(a.size(), b.size());
        for (int i = 0; i < n; i++) {
            int v = compareLabels(a.get(i), b.get(i));
            if (v != 0)
                return v;
        }
        return Integer.compare(a.size(), b.size());
    }
    
    private static int compareLabels(Object a, Object b) {
        if (a.getClass() == b.getClass() && a instanceof Comparable)
            return Utils.NATURAL_ORDER.compare(a, b);
        int v = a.toString().compareTo(b.toString());
        if (v != 0)
            return v;
        return a.getClass().getName().compareTo(b.getClass().getName());
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GroupID))
            return false;
        GroupID a = this;
        GroupID b = (GroupID) o;
        if (a.depth != b.depth || a.hash != b.hash)
            return false;
        for (; a.parent != null; a = a.parent, b = b.parent)
            if (!a.label.equals(b.label))
                return false;
        return true;
    }
    
    @Override
    public int hashCode() {
        return hash;
    }
    
    /**
     * Returns a string representation of this group identifier: the labels from the root down, each preceded by a
     * {@code '/'}. Slashes and backslashes within labels are escaped with a backslash. The root is {@code "/"}.
     *
     * @return a string representation of this group identifier
     */
    @Override
    public String toString() {
        if (parent == null)
            return "/";
        StringBuilder sb = new StringBuilder();
        for (Object l : path())
            sb.append('/').append(l.toString().replace("\\", "\\\\").replace("/", "\\/"));
        return sb.toString();
    }
}
