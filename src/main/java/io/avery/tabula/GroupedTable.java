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

import static io.avery.tabula.Utils.quote;

/**
 * A {@link Grouping} of any number of groups. Instances are never modified once constructed.
 */
final class GroupedTable implements Grouping {
    static final GroupedTable EMPTY = new GroupedTable(Map.of(), List.of(), List.of());
    
    final Map<GroupID, Table> tables;
    final List<GroupID> groups;
    final List<String> colNames;
    
    GroupedTable(Map<GroupID, Table> tables, List<GroupID> groups, List<String> colNames) {
        this.tables = tables;
        this.groups = groups;
        this.colNames = colNames;
    }
    
    @Override
    public List<String> columns() {
        return colNames;
    }
    
    @Override
    public List<GroupID> tables() {
        return Collections.unmodifiableList(groups);
    }
    
    @Override
    public Table table(GroupID gid) {
        return tables.get(gid);
    }
    
    @Override
    public Grouping addTable(GroupID gid, Table t) {
        Objects.requireNonNull(gid);
        if (t != null && t.isEmpty())
            return this; // Adding an empty table has no effect
        
        // Copy, removing any existing table with the same group id.
        Map<GroupID, Table> ntables = new HashMap<>();
        List<GroupID> ngroups = new ArrayList<>(groups.size() + 1);
        for (GroupID gid2 : groups) {
            if (gid.equals(gid2))
                continue;
            ntables.put(gid2, tables.get(gid2));
            ngroups.add(gid2);
        }
        if (t == null)
            return new GroupedTable(ntables, ngroups, ngroups.isEmpty() ? List.of() : colNames);
        
        if (ngroups.isEmpty()) {
            ntables.put(gid, t);
            ngroups.add(gid);
            return new GroupedTable(ntables, ngroups, t.columns());
        }
        
        checkSchema(ntables.get(ngroups.get(0)), colNames, t);
        ntables.put(gid, t);
        ngroups.add(gid);
        return new GroupedTable(ntables, ngroups, colNames);
    }
    
    /**
     * Checks that table {@code t} has exactly the columns {@code colNames} of table {@code base}, with the same
     * element types.
     */
    static void checkSchema(Table base, List<String> colNames, Table t) {
        for (String col : colNames) {
            Class<?> t0 = base.columnType(col);
            Class<?> t1 = t.columnType(col);
            if (t1 == null)
                throw new IllegalArgumentException("table missing column " + quote(col));
            if (t0 != t1)
                throw new ColumnTypeException(t0, t1, "for column " + quote(col) + " are not the same");
        }
        if (t.colNames.size() != colNames.size()) {
            // t has a column the grouping doesn't.
            Set<String> colSet = new HashSet<>(colNames);
            for (String col : t.colNames)
                if (!colSet.contains(col))
                    throw new IllegalArgumentException("table has extra column " + quote(col));
        }
    }
    
    /**
     * Returns {@code true} if and only if the given object is a grouped table with the same groups, in the same
     * order, bound to equal tables.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof GroupedTable))
            return false;
        GroupedTable other = (GroupedTable) o;
        return groups.equals(other.groups) && tables.equals(other.tables);
    }
    
    @Override
    public int hashCode() {
        return 31 * groups.hashCode() + tables.hashCode();
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Grouping[");
        for (GroupID gid : groups)
            sb.append("\n").append(gid).append(" = ").append(tables.get(gid));
        return sb.append("\n]").toString();
    }
}
