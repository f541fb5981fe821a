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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Accumulates groups in place, then freezes them into a {@link Grouping}. Adding N tables costs O(N), where adding
 * them one at a time through {@link Grouping#addTable(GroupID, Table)} costs O(N^2).
 *
 * <p>The builder must not be used after {@link #build()}; the built grouping takes over its storage.
 */
final class GroupingBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(GroupingBuilder.class);
    
    private Map<GroupID, Table> tables = new HashMap<>();
    private List<GroupID> groups = new ArrayList<>();
    private List<String> colNames = List.of();
    private boolean built = false;
    
    /**
     * Binds {@code t} to {@code gid}, replacing any existing binding but keeping its position. A {@code null} or
     * empty table is ignored.
     */
    GroupingBuilder add(GroupID gid, Table t) {
        Objects.requireNonNull(gid);
        if (built)
            throw new IllegalStateException("grouping already built");
        if (t == null || t.isEmpty())
            return this;
        if (groups.isEmpty()) {
            colNames = t.columns();
        } else {
            GroupedTable.checkSchema(tables.get(groups.get(0)), colNames, t);
        }
        if (tables.put(gid, t) == null)
            groups.add(gid);
        return this;
    }
    
    /**
     * Freezes the accumulated groups. No groups yields the empty table, and a lone root group yields its table.
     */
    Grouping build() {
        if (built)
            throw new IllegalStateException("grouping already built");
        built = true;
        LOG.debug("Built grouping of {} groups over columns {}", groups.size(), colNames);
        if (groups.isEmpty())
            return Table.empty();
        if (groups.size() == 1 && groups.get(0).isRoot())
            return tables.get(GroupID.ROOT);
        Grouping g = new GroupedTable(tables, groups, colNames);
        tables = null;
        groups = null;
        return g;
    }
}
