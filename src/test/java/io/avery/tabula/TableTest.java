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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class TableTest {
    private static final Table XY = Table.empty()
        .add("x", new double[]{ 3.0, 1.0, 2.0 })
        .add("y", new String[]{ "c", "a", "b" });
    
    @Test
    void testEmpty() {
        Table empty = Table.empty();
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
        assertEquals(List.of(), empty.columns());
        assertEquals(List.of(), empty.tables());
        assertNull(empty.table(GroupID.ROOT));
        assertSame(empty, empty.add("x", null));
    }
    
    @Test
    void testAddDefinesRowCount() {
        Table t = Table.empty().add("x", new int[]{ 1, 2, 3 });
        assertEquals(3, t.size());
        assertFalse(t.isEmpty());
        assertEquals(List.of("x"), t.columns());
    }
    
    @Test
    void testZeroRowTableIsNotEmpty() {
        Table t = Table.empty().add("x", new double[0]);
        assertEquals(0, t.size());
        assertFalse(t.isEmpty());
        assertEquals(List.of(GroupID.ROOT), t.tables());
    }
    
    @Test
    void testLengthMismatch() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> XY.add("z", new int[]{ 1, 2 }));
        assertEquals("cannot add column \"z\" with 2 elements to table with 3 rows", e.getMessage());
    }
    
    @Test
    void testNonSequence() {
        assertThrows(ColumnTypeException.class, () -> XY.add("z", 42));
    }
    
    @Test
    void testAddOverwritesByName() {
        Table t = XY.add("x", new int[]{ 7, 8, 9 });
        assertEquals(List.of("y", "x"), t.columns());
        assertEquals(Integer.class, t.columnType("x"));
        assertEquals(Column.ofInts(7, 8, 9), t.column("x"));
    }
    
    @Test
    void testOverwriteOnlyColumnWithNewLength() {
        Table t = Table.empty().add("x", new int[]{ 1, 2 }).add("x", new int[]{ 1, 2, 3 });
        assertEquals(3, t.size());
    }
    
    @Test
    void testAddConstOverwritesRegular() {
        Table t = XY.addConst("x", 5.0);
        assertTrue(t.isConstant("x"));
        assertEquals(Optional.of(5.0), t.constant("x"));
        assertEquals(3, t.size());
        assertEquals(List.of("y", "x"), t.columns());
    }
    
    @Test
    void testAddRegularOverwritesConst() {
        Table t = XY.addConst("k", "v").add("k", new int[]{ 1, 2, 3 });
        assertFalse(t.isConstant("k"));
        assertEquals(Optional.empty(), t.constant("k"));
    }
    
    @Test
    void testImmutability() {
        Table before = XY;
        List<String> columns = List.copyOf(before.columns());
        Column<?> x = before.column("x");
        before.add("z", new int[]{ 1, 2, 3 });
        before.addConst("x", 1);
        before.add("y", null);
        before.addTable(GroupID.ROOT.extend("a"), XY);
        assertEquals(columns, before.columns());
        assertSame(x, before.column("x"));
        assertEquals(3, before.size());
        assertThrows(UnsupportedOperationException.class, () -> before.columns().add("w"));
    }
    
    @Test
    void testUnmodifiedColumnsAreShared() {
        Table t = XY.add("z", new int[]{ 1, 2, 3 });
        assertSame(XY.column("x"), t.column("x"));
        assertSame(XY.column("y"), t.column("y"));
    }
    
    @Test
    void testRoundTripAddRemove() {
        Table t = XY.add("z", new int[]{ 1, 2, 3 }).add("z", null);
        assertEquals(XY, t);
        assertEquals(XY.columns(), t.columns());
        assertSame(Table.empty(), Table.empty().add("x", new int[]{ 1 }).add("x", null));
        assertSame(Table.empty(), Table.empty().addConst("c", 1).add("c", null));
    }
    
    @Test
    void testRemoveMissingColumnReturnsReceiver() {
        assertSame(XY, XY.add("nope", null));
        assertSame(XY, XY.addConst("nope", null));
    }
    
    @Test
    void testConstantExpansion() {
        Table t = XY.addConst("k", "v");
        Column<?> k = t.column("k");
        assertEquals(List.of("v", "v", "v"), k.toList());
        assertEquals(String.class, k.type());
        assertSame(k, t.column("k"));
        assertSame(k, t.mustColumn("k"));
    }
    
    @Test
    void testConcurrentConstantExpansion() throws Exception {
        int[] data = new int[1000];
        Table t = Table.empty().add("x", data).addConst("k", "v");
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        List<Callable<Column<?>>> reads = new ArrayList<>();
        for (int i = 0; i < threads * 4; i++)
            reads.add(() -> {
                start.await();
                return t.column("k");
            });
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Column<?>>> futures = new ArrayList<>();
            for (Callable<Column<?>> read : reads)
                futures.add(pool.submit(read));
            start.countDown();
            Column<?> first = futures.get(0).get();
            assertEquals(t.size(), first.size());
            for (Future<Column<?>> f : futures)
                assertSame(first, f.get());
            assertSame(first, t.column("k"));
        } finally {
            pool.shutdownNow();
        }
    }
    
    @Test
    void testConstantOnlyTableHasNoRows() {
        Table t = Table.empty().addConst("k", 1);
        assertEquals(0, t.size());
        assertFalse(t.isEmpty());
        assertEquals(0, t.column("k").size());
        Table t2 = t.add("x", new int[]{ 1, 2 });
        assertEquals(List.of(1, 1), t2.column("k").toList());
    }
    
    @Test
    void testRemovingLastRegularColumnResetsRowCount() {
        Table t = Table.empty().add("x", new int[]{ 1, 2 }).addConst("k", 1).add("x", null);
        assertEquals(0, t.size());
        assertEquals(3, t.add("y", new int[]{ 1, 2, 3 }).size());
    }
    
    @Test
    void testColumnLookup() {
        assertNull(XY.column("nope"));
        NoSuchElementException e = assertThrows(NoSuchElementException.class, () -> XY.mustColumn("nope"));
        assertEquals("unknown column \"nope\"", e.getMessage());
        assertEquals(Optional.empty(), XY.constant("x"));
        assertTrue(XY.hasColumn("x"));
        assertNull(XY.columnType("nope"));
    }
    
    @Test
    void testTypedMustColumn() {
        Column<? extends Number> x = XY.mustColumn("x", Number.class);
        assertEquals(3.0, x.get(0).doubleValue());
        assertThrows(ColumnTypeException.class, () -> XY.mustColumn("y", Number.class));
    }
    
    @Test
    void testTableAsGrouping() {
        assertEquals(List.of(GroupID.ROOT), XY.tables());
        assertSame(XY, XY.table(GroupID.ROOT));
        assertNull(XY.table(GroupID.ROOT.extend("a")));
        assertEquals(List.of("x", "y"), XY.columns());
    }
    
    @Test
    void testTableAddTable() {
        GroupID a = GroupID.ROOT.extend("a");
        Table other = Table.empty().add("x", new double[]{ 9.0 }).add("y", new String[]{ "z" });
        
        assertSame(Table.empty(), XY.addTable(GroupID.ROOT, null));
        assertSame(XY, XY.addTable(a, null));
        assertSame(XY, XY.addTable(a, Table.empty()));
        assertSame(other, XY.addTable(GroupID.ROOT, other));
        
        Grouping g = XY.addTable(a, other);
        assertEquals(List.of(GroupID.ROOT, a), g.tables());
        assertSame(XY, g.table(GroupID.ROOT));
        assertSame(other, g.table(a));
        
        Grouping single = Table.empty().addTable(a, other);
        assertEquals(List.of(a), single.tables());
    }
    
    @Test
    void testEqualsIgnoresColumnOrder() {
        Table yx = Table.empty()
            .add("y", new String[]{ "c", "a", "b" })
            .add("x", new double[]{ 3.0, 1.0, 2.0 });
        assertEquals(XY, yx);
        assertEquals(XY.hashCode(), yx.hashCode());
        assertNotEquals(XY, XY.addConst("k", 1));
    }
    
    @Test
    void testToString() {
        Table t = Table.empty().add("x", new int[]{ 1, 2 }).addConst("k", "v");
        assertEquals("Table[\n\t[x, k],\n\t[1, v],\n\t[2, v]\n]", t.toString());
    }
    
    @Test
    void testCollector() {
        Table t = Stream.of("apple", "fig", "banana")
            .collect(Table.collector(into -> into
                .column("word", String.class, s -> s)
                .column("length", Integer.class, String::length)
                .column("word", String.class, String::toUpperCase)
            ));
        assertEquals(List.of("word", "length"), t.columns());
        assertEquals(List.of("APPLE", "FIG", "BANANA"), t.column("word").toList());
        assertEquals(Column.ofInts(5, 3, 6), t.column("length"));
        assertEquals(3, t.size());
    }
    
    @Test
    void testCollectorOfNothing() {
        Table noRows = Stream.<String>empty().collect(Table.collector(into -> into.column("w", String.class, s -> s)));
        assertEquals(0, noRows.size());
        assertEquals(Set.of("w"), Set.copyOf(noRows.columns()));
        assertSame(Table.empty(), Stream.of(1).collect(Table.collector(into -> {})));
    }
}
