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

package io.avery.tabula.stat;

import io.avery.tabula.Column;
import io.avery.tabula.GroupID;
import io.avery.tabula.Grouping;
import io.avery.tabula.Table;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class DensityTest {
    private static final GroupID A = GroupID.ROOT.extend("a");
    private static final GroupID B = GroupID.ROOT.extend("b");
    
    private static final Table SAMPLES = Table.empty().add("x", new double[]{ -1, 0, 0.5, 1, 2 });
    
    private static double integrate(double[] xs, double[] ys) {
        double sum = 0;
        for (int i = 1; i < xs.length; i++)
            sum += (xs[i] - xs[i - 1]) * (ys[i] + ys[i - 1]) / 2;
        return sum;
    }
    
    @Test
    void testProbabilityDensityIntegratesToOne() {
        Table t = (Table) Density.of(d -> d.samples("x").points(2001).widen(6)).apply(SAMPLES);
        assertEquals(List.of("x", Density.PROBABILITY_DENSITY), t.columns());
        double[] xs = t.mustColumn("x").toDoubleArray();
        double[] ys = t.mustColumn(Density.PROBABILITY_DENSITY).toDoubleArray();
        assertEquals(2001, xs.length);
        assertEquals(1, integrate(xs, ys), 1e-3);
    }
    
    @Test
    void testCumulativeDensity() {
        Density density = Density.of(d -> d.samples("x").cumulative().widen(6));
        assertEquals(Density.CUMULATIVE_DENSITY, density.responseColumn());
        Table t = (Table) density.apply(SAMPLES);
        double[] ys = t.mustColumn(Density.CUMULATIVE_DENSITY).toDoubleArray();
        assertEquals(200, ys.length);
        assertEquals(0, ys[0], 1e-3);
        assertEquals(1, ys[ys.length - 1], 1e-3);
        for (int i = 1; i < ys.length; i++)
            assertTrue(ys[i] >= ys[i - 1] - 1e-12);
    }
    
    @Test
    void testFixedBandwidthBounds() {
        Table samples = Table.empty().add("x", new double[]{ 0, 1 });
        Table t = (Table) Density.of(d -> d.samples("x").bandwidth(0.5).points(5)).apply(samples);
        assertEquals(Column.ofDoubles(-1.5, -0.5, 0.5, 1.5, 2.5), t.column("x"));
        
        Table narrow = (Table) Density.of(d -> d.samples("x").bandwidth(0.5).points(3).widen(-1)).apply(samples);
        assertEquals(Column.ofDoubles(0, 0.5, 1), narrow.column("x"));
    }
    
    @Test
    void testGroupsShareBoundsByDefault() {
        Grouping g = Table.empty()
            .addTable(A, Table.empty().add("x", new double[]{ 0, 1 }))
            .addTable(B, Table.empty().add("x", new double[]{ 10, 11 }));
        Grouping shared = Density.of(d -> d.samples("x").bandwidth(1)).apply(g);
        assertEquals(List.of(A, B), shared.tables());
        assertEquals(shared.table(A).column("x"), shared.table(B).column("x"));
        assertEquals(-3, shared.table(A).column("x").toDoubleArray()[0], 1e-9);
        assertEquals(14, shared.table(B).column("x").toDoubleArray()[199], 1e-9);
        
        Grouping split = Density.of(d -> d.samples("x").bandwidth(1).splitGroups()).apply(g);
        assertEquals(-3, split.table(A).column("x").toDoubleArray()[0], 1e-9);
        assertEquals(7, split.table(B).column("x").toDoubleArray()[0], 1e-9);
    }
    
    @Test
    void testZeroWeightGroup() {
        Grouping g = Table.empty()
            .addTable(A, Table.empty().add("x", new double[]{ 0, 1 }).add("w", new double[]{ 1, 1 }))
            .addTable(B, Table.empty().add("x", new double[]{ 5 }).add("w", new double[]{ 0 }));
        Grouping out = Density.of(d -> d.samples("x").weights("w")).apply(g);
        assertEquals(200, out.table(A).size());
        assertEquals(0, out.table(B).size());
        assertFalse(out.table(B).isEmpty());
    }
    
    @Test
    void testWeightsShiftTheEstimate() {
        Table t = Table.empty().add("x", new double[]{ 0, 1 }).add("w", new double[]{ 3, 1 });
        Table out = (Table) Density.of(d -> d.samples("x").weights("w").bandwidth(0.25).points(3).widen(-1)).apply(t);
        double[] ys = out.mustColumn(Density.PROBABILITY_DENSITY).toDoubleArray();
        assertTrue(ys[0] > ys[2]);
    }
    
    @Test
    void testBoundedSupportKeepsMass() {
        Table t = Table.empty().add("x", new double[]{ 0.1, 0.2, 0.4, 1.0 });
        Table out = (Table) Density.of(d -> d
            .samples("x")
            .bounds(0, Double.POSITIVE_INFINITY)
            .points(4001)
            .widen(8)
        ).apply(t);
        double[] xs = out.mustColumn("x").toDoubleArray();
        double[] ys = out.mustColumn(Density.PROBABILITY_DENSITY).toDoubleArray();
        for (int i = 0; i < xs.length; i++)
            if (xs[i] < 0)
                assertEquals(0, ys[i]);
        assertEquals(1, integrate(xs, ys), 5e-3);
    }
    
    @Test
    void testDeltaKernelCumulative() {
        Table t = Table.empty().add("x", new double[]{ 0, 1 });
        Table out = (Table) Density.of(d -> d
            .samples("x")
            .kernel(Kernel.DELTA)
            .cumulative()
            .widen(-1)
            .points(3)
        ).apply(t);
        assertEquals(Column.ofDoubles(0.5, 0.5, 1), out.column(Density.CUMULATIVE_DENSITY));
    }
    
    @Test
    void testConfiguration() {
        assertThrows(IllegalStateException.class, () -> Density.of(d -> d.points(10)));
        assertThrows(IllegalArgumentException.class, () -> Density.of(d -> d.samples("x").points(0)));
        assertThrows(IllegalArgumentException.class, () -> Density.of(d -> d.samples("x").bandwidth(0)));
        assertThrows(IllegalArgumentException.class, () -> Density.of(d -> d.samples("x").bounds(1, 1)));
    }
    
    @Test
    void testMissingOrNonNumericColumn() {
        assertThrows(NoSuchElementException.class, () -> Density.of(d -> d.samples("nope")).apply(SAMPLES));
        Table strings = Table.empty().add("x", new String[]{ "a" });
        assertThrows(io.avery.tabula.ColumnTypeException.class, () -> Density.of(d -> d.samples("x")).apply(strings));
    }
    
    @Test
    void testEmptyGrouping() {
        assertSame(Table.empty(), Density.of(d -> d.samples("x")).apply(Table.empty()));
    }
    
    @Test
    void testKernelDensityHelpers() {
        assertEquals(1, KernelDensity.erfc(0), 1e-7);
        assertEquals(2, KernelDensity.erfc(-10), 1e-7);
        assertEquals(0.157299207, KernelDensity.erfc(1), 1e-6);
        assertEquals(1.139017, KernelDensity.scottBandwidth(new double[]{ 1, 2, 3, 4, 5 }, null), 1e-5);
        assertEquals(1, KernelDensity.scottBandwidth(new double[]{ 4 }, null));
        assertArrayEquals(new double[]{ 0, 0.25, 0.5, 0.75, 1 }, Density.linspace(0, 1, 5), 1e-12);
    }
    
    @Test
    void testQuantile() {
        double[] xs = { 4, 0, 1000, 2, 1, 3 };
        assertEquals(1.25, KernelDensity.quantile(xs, null, 0.25), 1e-12);
        assertEquals(3.75, KernelDensity.quantile(xs, null, 0.75), 1e-12);
        assertEquals(0, KernelDensity.quantile(xs, null, 0), 1e-12);
        assertEquals(1000, KernelDensity.quantile(xs, null, 1), 1e-12);
        
        // Zero weights drop samples.
        double[] ws = { 1, 1, 0, 1, 1, 1 };
        assertEquals(1, KernelDensity.quantile(xs, ws, 0.25), 1e-12);
        assertEquals(3, KernelDensity.quantile(xs, ws, 0.75), 1e-12);
        assertEquals(0.5, KernelDensity.quantile(new double[]{ 0, 1 }, new double[]{ 3, 1 }, 0.5), 1e-12);
        assertEquals(Double.NaN, KernelDensity.quantile(xs, new double[6], 0.5));
    }
    
    @Test
    void testScottBandwidthResistsOutliers() {
        double h = KernelDensity.scottBandwidth(new double[]{ 0, 1, 2, 3, 4, 1000 }, null);
        assertEquals(1.372789, h, 1e-4);
        
        Table t = Table.empty().add("x", new double[]{ 0, 1, 2, 3, 4, 1000 });
        Table out = (Table) Density.of(d -> d.samples("x").widen(3)).apply(t);
        double[] xs = out.mustColumn("x").toDoubleArray();
        assertEquals(-3 * h, xs[0], 1e-9);
        assertEquals(1000 + 3 * h, xs[xs.length - 1], 1e-9);
    }
}
