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
import io.avery.tabula.Groupings;
import io.avery.tabula.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A kernel density estimate of a column of samples, computed per group.
 *
 * <p>Applying a density to a grouping yields a grouping with the same groups, each holding a table of two columns:
 *
 * <ul>
 *     <li>the samples column (as named by {@link DensityAPI#samples}), holding evenly spaced points at which the
 *     estimate is sampled</li>
 *     <li>{@value #PROBABILITY_DENSITY} holding the estimate at each point, or {@value #CUMULATIVE_DENSITY} if the
 *     density is {@link DensityAPI#cumulative() cumulative}</li>
 * </ul>
 *
 * <p>Groups whose samples have no weight yield zero-row columns.
 */
public final class Density {
    private static final Logger LOG = LoggerFactory.getLogger(Density.class);
    
    /**
     * The name of the output column of a probability density estimate.
     */
    public static final String PROBABILITY_DENSITY = "probability density";
    
    /**
     * The name of the output column of a cumulative density estimate.
     */
    public static final String CUMULATIVE_DENSITY = "cumulative density";
    
    private final String x;
    private final String w;
    private final int n;
    private final double widen;
    private final boolean splitGroups;
    private final boolean cumulative;
    private final Kernel kernel;
    private final double bandwidth;
    private final double boundaryMin;
    private final double boundaryMax;
    
    private Density(DensityAPI config) {
        if (config.x == null)
            throw new IllegalStateException("density requires a samples column");
        this.x = config.x;
        this.w = config.w;
        this.n = config.n;
        this.widen = config.widen;
        this.splitGroups = config.splitGroups;
        this.cumulative = config.cumulative;
        this.kernel = config.kernel;
        this.bandwidth = config.bandwidth;
        this.boundaryMin = config.boundaryMin;
        this.boundaryMax = config.boundaryMax;
    }
    
    /**
     * Returns a density estimate configured by the given configurator consumer.
     *
     * @param config a consumer that configures the estimate
     * @return a density estimate
     * @throws IllegalStateException if the configurator does not set a samples column
     */
    public static Density of(Consumer<DensityAPI> config) {
        DensityAPI api = new DensityAPI();
        config.accept(api);
        return new Density(api);
    }
    
    /**
     * Returns the name of the output column holding the estimate.
     *
     * @return the name of the estimate column
     */
    public String responseColumn() {
        return cumulative ? CUMULATIVE_DENSITY : PROBABILITY_DENSITY;
    }
    
    /**
     * Computes the estimate for each group of the given grouping.
     *
     * @param g the grouping
     * @return a grouping of the estimates, with the same groups as the given grouping
     * @throws java.util.NoSuchElementException if a group lacks the samples or weights column
     * @throws io.avery.tabula.ColumnTypeException if the samples or weights column is not numeric
     */
    public Grouping apply(Grouping g) {
        String resp = responseColumn();
        
        // Gather samples.
        Map<GroupID, double[]> samples = new HashMap<>();
        Map<GroupID, double[]> weights = new HashMap<>();
        for (GroupID gid : g.tables()) {
            Table t = g.table(gid);
            samples.put(gid, t.mustColumn(x).toDoubleArray());
            if (w != null)
                weights.put(gid, t.mustColumn(w).toDoubleArray());
        }
        
        double[] combined = { Double.NaN, Double.NaN };
        if (!splitGroups) {
            for (GroupID gid : g.tables()) {
                double[] xs = samples.get(gid);
                double[] ws = weights.get(gid);
                if (xs.length == 0 || KernelDensity.weight(xs, ws) == 0)
                    continue;
                double[] b = widened(xs, ws);
                if (b[0] < combined[0] || Double.isNaN(combined[0]))
                    combined[0] = b[0];
                if (b[1] > combined[1] || Double.isNaN(combined[1]))
                    combined[1] = b[1];
            }
            LOG.debug("Combined density bounds for {}: [{}, {}]", x, combined[0], combined[1]);
        }
        
        return Groupings.mapTables(g, (gid, t) -> {
            double[] xs = samples.get(gid);
            double[] ws = weights.get(gid);
            if (KernelDensity.weight(xs, ws) == 0)
                return Table.empty().add(x, Column.ofDoubles()).add(resp, Column.ofDoubles());
            
            double h = bandwidthFor(xs, ws);
            KernelDensity kde = new KernelDensity(xs, ws, kernel, h, boundaryMin, boundaryMax);
            double[] b = splitGroups ? widened(xs, ws) : combined;
            
            double[] ss = linspace(b[0], b[1], n);
            double[] ys = new double[ss.length];
            for (int i = 0; i < ss.length; i++)
                ys[i] = cumulative ? kde.cdf(ss[i]) : kde.pdf(ss[i]);
            return Table.empty().add(x, Column.ofDoubles(ss)).add(resp, Column.ofDoubles(ys));
        });
    }
    
    private double bandwidthFor(double[] xs, double[] ws) {
        return bandwidth != 0 ? bandwidth : KernelDensity.scottBandwidth(xs, ws);
    }
    
    /**
     * Range of the samples, widened on each side by {@code widen} bandwidths unless {@code widen} is negative.
     */
    private double[] widened(double[] xs, double[] ws) {
        double[] b = KernelDensity.bounds(xs);
        if (widen < 0)
            return b;
        double h = bandwidthFor(xs, ws);
        return new double[]{ b[0] - widen * h, b[1] + widen * h };
    }
    
    /**
     * Returns {@code n} evenly spaced points from {@code lo} to {@code hi}, inclusive.
     */
    static double[] linspace(double lo, double hi, int n) {
        double[] out = new double[n];
        if (n == 1) {
            out[0] = lo;
            return out;
        }
        for (int i = 0; i < n; i++)
            out[i] = lo + (hi - lo) * i / (n - 1);
        return out;
    }
}
