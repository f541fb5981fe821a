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

import java.util.Objects;

/**
 * A configurator used to define a {@link Density} estimate. Only {@link #samples(String)} is required; every other
 * setting has a default.
 *
 * @see Density#of
 */
public class DensityAPI {
    String x;
    String w;
    int n = 200;
    double widen = 3;
    boolean splitGroups = false;
    boolean cumulative = false;
    Kernel kernel = Kernel.GAUSSIAN;
    double bandwidth = 0;
    double boundaryMin = Double.NEGATIVE_INFINITY;
    double boundaryMax = Double.POSITIVE_INFINITY;
    
    DensityAPI() {} // Prevent default public constructor
    
    /**
     * Sets the name of the column of samples. The column must be numeric. This is also the name of the output column
     * of sample points.
     *
     * @param column the name of the sample column
     * @return this configurator
     */
    public DensityAPI samples(String column) {
        this.x = Objects.requireNonNull(column);
        return this;
    }
    
    /**
     * Sets the name of a numeric column of sample weights. By default samples are weighted uniformly.
     *
     * @param column the name of the weight column
     * @return this configurator
     */
    public DensityAPI weights(String column) {
        this.w = Objects.requireNonNull(column);
        return this;
    }
    
    /**
     * Sets the number of points at which to sample the estimate. Defaults to 200.
     *
     * @param n the number of points
     * @return this configurator
     */
    public DensityAPI points(int n) {
        if (n < 1)
            throw new IllegalArgumentException("points must be positive: " + n);
        this.n = n;
        return this;
    }
    
    /**
     * Sets how far past the range of the data the estimate extends, in multiples of the bandwidth. A negative value
     * limits the estimate to the range of the data. Defaults to 3.
     *
     * @param widen the widening factor
     * @return this configurator
     */
    public DensityAPI widen(double widen) {
        this.widen = widen;
        return this;
    }
    
    /**
     * Bounds each group's estimate by the data in that group alone. By default the estimate of every group spans the
     * bounds of all the data combined, which makes estimates comparable (and stackable) across groups.
     *
     * @return this configurator
     */
    public DensityAPI splitGroups() {
        this.splitGroups = true;
        return this;
    }
    
    /**
     * Produces a cumulative density estimate rather than a probability density estimate.
     *
     * @return this configurator
     */
    public DensityAPI cumulative() {
        this.cumulative = true;
        return this;
    }
    
    /**
     * Sets the kernel. Defaults to {@link Kernel#GAUSSIAN}.
     *
     * @param kernel the kernel
     * @return this configurator
     */
    public DensityAPI kernel(Kernel kernel) {
        this.kernel = Objects.requireNonNull(kernel);
        return this;
    }
    
    /**
     * Sets the kernel bandwidth. By default the bandwidth is computed from each group's samples by Scott's rule.
     *
     * @param bandwidth the bandwidth
     * @return this configurator
     */
    public DensityAPI bandwidth(double bandwidth) {
        if (!(bandwidth > 0) || Double.isInfinite(bandwidth))
            throw new IllegalArgumentException("bandwidth must be positive and finite: " + bandwidth);
        this.bandwidth = bandwidth;
        return this;
    }
    
    /**
     * Bounds the support of the estimate to {@code [min, max)}. Kernel mass falling outside the support is reflected
     * back into it. Either bound may be infinite for a half-bounded support. By default the support is unbounded.
     *
     * @param min the inclusive lower bound
     * @param max the exclusive upper bound
     * @return this configurator
     */
    public DensityAPI bounds(double min, double max) {
        if (!(min < max))
            throw new IllegalArgumentException("empty support [" + min + ", " + max + ")");
        this.boundaryMin = min;
        this.boundaryMax = max;
        return this;
    }
}
