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

import java.util.Arrays;
import java.util.Comparator;

/**
 * A weighted kernel density estimate over a set of samples, with optional bounded support. Probability mass that a
 * kernel places outside the support is reflected back into it.
 */
final class KernelDensity {
    private static final double SQRT2 = Math.sqrt(2);
    private static final double INV_SQRT_2PI = 1 / Math.sqrt(2 * Math.PI);
    
    private final double[] xs;
    private final double[] weights;
    private final double totalWeight;
    private final Kernel kernel;
    private final double bandwidth;
    private final double min;
    private final double max;
    
    /**
     * @param xs the samples
     * @param weights the sample weights, or {@code null} to weight samples uniformly
     * @param kernel the kernel
     * @param bandwidth the kernel bandwidth
     * @param min the inclusive lower bound of the support, possibly negative infinity
     * @param max the exclusive upper bound of the support, possibly positive infinity
     */
    KernelDensity(double[] xs, double[] weights, Kernel kernel, double bandwidth, double min, double max) {
        if (weights != null && weights.length != xs.length)
            throw new IllegalArgumentException(
                "got " + weights.length + " weights for " + xs.length + " samples");
        this.xs = xs;
        this.weights = weights;
        this.totalWeight = weight(xs, weights);
        this.kernel = kernel;
        this.bandwidth = bandwidth;
        this.min = min;
        this.max = max;
    }
    
    /**
     * Returns the total weight of the samples: the sum of the weights, or the number of samples if unweighted.
     */
    static double weight(double[] xs, double[] weights) {
        if (weights == null)
            return xs.length;
        double sum = 0;
        for (double w : weights)
            sum += w;
        return sum;
    }
    
    /**
     * Returns {@code {min, max}} of the samples, or {@code {NaN, NaN}} if there are none.
     */
    static double[] bounds(double[] xs) {
        if (xs.length == 0)
            return new double[]{ Double.NaN, Double.NaN };
        double lo = xs[0];
        double hi = xs[0];
        for (double x : xs) {
            lo = Math.min(lo, x);
            hi = Math.max(hi, x);
        }
        return new double[]{ lo, hi };
    }
    
    /**
     * Scott's rule of thumb: {@code 1.06 * min(stddev, IQR / 1.349) * weight^(-1/5)}. A zero interquartile range
     * leaves the standard deviation as the scale. Falls back to 1 when the samples have no spread (fewer than two
     * samples, or all samples equal).
     */
    static double scottBandwidth(double[] xs, double[] weights) {
        double total = weight(xs, weights);
        double mean = 0;
        for (int i = 0; i < xs.length; i++)
            mean += w(weights, i) * xs[i];
        mean /= total;
        double ss = 0;
        for (int i = 0; i < xs.length; i++) {
            double d = xs[i] - mean;
            ss += w(weights, i) * d * d;
        }
        double scale = Math.sqrt(ss / (total - 1));
        double iqr = quantile(xs, weights, 0.75) - quantile(xs, weights, 0.25);
        if (iqr > 0)
            scale = Math.min(scale, iqr / 1.349);
        double h = 1.06 * scale * Math.pow(total, -1.0 / 5);
        if (!(h > 0) || Double.isInfinite(h))
            return 1;
        return h;
    }
    
    /**
     * Returns the {@code q}-quantile of the samples, interpolating linearly between order statistics, or {@code NaN}
     * if no sample has positive weight. In ascending order, a sample sits at the weight of the samples before it
     * divided by the total weight less that of the largest sample. With unit weights this is {@code k / (n - 1)}.
     */
    static double quantile(double[] xs, double[] weights, double q) {
        Integer[] order = new Integer[xs.length];
        int n = 0;
        for (int i = 0; i < xs.length; i++)
            if (w(weights, i) > 0)
                order[n++] = i;
        if (n == 0)
            return Double.NaN;
        Arrays.sort(order, 0, n, Comparator.comparingDouble(i -> xs[i]));
        double total = 0;
        for (int k = 0; k < n; k++)
            total += w(weights, order[k]);
        double target = Math.min(1, Math.max(0, q)) * (total - w(weights, order[n - 1]));
        double before = 0;
        for (int k = 0; k < n - 1; k++) {
            double wk = w(weights, order[k]);
            if (target <= before + wk) {
                double lo = xs[order[k]];
                return lo + (target - before) / wk * (xs[order[k + 1]] - lo);
            }
            before += wk;
        }
        return xs[order[n - 1]];
    }
    
    private static double w(double[] weights, int i) {
        return weights == null ? 1 : weights[i];
    }
    
    double pdf(double x) {
        if (x < min || x >= max)
            return 0;
        double sum = 0;
        switch (kernel) {
            case DELTA:
                for (double xi : xs)
                    if (xi == x)
                        return Double.POSITIVE_INFINITY;
                return 0;
            case GAUSSIAN:
                for (int i = 0; i < xs.length; i++) {
                    double xi = xs[i];
                    double p = phi((x - xi) / bandwidth);
                    if (!Double.isInfinite(min))
                        p += phi((x - (2 * min - xi)) / bandwidth);
                    if (!Double.isInfinite(max))
                        p += phi((x - (2 * max - xi)) / bandwidth);
                    sum += w(weights, i) * p;
                }
                return sum / bandwidth / totalWeight;
            default:
                throw new AssertionError(kernel);
        }
    }
    
    double cdf(double x) {
        if (x < min)
            return 0;
        if (x >= max)
            return 1;
        double sum = 0;
        switch (kernel) {
            case DELTA:
                for (int i = 0; i < xs.length; i++)
                    if (xs[i] <= x)
                        sum += w(weights, i);
                return sum / totalWeight;
            case GAUSSIAN:
                for (int i = 0; i < xs.length; i++) {
                    double xi = xs[i];
                    double p = mass(xi, x);
                    if (!Double.isInfinite(min))
                        p += mass(2 * min - xi, x);
                    if (!Double.isInfinite(max))
                        p += mass(2 * max - xi, x);
                    sum += w(weights, i) * p;
                }
                return Math.min(1, Math.max(0, sum / totalWeight));
            default:
                throw new AssertionError(kernel);
        }
    }
    
    /**
     * The mass a kernel centered at {@code center} places on {@code [min, x]}.
     */
    private double mass(double center, double x) {
        double lo = Double.isInfinite(min) ? 0 : normalCdf((min - center) / bandwidth);
        return normalCdf((x - center) / bandwidth) - lo;
    }
    
    private static double phi(double z) {
        return INV_SQRT_2PI * Math.exp(-0.5 * z * z);
    }
    
    private static double normalCdf(double z) {
        return 0.5 * erfc(-z / SQRT2);
    }
    
    /**
     * Complementary error function, by Chebyshev approximation (fractional error below 1.2e-7).
     */
    static double erfc(double x) {
        double z = Math.abs(x);
        double t = 1 / (1 + 0.5 * z);
        double ans = t * Math.exp(-z * z - 1.26551223 + t * (1.00002368 + t * (0.37409196 + t * (0.09678418
            + t * (-0.18628806 + t * (0.27886807 + t * (-1.13520398 + t * (1.48851587
            + t * (-0.82215223 + t * 0.17087277)))))))));
        return x >= 0 ? ans : 2 - ans;
    }
}
