/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.engine;

import ai.evacortex.coilcombine.core.ComplexArray;
import ai.evacortex.coilcombine.core.math.SafeDivision;

/**
 * Per-range inner loops shared by all kernels. Each call writes only the output slots of the
 * spatial locations in {@code [from, to)}, so disjoint ranges can run concurrently.
 *
 * <p>Layout is column-major: {@code y[s, c, e]} sits at {@code s + nS * (c + nc * e)},
 * {@code smap[s, c]} at {@code s + nS * c} and {@code z[s, e]} at {@code s + nS * e}.</p>
 */
final class CombineLoops {

    @FunctionalInterface
    interface RangeOp {
        void apply(int from, int to);
    }

    private CombineLoops() {}

    static void weighted(ComplexArray y, ComplexArray smap,
                         int nS, int nc, int ne,
                         double[] zRe, double[] zIm, double[] sos,
                         int from, int to) {
        double[] wRe = new double[nc];
        double[] wIm = new double[nc];

        for (int s = from; s < to; s++) {
            double energy = 0.0;
            for (int c = 0; c < nc; c++) {
                int i = s + nS * c;
                double re = smap.realAt(i);
                double im = smap.imagAt(i);
                energy += re * re + im * im;
            }
            sos[s] = energy;

            // weights from the rescaled norm stay finite where the raw energy under- or overflows
            double scale = largestComponent(smap, s, nS, nc);
            double norm = scaledEnergy(smap, s, nS, nc, scale) * scale;
            for (int c = 0; c < nc; c++) {
                int i = s + nS * c;
                wRe[c] = SafeDivision.div0(SafeDivision.div0(smap.realAt(i), scale), norm);
                wIm[c] = SafeDivision.div0(SafeDivision.div0(smap.imagAt(i), scale), norm);
            }
            reduce(y, wRe, wIm, nS, nc, ne, zRe, zIm, s);
        }
    }

    static void selfWeighted(ComplexArray y,
                             int nS, int nc, int ne,
                             double[] zRe, double[] zIm, double[] sos,
                             int from, int to) {
        double[] wRe = new double[nc];
        double[] wIm = new double[nc];

        for (int s = from; s < to; s++) {
            // first echo occupies offsets s + nS * c
            double scale = largestComponent(y, s, nS, nc);
            double scaledRss = Math.sqrt(scaledEnergy(y, s, nS, nc, scale));
            sos[s] = scale * scaledRss;

            for (int c = 0; c < nc; c++) {
                int i = s + nS * c;
                wRe[c] = SafeDivision.div0(SafeDivision.div0(y.realAt(i), scale), scaledRss);
                wIm[c] = SafeDivision.div0(SafeDivision.div0(y.imagAt(i), scale), scaledRss);
            }
            reduce(y, wRe, wIm, nS, nc, ne, zRe, zIm, s);
        }
    }

    // max over coils of |re| and |im| at location s; 0 only if every coil value is 0
    private static double largestComponent(ComplexArray a, int s, int nS, int nc) {
        double max = 0.0;
        for (int c = 0; c < nc; c++) {
            int i = s + nS * c;
            max = Math.max(max, Math.max(Math.abs(a.realAt(i)), Math.abs(a.imagAt(i))));
        }
        return max;
    }

    // Σ_c |a[s, c] / scale|², ascending c
    private static double scaledEnergy(ComplexArray a, int s, int nS, int nc, double scale) {
        double energy = 0.0;
        for (int c = 0; c < nc; c++) {
            int i = s + nS * c;
            double re = SafeDivision.div0(a.realAt(i), scale);
            double im = SafeDivision.div0(a.imagAt(i), scale);
            energy += re * re + im * im;
        }
        return energy;
    }

    // z[s, e] = Σ_c conj(w_c) · y[s, c, e], ascending c
    private static void reduce(ComplexArray y, double[] wRe, double[] wIm,
                               int nS, int nc, int ne,
                               double[] zRe, double[] zIm, int s) {
        for (int e = 0; e < ne; e++) {
            double accRe = 0.0;
            double accIm = 0.0;
            for (int c = 0; c < nc; c++) {
                int i = s + nS * (c + nc * e);
                double yr = y.realAt(i);
                double yi = y.imagAt(i);
                accRe += wRe[c] * yr + wIm[c] * yi;
                accIm += wRe[c] * yi - wIm[c] * yr;
            }
            zRe[s + nS * e] = accRe;
            zIm[s + nS * e] = accIm;
        }
    }
}
