/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.engine;

import ai.evacortex.coilcombine.core.CoilCombination;
import ai.evacortex.coilcombine.core.ComplexArray;
import ai.evacortex.coilcombine.core.ImageVolume;
import ai.evacortex.coilcombine.core.RealArray;
import ai.evacortex.coilcombine.core.SensitivityMap;
import ai.evacortex.coilcombine.core.Shapes;
import ai.evacortex.coilcombine.core.exceptions.ShapeMismatchException;
import ai.evacortex.coilcombine.core.math.SafeDivision;

import java.util.Arrays;
import java.util.Objects;

/**
 * Validation, output allocation and SOS normalization common to all kernels. Subclasses decide
 * only how the spatial index range is scheduled.
 */
abstract class AbstractCombineKernel implements CombineKernel {

    /**
     * Runs {@code op} over {@code [0, size)}, possibly split into disjoint sub-ranges.
     * Must return only after every sub-range has completed.
     */
    protected abstract void forEachRange(int size, CombineLoops.RangeOp op);

    @Override
    public CoilCombination weightedCombine(ImageVolume ydata, SensitivityMap smap) {
        Objects.requireNonNull(ydata, "ydata must not be null");
        Objects.requireNonNull(smap, "smap must not be null");
        requireMatchingShape(ydata, smap);

        int[] spatial = ydata.spatialShape();
        int nS = Shapes.size(spatial);
        int nc = ydata.coils();
        int ne = ydata.echoes();
        ComplexArray y = ydata.data();
        ComplexArray sens = smap.data();

        double[] zRe = new double[nS * ne];
        double[] zIm = new double[nS * ne];
        double[] sos = new double[nS];

        forEachRange(nS, (from, to) -> CombineLoops.weighted(y, sens, nS, nc, ne, zRe, zIm, sos, from, to));

        return new CoilCombination(
                ComplexArray.wrap(Shapes.append(spatial, ne), zRe, zIm),
                RealArray.wrap(spatial, sos));
    }

    @Override
    public CoilCombination selfWeightedCombine(ImageVolume ydata) {
        Objects.requireNonNull(ydata, "ydata must not be null");

        int[] spatial = ydata.spatialShape();
        int nS = Shapes.size(spatial);
        int nc = ydata.coils();
        int ne = ydata.echoes();
        ComplexArray y = ydata.data();

        double[] zRe = new double[nS * ne];
        double[] zIm = new double[nS * ne];
        double[] sos = new double[nS];

        forEachRange(nS, (from, to) -> CombineLoops.selfWeighted(y, nS, nc, ne, zRe, zIm, sos, from, to));

        double max = 0.0;
        for (double v : sos) {
            if (v > max) max = v;
        }
        SafeDivision.div0InPlace(sos, max);

        return new CoilCombination(
                ComplexArray.wrap(Shapes.append(spatial, ne), zRe, zIm),
                RealArray.wrap(spatial, sos));
    }

    /**
     * @throws ShapeMismatchException if {@code smap} is not shaped {@code (spatial..., nc)}
     */
    static void requireMatchingShape(ImageVolume ydata, SensitivityMap smap) {
        int[] expected = Shapes.append(ydata.spatialShape(), ydata.coils());
        int[] actual = smap.shape();
        if (!Arrays.equals(actual, expected)) {
            throw new ShapeMismatchException("smap size", actual, expected);
        }
    }
}
