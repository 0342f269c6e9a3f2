/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable n-dimensional real array in column-major order. Same copy/ownership rules as
 * {@link ComplexArray}.
 */
public final class RealArray {

    private final int[] shape;
    private final double[] values;

    private RealArray(int[] shape, double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        int size = Shapes.size(shape);
        if (values.length != size) {
            throw new IllegalArgumentException("Length " + values.length
                    + " does not match shape " + Arrays.toString(shape) + " (" + size + " elements)");
        }
        this.shape = shape;
        this.values = values;
    }

    public static RealArray of(int[] shape, double[] values) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(values, "values must not be null");
        return new RealArray(shape.clone(), values.clone());
    }

    public static RealArray wrap(int[] shape, double[] values) {
        Objects.requireNonNull(shape, "shape must not be null");
        return new RealArray(shape.clone(), values);
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int size() {
        return values.length;
    }

    public double getFlat(int flatIndex) {
        return values[flatIndex];
    }

    public double get(int... index) {
        return values[Shapes.offset(shape, index)];
    }

    public double[] values() {
        return values.clone();
    }

    /** Largest element; {@code 0} for an empty array. */
    public double max() {
        double max = values.length == 0 ? 0.0 : Double.NEGATIVE_INFINITY;
        for (double v : values) {
            if (v > max) max = v;
        }
        return max;
    }

    /** Smallest element; {@code 0} for an empty array. */
    public double min() {
        double min = values.length == 0 ? 0.0 : Double.POSITIVE_INFINITY;
        for (double v : values) {
            if (v < min) min = v;
        }
        return min;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RealArray)) return false;
        RealArray other = (RealArray) obj;
        return Arrays.equals(shape, other.shape) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "RealArray" + Arrays.toString(shape);
    }
}
