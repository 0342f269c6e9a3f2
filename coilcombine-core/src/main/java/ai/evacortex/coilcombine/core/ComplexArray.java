/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core;

import ai.evacortex.coilcombine.core.math.Complex;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable n-dimensional complex array in column-major order (first axis varies fastest),
 * stored as separate real and imaginary planes.
 *
 * <p>{@link #of(int[], double[], double[])} copies the caller's planes;
 * {@link #wrap(int[], double[], double[])} takes ownership and must only be handed arrays
 * that nobody else writes to afterwards.</p>
 */
public final class ComplexArray {

    private final int[] shape;
    private final double[] real;
    private final double[] imag;

    private ComplexArray(int[] shape, double[] real, double[] imag) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(real, "real must not be null");
        Objects.requireNonNull(imag, "imag must not be null");
        int size = Shapes.size(shape);
        if (real.length != size || imag.length != size) {
            throw new IllegalArgumentException("Plane lengths " + real.length + "/" + imag.length
                    + " do not match shape " + Arrays.toString(shape) + " (" + size + " elements)");
        }
        this.shape = shape;
        this.real = real;
        this.imag = imag;
    }

    public static ComplexArray of(int[] shape, double[] real, double[] imag) {
        Objects.requireNonNull(shape, "shape must not be null");
        Objects.requireNonNull(real, "real must not be null");
        Objects.requireNonNull(imag, "imag must not be null");
        return new ComplexArray(shape.clone(), real.clone(), imag.clone());
    }

    public static ComplexArray wrap(int[] shape, double[] real, double[] imag) {
        Objects.requireNonNull(shape, "shape must not be null");
        return new ComplexArray(shape.clone(), real, imag);
    }

    public static ComplexArray zeros(int... shape) {
        int size = Shapes.size(shape);
        return new ComplexArray(shape.clone(), new double[size], new double[size]);
    }

    /**
     * Builds an array from complex values given in column-major order.
     */
    public static ComplexArray fromValues(int[] shape, Complex... values) {
        double[] re = new double[values.length];
        double[] im = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            re[i] = values[i].real;
            im[i] = values[i].imag;
        }
        return new ComplexArray(shape.clone(), re, im);
    }

    public int[] shape() {
        return shape.clone();
    }

    public int rank() {
        return shape.length;
    }

    public int dim(int axis) {
        return shape[axis];
    }

    public int size() {
        return real.length;
    }

    public double realAt(int flatIndex) {
        return real[flatIndex];
    }

    public double imagAt(int flatIndex) {
        return imag[flatIndex];
    }

    public Complex get(int... index) {
        int i = Shapes.offset(shape, index);
        return new Complex(real[i], imag[i]);
    }

    public Complex getFlat(int flatIndex) {
        return new Complex(real[flatIndex], imag[flatIndex]);
    }

    public double[] realPlane() {
        return real.clone();
    }

    public double[] imagPlane() {
        return imag.clone();
    }

    public boolean allFinite() {
        for (int i = 0; i < real.length; i++) {
            if (!Double.isFinite(real[i]) || !Double.isFinite(imag[i])) return false;
        }
        return true;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComplexArray)) return false;
        ComplexArray other = (ComplexArray) obj;
        return Arrays.equals(shape, other.shape)
                && Arrays.equals(real, other.real)
                && Arrays.equals(imag, other.imag);
    }

    @Override
    public int hashCode() {
        int h = Arrays.hashCode(shape);
        h = 31 * h + Arrays.hashCode(real);
        return 31 * h + Arrays.hashCode(imag);
    }

    @Override
    public String toString() {
        return "ComplexArray" + Arrays.toString(shape);
    }
}
