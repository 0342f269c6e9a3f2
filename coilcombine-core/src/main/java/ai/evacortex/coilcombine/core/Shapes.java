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
 * Helpers for column-major array shapes.
 */
public final class Shapes {

    private Shapes() {}

    /**
     * Number of elements described by {@code shape}; {@code 1} for a rank-0 shape.
     *
     * @throws IllegalArgumentException if a dimension is negative or the product overflows an int
     */
    public static int size(int[] shape) {
        Objects.requireNonNull(shape, "shape must not be null");
        long n = 1;
        for (int d : shape) {
            if (d < 0) {
                throw new IllegalArgumentException("Negative dimension in shape " + Arrays.toString(shape));
            }
            n *= d;
            if (n > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Shape " + Arrays.toString(shape) + " exceeds array capacity");
            }
        }
        return (int) n;
    }

    /**
     * Flat column-major offset of {@code index} within {@code shape}.
     *
     * @throws IndexOutOfBoundsException if the rank differs or any component is out of range
     */
    public static int offset(int[] shape, int... index) {
        if (index.length != shape.length) {
            throw new IndexOutOfBoundsException("Index rank " + index.length + " != array rank " + shape.length);
        }
        int offset = 0;
        int stride = 1;
        for (int k = 0; k < shape.length; k++) {
            if (index[k] < 0 || index[k] >= shape[k]) {
                throw new IndexOutOfBoundsException("Index " + Arrays.toString(index)
                        + " out of bounds for shape " + Arrays.toString(shape));
            }
            offset += index[k] * stride;
            stride *= shape[k];
        }
        return offset;
    }

    /** {@code shape} with {@code extra} appended. */
    public static int[] append(int[] shape, int... extra) {
        int[] out = Arrays.copyOf(shape, shape.length + extra.length);
        System.arraycopy(extra, 0, out, shape.length, extra.length);
        return out;
    }
}
