/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.exceptions;

import java.util.Arrays;

/**
 * Raised when a sensitivity map does not have the shape {@code (spatial..., nc)} implied by the
 * image volume it is combined with. Carries both shapes for diagnostics.
 */
public class ShapeMismatchException extends RuntimeException {

    private final int[] actualShape;
    private final int[] expectedShape;

    public ShapeMismatchException(String what, int[] actualShape, int[] expectedShape) {
        super("Shape mismatch: " + what + " " + Arrays.toString(actualShape)
                + " != " + Arrays.toString(expectedShape));
        this.actualShape = actualShape.clone();
        this.expectedShape = expectedShape.clone();
    }

    public int[] actualShape() {
        return actualShape.clone();
    }

    public int[] expectedShape() {
        return expectedShape.clone();
    }
}
