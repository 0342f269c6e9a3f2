/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.math;

/**
 * Division that maps an exactly-zero divisor to a zero result instead of NaN or Infinity.
 *
 * <p>Every normalized sensitivity or weight in the combination kernels goes through here,
 * so locations without any coil signal stay exactly zero in both SOS and combined output.</p>
 */
public final class SafeDivision {

    private SafeDivision() {}

    public static double div0(double a, double b) {
        return b == 0.0 ? 0.0 : a / b;
    }

    /**
     * In-place {@code values[i] = div0(values[i], divisor)}. Intended for arrays the caller
     * allocated itself.
     */
    public static void div0InPlace(double[] values, double divisor) {
        for (int i = 0; i < values.length; i++) {
            values[i] = div0(values[i], divisor);
        }
    }
}
