/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core;

/**
 * Output of a coil combination.
 *
 * @param combined complex combined image, axes {@code (spatial..., echo)}
 * @param sos      non-negative sum-of-squares weight map, axes {@code (spatial...)}
 */
public record CoilCombination(ComplexArray combined, RealArray sos) {
}
