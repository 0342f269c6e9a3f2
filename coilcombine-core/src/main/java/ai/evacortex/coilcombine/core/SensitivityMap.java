/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core;

import java.util.Objects;

/**
 * Complex receive sensitivity per coil, axes {@code (spatial..., coil)}. The shape is checked
 * against the {@link ImageVolume} it is combined with, not on construction.
 */
public record SensitivityMap(ComplexArray data) {

    public SensitivityMap {
        Objects.requireNonNull(data, "data must not be null");
    }

    public int[] shape() {
        return data.shape();
    }
}
