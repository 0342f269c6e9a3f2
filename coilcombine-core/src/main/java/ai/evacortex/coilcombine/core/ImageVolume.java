/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core;

import ai.evacortex.coilcombine.core.exceptions.DimensionException;

import java.util.Arrays;
import java.util.Objects;

/**
 * Multi-coil, multi-echo complex image data with axes {@code (spatial..., coil, echo)}.
 * The spatial part may have any rank, including zero. Construction fails with
 * {@link DimensionException} when the coil or echo axis is missing or empty.
 */
public record ImageVolume(ComplexArray data) {

    public ImageVolume {
        Objects.requireNonNull(data, "data must not be null");
        int rank = data.rank();
        if (rank < 2) {
            throw new DimensionException("image volume needs trailing (coil, echo) axes, got shape "
                    + Arrays.toString(data.shape()));
        }
        if (data.dim(rank - 2) < 1) {
            throw new DimensionException("at least one coil required, got shape " + Arrays.toString(data.shape()));
        }
        if (data.dim(rank - 1) < 1) {
            throw new DimensionException("at least one echo required, got shape " + Arrays.toString(data.shape()));
        }
    }

    public int[] spatialShape() {
        return Arrays.copyOf(data.shape(), data.rank() - 2);
    }

    public int spatialSize() {
        return Shapes.size(spatialShape());
    }

    public int coils() {
        return data.dim(data.rank() - 2);
    }

    public int echoes() {
        return data.dim(data.rank() - 1);
    }
}
