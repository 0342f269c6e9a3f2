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
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ImageVolumeTest {

    @Test
    void trailingAxes_areCoilAndEcho() {
        ImageVolume v = new ImageVolume(ComplexArray.zeros(5, 4, 3, 2));
        assertArrayEquals(new int[]{5, 4}, v.spatialShape());
        assertEquals(20, v.spatialSize());
        assertEquals(3, v.coils());
        assertEquals(2, v.echoes());
    }

    @Test
    void rankTwo_hasScalarSpatialShape() {
        ImageVolume v = new ImageVolume(ComplexArray.zeros(4, 1));
        assertArrayEquals(new int[0], v.spatialShape());
        assertEquals(1, v.spatialSize());
        assertEquals(4, v.coils());
        assertEquals(1, v.echoes());
    }

    @Test
    void missingAxes_areRejected() {
        DimensionException ex = assertThrows(DimensionException.class,
                () -> new ImageVolume(ComplexArray.zeros(8)));
        assertTrue(ex.getMessage().startsWith("Invalid dimensions:"));
        assertThrows(DimensionException.class, () -> new ImageVolume(ComplexArray.zeros()));
    }

    @Test
    void emptyCoilOrEchoAxis_isRejected() {
        assertThrows(DimensionException.class, () -> new ImageVolume(ComplexArray.zeros(3, 0, 2)));
        assertThrows(DimensionException.class, () -> new ImageVolume(ComplexArray.zeros(3, 2, 0)));
    }

    @Test
    void nullData_isRejected() {
        assertThrows(NullPointerException.class, () -> new ImageVolume(null));
        assertThrows(NullPointerException.class, () -> new SensitivityMap(null));
    }
}
