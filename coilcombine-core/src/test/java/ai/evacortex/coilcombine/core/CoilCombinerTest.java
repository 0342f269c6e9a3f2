/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core;

import ai.evacortex.coilcombine.core.config.CoilCombineConfig;
import ai.evacortex.coilcombine.core.engine.JavaCombineKernel;
import ai.evacortex.coilcombine.core.engine.ParallelCombineKernel;
import ai.evacortex.coilcombine.core.exceptions.ShapeMismatchException;
import ai.evacortex.coilcombine.core.math.Complex;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static ai.evacortex.coilcombine.core.CoilDataTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class CoilCombinerTest {

    private CoilCombiner combiner;

    @BeforeEach void setUp() { combiner = new CoilCombiner(); }
    @AfterEach  void tearDown() { combiner.close(); }

    @Test
    void combine_withMap_dispatchesToWeighted() {
        int[] spatial = {4, 4};
        ImageVolume y = randomVolume(spatial, 3, 2, 1);
        SensitivityMap smap = randomMap(spatial, 3, 2);

        assertEquals(combiner.weightedCombine(y, smap), combiner.combine(y, Optional.of(smap)));
    }

    @Test
    void combine_withoutMap_dispatchesToSelfWeighted() {
        ImageVolume y = randomVolume(new int[]{4, 4}, 3, 2, 3);

        CoilCombination r = combiner.combine(y, Optional.empty());

        assertEquals(combiner.selfWeightedCombine(y), r);
        assertEquals(1.0, r.sos().max(), 0.0);
    }

    @Test
    void scenarios_throughFacade() {
        ImageVolume yA = volume(new int[]{1}, 2, 1, (s, c, e) -> c == 0 ? c(2, 0) : c(3, 0));
        SensitivityMap smapA = map(new int[]{1}, 2, (s, c) -> c(1, 0));
        CoilCombination a = combiner.weightedCombine(yA, smapA);
        assertEquals(2.0, a.sos().get(0), 0.0);
        assertEquals(new Complex(2.5, 0.0), a.combined().get(0, 0));

        ImageVolume yB = volume(new int[]{1}, 2, 1, (s, c, e) -> c == 0 ? c(3, 4) : c(0, 0));
        CoilCombination b = combiner.combine(yB, Optional.empty());
        assertEquals(1.0, b.sos().get(0), 0.0);
        assertEquals(5.0, b.combined().get(0, 0).real, 1e-12);
        assertEquals(0.0, b.combined().get(0, 0).imag, 1e-12);
    }

    @Test
    void shapeMismatch_surfacesToCaller() {
        ImageVolume y = randomVolume(new int[]{2, 2}, 2, 1, 4);
        SensitivityMap smap = randomMap(new int[]{2, 2}, 1, 5);
        assertThrows(ShapeMismatchException.class, () -> combiner.combine(y, Optional.of(smap)));
    }

    @Test
    void nullArguments_throwNpe() {
        ImageVolume y = randomVolume(new int[]{2}, 1, 1, 6);
        assertThrows(NullPointerException.class, () -> combiner.combine(y, null));
        assertThrows(NullPointerException.class, () -> combiner.combine(null, Optional.empty()));
        assertThrows(NullPointerException.class, () -> combiner.weightedCombine(y, null));
        assertThrows(NullPointerException.class, () -> new CoilCombiner(null));
    }

    @Test
    void fromConfig_selectsKernel() {
        try (CoilCombiner javaCombiner = CoilCombiner.fromConfig(CoilCombineConfig.defaults())) {
            assertInstanceOf(JavaCombineKernel.class, javaCombiner.kernel());
        }

        CoilCombineConfig parallelConfig =
                new CoilCombineConfig(CoilCombineConfig.KernelType.PARALLEL, 2, 8);
        ImageVolume y = randomVolume(new int[]{16, 16}, 4, 2, 7);
        SensitivityMap smap = randomMap(new int[]{16, 16}, 4, 8);
        try (CoilCombiner parallel = CoilCombiner.fromConfig(parallelConfig)) {
            assertInstanceOf(ParallelCombineKernel.class, parallel.kernel());
            assertEquals(combiner.weightedCombine(y, smap), parallel.weightedCombine(y, smap));
            assertEquals(combiner.selfWeightedCombine(y), parallel.selfWeightedCombine(y));
        }
    }

    @Test
    void combine_withDebugDisabled_producesSameResult() {
        ImageVolume y = randomVolume(new int[]{5, 3}, 2, 2, 9);
        SensitivityMap smap = randomMap(new int[]{5, 3}, 2, 10);
        CoilCombination weighted = combiner.weightedCombine(y, smap);
        CoilCombination self = combiner.selfWeightedCombine(y);

        String name = CoilCombiner.class.getName();
        Level previous = LogManager.getLogger(name).getLevel();
        Configurator.setLevel(name, Level.WARN);
        try {
            assertFalse(LogManager.getLogger(name).isDebugEnabled());
            assertEquals(weighted, combiner.weightedCombine(y, smap));
            assertEquals(self, combiner.selfWeightedCombine(y));
        } finally {
            Configurator.setLevel(name, previous);
        }
    }
}
