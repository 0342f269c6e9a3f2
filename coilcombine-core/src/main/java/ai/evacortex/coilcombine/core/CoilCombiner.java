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
import ai.evacortex.coilcombine.core.engine.CombineKernel;
import ai.evacortex.coilcombine.core.engine.JavaCombineKernel;
import ai.evacortex.coilcombine.core.engine.ParallelCombineKernel;
import ai.evacortex.coilcombine.core.util.HashingUtil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for complex coil combination. Produces the combined image and sum-of-squares map
 * consumed by B0 field-map estimation.
 *
 * <p>The variant is chosen by which operation is called, or by the presence of the sensitivity
 * map in {@link #combine(ImageVolume, Optional)}. Computation is delegated to a
 * {@link CombineKernel}; closing the combiner closes the kernel if it holds resources.</p>
 */
public class CoilCombiner implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(CoilCombiner.class);

    private final CombineKernel kernel;

    public CoilCombiner() {
        this(new JavaCombineKernel());
    }

    public CoilCombiner(CombineKernel kernel) {
        this.kernel = Objects.requireNonNull(kernel, "kernel must not be null");
    }

    public static CoilCombiner fromConfig(CoilCombineConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return switch (config.kernel()) {
            case JAVA -> new CoilCombiner(new JavaCombineKernel());
            case PARALLEL -> new CoilCombiner(new ParallelCombineKernel(config.toOptions()));
        };
    }

    public CombineKernel kernel() {
        return kernel;
    }

    /**
     * Combines using known coil sensitivities. SOS is {@code Σ_c |smap_c|²}, unscaled.
     */
    public CoilCombination weightedCombine(ImageVolume ydata, SensitivityMap smap) {
        Objects.requireNonNull(ydata, "ydata must not be null");
        Objects.requireNonNull(smap, "smap must not be null");
        if (log.isDebugEnabled()) {
            log.debug("Weighted combine: spatial={}, coils={}, echoes={}, kernel={}",
                    Arrays.toString(ydata.spatialShape()), ydata.coils(), ydata.echoes(), kernel);
        }
        return traced("weighted", kernel.weightedCombine(ydata, smap));
    }

    /**
     * Combines using the first echo as surrogate sensitivity. SOS is the coil root-sum-of-squares
     * of the first echo scaled to a maximum of 1.
     */
    public CoilCombination selfWeightedCombine(ImageVolume ydata) {
        Objects.requireNonNull(ydata, "ydata must not be null");
        if (log.isDebugEnabled()) {
            log.debug("Self-weighted combine: spatial={}, coils={}, echoes={}, kernel={}",
                    Arrays.toString(ydata.spatialShape()), ydata.coils(), ydata.echoes(), kernel);
        }
        return traced("self-weighted", kernel.selfWeightedCombine(ydata));
    }

    public CoilCombination combine(ImageVolume ydata, Optional<SensitivityMap> smap) {
        Objects.requireNonNull(smap, "smap must not be null, use Optional.empty()");
        return smap.isPresent()
                ? weightedCombine(ydata, smap.get())
                : selfWeightedCombine(ydata);
    }

    private static CoilCombination traced(String variant, CoilCombination result) {
        if (log.isTraceEnabled()) {
            log.trace("{} combine result: combined={} sos={} maxSos={}", variant,
                    HashingUtil.fingerprint(result.combined()),
                    HashingUtil.fingerprint(result.sos()),
                    result.sos().max());
        }
        return result;
    }

    @Override
    public void close() {
        if (kernel instanceof AutoCloseable) {
            try {
                ((AutoCloseable) kernel).close();
            } catch (Exception e) {
                throw new IllegalStateException("Failed to close kernel " + kernel, e);
            }
        }
    }
}
