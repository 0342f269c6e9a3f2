/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.engine;

/**
 * Execution options for {@link ParallelCombineKernel}. They affect scheduling only, never results.
 */
public record CombineOptions(
        int parallelism,    // worker threads in the kernel's pool
        int minChunkSize    // spatial locations below which a range is not split further
) {
    public static final int DEFAULT_MIN_CHUNK_SIZE = 4096;

    public CombineOptions {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (minChunkSize < 1) {
            throw new IllegalArgumentException("minChunkSize must be >= 1, got " + minChunkSize);
        }
    }

    public static CombineOptions defaultOptions() {
        return new CombineOptions(Runtime.getRuntime().availableProcessors(), DEFAULT_MIN_CHUNK_SIZE);
    }
}
