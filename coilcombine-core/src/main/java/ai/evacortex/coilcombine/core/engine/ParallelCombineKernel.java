/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.engine;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.TimeUnit;

/**
 * Data-parallel kernel. The spatial index range is split in halves until a piece holds at most
 * {@link CombineOptions#minChunkSize()} locations, and the pieces run on a private
 * {@link ForkJoinPool}.
 *
 * <p>Each location is reduced by exactly one task, in ascending coil order, so output is
 * bit-identical to {@link JavaCombineKernel}.</p>
 */
public final class ParallelCombineKernel extends AbstractCombineKernel implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(ParallelCombineKernel.class);

    private final ForkJoinPool pool;
    private final int minChunkSize;

    public ParallelCombineKernel() {
        this(CombineOptions.defaultOptions());
    }

    public ParallelCombineKernel(CombineOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        this.pool = new ForkJoinPool(options.parallelism());
        this.minChunkSize = options.minChunkSize();
        log.debug("Created combine pool: parallelism={}, minChunkSize={}",
                options.parallelism(), options.minChunkSize());
    }

    @Override
    protected void forEachRange(int size, CombineLoops.RangeOp op) {
        if (size <= minChunkSize) {
            op.apply(0, size);
            return;
        }
        pool.invoke(new RangeTask(op, 0, size, minChunkSize));
    }

    @Override
    public void close() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Combine pool did not terminate in time, forcing shutdown");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "ParallelCombineKernel[parallelism=" + pool.getParallelism() + ", minChunkSize=" + minChunkSize + "]";
    }

    private static final class RangeTask extends RecursiveAction {
        private final CombineLoops.RangeOp op;
        private final int from;
        private final int to;
        private final int threshold;

        RangeTask(CombineLoops.RangeOp op, int from, int to, int threshold) {
            this.op = op;
            this.from = from;
            this.to = to;
            this.threshold = threshold;
        }

        @Override
        protected void compute() {
            if (to - from <= threshold) {
                op.apply(from, to);
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(new RangeTask(op, from, mid, threshold),
                      new RangeTask(op, mid, to, threshold));
        }
    }
}
