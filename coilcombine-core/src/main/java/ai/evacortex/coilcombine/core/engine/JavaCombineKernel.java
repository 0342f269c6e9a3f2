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
 * Single-threaded kernel: one pass over all spatial locations on the calling thread.
 */
public final class JavaCombineKernel extends AbstractCombineKernel {

    @Override
    protected void forEachRange(int size, CombineLoops.RangeOp op) {
        op.apply(0, size);
    }

    @Override
    public String toString() {
        return "JavaCombineKernel";
    }
}
