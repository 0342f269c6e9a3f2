/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.util;

import ai.evacortex.coilcombine.core.ComplexArray;
import ai.evacortex.coilcombine.core.RealArray;
import net.jpountz.xxhash.XXHash64;
import net.jpountz.xxhash.XXHashFactory;

import java.nio.ByteBuffer;
import java.util.HexFormat;

/**
 * Content fingerprints over the exact IEEE-754 bits of an array and its shape. Two arrays share a
 * fingerprint only if they are bit-identical (up to hash collisions), which makes this suitable
 * for reproducibility checks where a tolerance comparison would hide reordering effects.
 *
 * <p>Data is hashed in fixed-size blocks, each block's xxHash64 seeding the next.</p>
 */
public final class HashingUtil {

    private static final XXHash64 XX_HASH = XXHashFactory.fastestInstance().hash64();
    private static final long SEED = 0x9747b28cL;
    private static final int BLOCK = 1024;

    private HashingUtil() {}

    public static String fingerprint(ComplexArray array) {
        long h = hashShape(array.shape());
        ByteBuffer buf = ByteBuffer.allocate(BLOCK * 16);
        for (int i = 0; i < array.size(); i++) {
            buf.putDouble(array.realAt(i));
            buf.putDouble(array.imagAt(i));
            if (!buf.hasRemaining()) h = flush(buf, h);
        }
        return HexFormat.of().toHexDigits(flush(buf, h));
    }

    public static String fingerprint(RealArray array) {
        long h = hashShape(array.shape());
        ByteBuffer buf = ByteBuffer.allocate(BLOCK * 8);
        for (int i = 0; i < array.size(); i++) {
            buf.putDouble(array.getFlat(i));
            if (!buf.hasRemaining()) h = flush(buf, h);
        }
        return HexFormat.of().toHexDigits(flush(buf, h));
    }

    private static long hashShape(int[] shape) {
        ByteBuffer buf = ByteBuffer.allocate(4 + shape.length * 4);
        buf.putInt(shape.length);
        for (int d : shape) buf.putInt(d);
        return XX_HASH.hash(buf.array(), 0, buf.position(), SEED);
    }

    private static long flush(ByteBuffer buf, long seed) {
        if (buf.position() == 0) return seed;
        long h = XX_HASH.hash(buf.array(), 0, buf.position(), seed);
        buf.clear();
        return h;
    }
}
