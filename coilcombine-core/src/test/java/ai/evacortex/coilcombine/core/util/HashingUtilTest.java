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
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class HashingUtilTest {

    private static ComplexArray random(int n, long seed) {
        Random r = new Random(seed);
        double[] re = new double[n];
        double[] im = new double[n];
        for (int i = 0; i < n; i++) {
            re[i] = r.nextGaussian();
            im[i] = r.nextGaussian();
        }
        return ComplexArray.of(new int[]{n}, re, im);
    }

    @Test
    void fingerprint_isDeterministicAndContentSensitive() {
        ComplexArray a = random(3000, 1);
        ComplexArray b = random(3000, 1);
        String h = HashingUtil.fingerprint(a);

        assertEquals(h, HashingUtil.fingerprint(b));
        assertEquals(16, h.length(), "64-bit hash must be 16 hex chars");

        double[] re = a.realPlane();
        re[2999] = Math.nextUp(re[2999]);
        assertNotEquals(h, HashingUtil.fingerprint(ComplexArray.of(a.shape(), re, a.imagPlane())),
                "a one-ulp change in the last element must change the fingerprint");
    }

    @Test
    void fingerprint_includesShape() {
        double[] v = {1, 2, 3, 4, 5, 6};
        assertNotEquals(HashingUtil.fingerprint(RealArray.of(new int[]{6}, v)),
                HashingUtil.fingerprint(RealArray.of(new int[]{2, 3}, v)));
        assertNotEquals(HashingUtil.fingerprint(RealArray.of(new int[]{2, 3}, v)),
                HashingUtil.fingerprint(RealArray.of(new int[]{3, 2}, v)));
    }

    @Test
    void fingerprint_distinguishesSignedZero() {
        RealArray plus = RealArray.of(new int[]{1}, new double[]{0.0});
        RealArray minus = RealArray.of(new int[]{1}, new double[]{-0.0});
        assertNotEquals(HashingUtil.fingerprint(plus), HashingUtil.fingerprint(minus));
    }
}
