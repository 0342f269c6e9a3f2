/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.engine;

import ai.evacortex.coilcombine.core.CoilCombination;
import ai.evacortex.coilcombine.core.ImageVolume;
import ai.evacortex.coilcombine.core.SensitivityMap;
import ai.evacortex.coilcombine.core.exceptions.ShapeMismatchException;

/**
 * {@code CombineKernel} reduces multi-coil complex image data to one complex image per echo
 * together with a real sum-of-squares (SOS) weight map.
 *
 * <p>For image data {@code y[s, c, e]} (spatial location {@code s}, coil {@code c}, echo {@code e})
 * and a per-coil weight {@code w[s, c]}, every implementation computes</p>
 * <pre>
 *     z[s, e] = Σ_c conj(w[s, c]) · y[s, c, e]
 * </pre>
 * <p>where the sum runs over coils in ascending order. The two variants differ only in where
 * {@code w} and the SOS map come from:</p>
 * <ul>
 *     <li>{@link #weightedCombine} uses known sensitivities {@code S}:
 *     {@code sos = Σ_c |S_c|²}, {@code w = S / sos}</li>
 *     <li>{@link #selfWeightedCombine} uses the first echo {@code y1}:
 *     {@code sos = √(Σ_c |y1_c|²)}, {@code w = y1 / sos}, then {@code sos /= max(sos)}</li>
 * </ul>
 *
 * <p>All divisions go through {@link ai.evacortex.coilcombine.core.math.SafeDivision}: where
 * {@code sos} is zero both the weight and the combined value are exactly zero.</p>
 *
 * <p>Implementations must be deterministic and free of side effects. Inputs are never modified
 * and outputs are freshly allocated. Two kernels given the same input must return bit-identical
 * results regardless of how they schedule work.</p>
 *
 * @see JavaCombineKernel
 * @see ParallelCombineKernel
 */
public interface CombineKernel {

    /**
     * Combines coil data using known complex coil sensitivities.
     *
     * <p>For a single coil this reduces to {@code z = y / S}, with {@code z = 0} where {@code S = 0}.
     * The SOS map is returned unscaled.</p>
     *
     * @param ydata image data, axes {@code (spatial..., coil, echo)}
     * @param smap  sensitivities, axes {@code (spatial..., coil)}
     * @return combined image {@code (spatial..., echo)} and SOS {@code (spatial...)}
     * @throws ShapeMismatchException if {@code smap} is not shaped {@code (spatial..., nc)}
     * @throws NullPointerException   if either argument is {@code null}
     */
    CoilCombination weightedCombine(ImageVolume ydata, SensitivityMap smap);

    /**
     * Combines coil data without sensitivity maps, weighting each coil by its normalized
     * first-echo image. The same weights are applied to every echo.
     *
     * <p>The returned SOS is scaled so its maximum is {@code 1}; if it is zero everywhere it
     * is returned as all zeros.</p>
     *
     * @param ydata image data, axes {@code (spatial..., coil, echo)}
     * @return combined image {@code (spatial..., echo)} and normalized SOS {@code (spatial...)}
     * @throws NullPointerException if {@code ydata} is {@code null}
     */
    CoilCombination selfWeightedCombine(ImageVolume ydata);
}
