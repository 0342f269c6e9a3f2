/*
 * CoilCombine — Multi-coil Complex Image Combination
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.coilcombine.core.config;

import ai.evacortex.coilcombine.core.engine.CombineOptions;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * JSON-backed configuration selecting the combine kernel and its scheduling options.
 *
 * <pre>
 * { "kernel": "parallel", "parallelism": 8, "minChunkSize": 4096 }
 * </pre>
 *
 * Absent fields take their defaults; unknown fields are ignored. Non-positive
 * {@code parallelism} or {@code minChunkSize} is rejected on load, whichever kernel is selected.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CoilCombineConfig(KernelType kernel, Integer parallelism, Integer minChunkSize) {

    public static final String RESOURCE_NAME = "coilcombine.json";

    private static final Logger log = LogManager.getLogger(CoilCombineConfig.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    public enum KernelType { JAVA, PARALLEL }

    public CoilCombineConfig {
        if (kernel == null) kernel = KernelType.JAVA;
        if (parallelism == null) parallelism = Runtime.getRuntime().availableProcessors();
        if (minChunkSize == null) minChunkSize = CombineOptions.DEFAULT_MIN_CHUNK_SIZE;
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (minChunkSize < 1) {
            throw new IllegalArgumentException("minChunkSize must be >= 1, got " + minChunkSize);
        }
    }

    public static CoilCombineConfig defaults() {
        return new CoilCombineConfig(null, null, null);
    }

    public static CoilCombineConfig load(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        try (InputStream in = Files.newInputStream(path)) {
            CoilCombineConfig config = read(in);
            log.info("Loaded coil combine config from {}: {}", path, config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load coil combine config from " + path, e);
        }
    }

    /**
     * Reads {@value #RESOURCE_NAME} from the context class loader, or returns {@link #defaults()}
     * when the resource is absent.
     */
    public static CoilCombineConfig fromClasspath() {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) loader = CoilCombineConfig.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(RESOURCE_NAME)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", RESOURCE_NAME);
                return defaults();
            }
            CoilCombineConfig config = read(in);
            log.info("Loaded coil combine config from classpath: {}", config);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE_NAME + " from classpath", e);
        }
    }

    public static CoilCombineConfig read(InputStream in) throws IOException {
        CoilCombineConfig config = MAPPER.readValue(in, CoilCombineConfig.class);
        return config != null ? config : defaults();
    }

    public CombineOptions toOptions() {
        return new CombineOptions(parallelism, minChunkSize);
    }
}
