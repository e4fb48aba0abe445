/*
 * P3IF — Pattern Integration Framework
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.p3if.core.config;

import java.time.Duration;

/**
 * Tuning knobs for a store instance.
 *
 * <p>{@link #defaults()} reads {@code p3if.metrics.timeoutSeconds} and {@code p3if.batch.threads}
 * from system properties, falling back to 300 seconds and the number of available processors.</p>
 */
public record FrameworkConfig(
        Duration metricsTimeout,
        int batchThreads
) {
    public static final long DEFAULT_METRICS_TIMEOUT_SECONDS = 300;

    public FrameworkConfig {
        if (metricsTimeout == null || metricsTimeout.isNegative() || metricsTimeout.isZero()) {
            throw new IllegalArgumentException("metricsTimeout must be positive");
        }
        if (batchThreads < 1) throw new IllegalArgumentException("batchThreads must be >= 1");
    }

    public static FrameworkConfig defaults() {
        long timeout = Long.parseLong(System.getProperty("p3if.metrics.timeoutSeconds",
                String.valueOf(DEFAULT_METRICS_TIMEOUT_SECONDS)));
        int threads = Integer.parseInt(System.getProperty("p3if.batch.threads",
                String.valueOf(Runtime.getRuntime().availableProcessors())));
        return new FrameworkConfig(Duration.ofSeconds(timeout), threads);
    }

    public FrameworkConfig withMetricsTimeout(Duration timeout) {
        return new FrameworkConfig(timeout, batchThreads);
    }

    public FrameworkConfig withBatchThreads(int threads) {
        return new FrameworkConfig(metricsTimeout, threads);
    }
}
