package org.matrixbfs.fanout;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration of a fan-out run.
 */
@Value
@Builder
public class FanOutConfig {
    public static final String PROP_WORKER_COUNT = "matrixbfs.fanout.workerCount";
    public static final String PROP_POOL_NAME = "matrixbfs.fanout.poolName";
    public static final String DEFAULT_POOL_NAME = "bfs";

    /**
     * Number of concurrent workers. Validated by the orchestrator, not here.
     */
    int workerCount;

    /**
     * Prefix of worker thread names.
     */
    @Builder.Default
    String poolName = DEFAULT_POOL_NAME;

    /**
     * Loads configuration from system properties.
     *
     * <p>A missing, malformed or non-positive worker count falls back to the number of available
     * processors; a missing or blank pool name falls back to {@value #DEFAULT_POOL_NAME}.</p>
     */
    public static FanOutConfig defaults() {
        return FanOutConfig.builder()
                .workerCount(readWorkerCount())
                .poolName(readPoolName())
                .build();
    }

    private static int readWorkerCount() {
        int fallback = Runtime.getRuntime().availableProcessors();
        String raw = System.getProperty(PROP_WORKER_COUNT);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            int parsed = Integer.parseInt(raw.trim());
            return parsed > 0 ? parsed : fallback;
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }

    private static String readPoolName() {
        String raw = System.getProperty(PROP_POOL_NAME);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_POOL_NAME;
        }
        return raw.trim();
    }
}
