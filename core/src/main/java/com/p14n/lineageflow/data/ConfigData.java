package com.p14n.lineageflow.data;

import java.time.Duration;

/**
 * Implementation of LineageFlowConfig that provides configuration data for
 * the queue consumer and the streaming endpoints.
 *
 * @param dbHost                Database host address
 * @param dbPort                Database port number
 * @param dbUser                Database username
 * @param dbPassword            Database password
 * @param dbName                Database name
 * @param queueName             Source queue holding lineage events
 * @param deadLetterQueueName   Queue receiving items that failed processing
 * @param notificationQueueName Queue holding job status and metric
 *                              notifications
 * @param batchSize             Maximum items leased per poll
 * @param pollInterval          How long a lease waits for items to appear
 * @param visibilityWindow      How long a leased item stays invisible
 * @param leaseFailureBackoff   Pause after a failed lease before retrying
 * @param httpPort              Port for the streaming and admin endpoints
 * @param metricsPort           Port for the Prometheus scrape endpoint
 */
public record ConfigData(String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        String queueName,
        String deadLetterQueueName,
        String notificationQueueName,
        int batchSize,
        Duration pollInterval,
        Duration visibilityWindow,
        Duration leaseFailureBackoff,
        int httpPort,
        int metricsPort) implements LineageFlowConfig {

    public static final String DEFAULT_QUEUE = "lineage_events";
    public static final String DEFAULT_DEAD_LETTER_QUEUE = "lineage_events_dlq";
    public static final String DEFAULT_NOTIFICATION_QUEUE = "lineage_notifications";

    public ConfigData {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Batch size must be at least 1");
        }
    }

    /**
     * Creates a new ConfigData instance with the default queue names, a batch
     * size of 10, a 5 second poll, a 30 second visibility window and a 5
     * second lease failure backoff.
     *
     * @param dbHost     Database host address
     * @param dbPort     Database port number
     * @param dbUser     Database username
     * @param dbPassword Database password
     * @param dbName     Database name
     */
    public ConfigData(String dbHost,
            int dbPort,
            String dbUser,
            String dbPassword,
            String dbName) {
        this(dbHost, dbPort, dbUser, dbPassword, dbName,
                DEFAULT_QUEUE, DEFAULT_DEAD_LETTER_QUEUE, DEFAULT_NOTIFICATION_QUEUE,
                10, Duration.ofSeconds(5), Duration.ofSeconds(30), Duration.ofSeconds(5),
                8000, 9464);
    }
}
