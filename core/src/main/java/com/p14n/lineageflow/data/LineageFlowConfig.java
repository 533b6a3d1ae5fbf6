package com.p14n.lineageflow.data;

import java.time.Duration;

public interface LineageFlowConfig {
    public String dbHost();

    public int dbPort();

    public String dbUser();

    public String dbPassword();

    public String dbName();

    public String queueName();

    public String deadLetterQueueName();

    public String notificationQueueName();

    public int batchSize();

    public Duration pollInterval();

    public Duration visibilityWindow();

    public Duration leaseFailureBackoff();

    public int httpPort();

    public int metricsPort();

    public default String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s",
                dbHost(), dbPort(), dbName());
    }
}
