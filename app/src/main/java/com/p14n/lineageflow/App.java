package com.p14n.lineageflow;

import java.sql.DriverManager;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import javax.sql.DataSource;

import org.postgresql.Driver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.data.ConfigData;
import com.p14n.lineageflow.data.LivenessSettings;
import com.p14n.lineageflow.db.PoolSetup;
import com.p14n.lineageflow.db.QueueSetup;
import com.p14n.lineageflow.processor.RunEventLedger;
import com.p14n.lineageflow.vertx.EventStreamHttpServer;

import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.vertx.core.Vertx;

public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String envVal(String name, String defaultValue) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    private static int envInt(String name, int defaultValue) {
        return Integer.parseInt(envVal(name, String.valueOf(defaultValue)));
    }

    private static Duration envSeconds(String name, Duration defaultValue) {
        var e = envVal(name, null);
        return e == null ? defaultValue : Duration.ofMillis((long) (Double.parseDouble(e) * 1000));
    }

    static ConfigData configFromEnv() {
        return new ConfigData(
                envVal("APP_DB_HOST", "localhost"),
                envInt("APP_DB_PORT", 5432),
                envVal("APP_DB_USER", "postgres"),
                envVal("APP_DB_PASSWORD", "postgres"),
                envVal("APP_DB_NAME", "postgres"),
                envVal("APP_QUEUE", ConfigData.DEFAULT_QUEUE),
                envVal("APP_DLQ", ConfigData.DEFAULT_DEAD_LETTER_QUEUE),
                envVal("APP_NOTIFICATION_QUEUE", ConfigData.DEFAULT_NOTIFICATION_QUEUE),
                envInt("APP_BATCH_SIZE", 10),
                envSeconds("APP_POLL_SECONDS", Duration.ofSeconds(5)),
                envSeconds("APP_VISIBILITY_SECONDS", Duration.ofSeconds(30)),
                envSeconds("APP_LEASE_BACKOFF_SECONDS", Duration.ofSeconds(5)),
                envInt("APP_HTTP_PORT", 8000),
                envInt("APP_METRICS_PORT", 9464));
    }

    private static void close(AutoCloseable c, String name) {
        try {
            if (c != null)
                c.close();
        } catch (Exception e) {
            logger.atWarn().setCause(e).addArgument(name).log("Failed to close {}");
        }
    }

    public static void main(String[] args) throws Exception {
        DriverManager.registerDriver(new Driver());

        var cfg = configFromEnv();
        var settings = LivenessSettings.defaults();

        OpenTelemetrySdk ot = Opentelemetry.create("lineageflow", cfg.metricsPort(),
                envVal("APP_OTLP_ENDPOINT", "http://localhost:4317"));
        DataSource ds = PoolSetup.createPool(cfg);
        new QueueSetup(ds).setupAll(cfg);

        var server = new LineageFlowServer(ds, cfg, settings, new RunEventLedger(ds, Clock.systemUTC()), ot);
        var vertx = Vertx.vertx();
        var http = new EventStreamHttpServer(vertx, server);

        var stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.atInfo().log("Shutting down");
            close(http, "http server");
            close(server, "lineage flow server");
            close(vertx::close, "vertx");
            close(ds instanceof AutoCloseable ? (AutoCloseable) ds : null, "connection pool");
            close(ot, "telemetry");
            stopped.countDown();
        }, "shutdown"));

        server.start();
        int port = http.start(cfg.httpPort());
        logger.atInfo().addArgument(port).addArgument(cfg.metricsPort())
                .log("Lineage flow running, events on port {}, metrics on port {}");
        stopped.await();
    }
}
