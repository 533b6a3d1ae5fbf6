package com.p14n.lineageflow.queue;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.fasterxml.jackson.databind.JsonNode;
import com.p14n.lineageflow.InMemoryWorkQueueStore;
import com.p14n.lineageflow.MutableClock;
import com.p14n.lineageflow.broadcast.ErrorNotice;
import com.p14n.lineageflow.broadcast.EventPayload;
import com.p14n.lineageflow.broadcast.QueueItemProcessed;
import com.p14n.lineageflow.data.ConfigData;
import com.p14n.lineageflow.data.JsonSupport;
import com.p14n.lineageflow.data.LineageEvent;
import com.p14n.lineageflow.data.QueueItem;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;

public class QueueConsumerTest {

    private static final String QUEUE = "lineage_events";
    private static final String DLQ = "lineage_events_dlq";

    private final ConfigData cfg = new ConfigData("localhost", 5432, "postgres", "postgres", "postgres",
            QUEUE, DLQ, "lineage_notifications", 10,
            Duration.ofMillis(50), Duration.ofSeconds(30), Duration.ofMillis(50), 0, 0);

    private InMemoryWorkQueueStore store;
    private EventProcessor processor;
    private List<EventPayload> published;
    private ExecutorService pool;

    @BeforeEach
    public void setUp() {
        store = new InMemoryWorkQueueStore();
        processor = mock(EventProcessor.class);
        published = new CopyOnWriteArrayList<>();
        pool = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    public void tearDown() {
        pool.shutdownNow();
    }

    private QueueConsumer consumer(OpenTelemetry ot) {
        return new QueueConsumer(store, processor, new DeadLetterSink(store, DLQ, new MutableClock()),
                published::add, cfg, ot);
    }

    private static String event(String runId) {
        return "{\"eventType\":\"COMPLETE\",\"run\":{\"runId\":\"" + runId
                + "\"},\"job\":{\"namespace\":\"etl\",\"name\":\"daily_load\"}}";
    }

    private List<QueueItemProcessed> outcomes() {
        return published.stream().filter(p -> p instanceof QueueItemProcessed)
                .map(p -> (QueueItemProcessed) p).collect(Collectors.toList());
    }

    private List<ErrorNotice> errors() {
        return published.stream().filter(p -> p instanceof ErrorNotice)
                .map(p -> (ErrorNotice) p).collect(Collectors.toList());
    }

    private static String runIdOf(Object arg) {
        return ((LineageEvent) arg).runId();
    }

    @Test
    public void failedItemsAppearOnceInDeadLetterQueueAndLeaveSource() throws Exception {
        when(processor.process(any())).thenAnswer(inv -> !"r2".equals(runIdOf(inv.getArgument(0))));
        store.send(QUEUE, event("r1"));
        long rejectedId = store.send(QUEUE, event("r2"));
        store.send(QUEUE, event("r3"));
        long garbageId = store.send(QUEUE, "{not json");

        consumer(OpenTelemetry.noop()).pollOnce();

        assertEquals(0, store.length(QUEUE));
        List<String> dead = store.payloads(DLQ);
        assertEquals(2, dead.size());

        JsonNode rejected = JsonSupport.MAPPER.readTree(dead.get(0));
        assertEquals(event("r2"), rejected.get("original_message").asText());
        assertEquals(rejectedId, rejected.get("msg_id").asLong());
        assertFalse(rejected.get("error").asText().isEmpty());
        assertTrue(rejected.has("failed_at"));

        JsonNode garbage = JsonSupport.MAPPER.readTree(dead.get(1));
        assertEquals("{not json", garbage.get("original_message").asText());
        assertEquals(garbageId, garbage.get("msg_id").asLong());
        assertTrue(garbage.get("error").asText().startsWith("Decode failed"));

        List<QueueItemProcessed> outcomes = outcomes();
        assertEquals(4, outcomes.size());
        assertEquals(List.of(true, false, true, false),
                outcomes.stream().map(QueueItemProcessed::success).collect(Collectors.toList()));
        assertEquals("r2", outcomes.get(1).runId());
        assertEquals("COMPLETE", outcomes.get(1).eventType());
        assertEquals("unknown", outcomes.get(3).eventType());
        assertEquals("failed", outcomes.get(3).status());

        List<ErrorNotice> errors = errors();
        assertEquals(2, errors.size());
        for (ErrorNotice e : errors) {
            assertEquals(ErrorNotice.ITEM_DEAD_LETTERED, e.errorType());
            assertFalse(e.message().contains("r2"));
        }
    }

    @Test
    public void processorExceptionIsContainedAndDeadLettered() {
        when(processor.process(any())).thenThrow(new IllegalStateException("ledger offline"));
        store.send(QUEUE, event("r1"));
        store.send(QUEUE, event("r2"));

        consumer(OpenTelemetry.noop()).pollOnce();

        verify(processor, times(2)).process(any());
        assertEquals(0, store.length(QUEUE));
        assertEquals(2, store.length(DLQ));
        assertTrue(store.payloads(DLQ).get(0).contains("ledger offline"));
    }

    @Test
    public void itemLeasedByCrashedConsumerIsRedelivered() throws Exception {
        when(processor.process(any())).thenReturn(true);
        store.send(QUEUE, event("r1"));

        // a consumer that crashed after leasing
        List<QueueItem> lost = store.lease(QUEUE, 10, Duration.ofMillis(10), Duration.ZERO);
        assertEquals(1, lost.size());
        Thread.sleep(30);

        consumer(OpenTelemetry.noop()).pollOnce();
        consumer(OpenTelemetry.noop()).pollOnce();

        verify(processor, times(1)).process(any());
        assertEquals(0, store.length(QUEUE));
        assertEquals(0, store.length(DLQ));
        assertTrue(outcomes().get(0).success());
    }

    @Test
    public void deadLetterSendFailureLeavesItemForRedelivery() {
        when(processor.process(any())).thenReturn(false);
        store.failSendsTo(DLQ);
        store.send(QUEUE, event("r1"));

        consumer(OpenTelemetry.noop()).pollOnce();

        assertEquals(1, store.length(QUEUE));
        assertFalse(outcomes().get(0).success());
    }

    @Test
    @Timeout(10)
    public void leaseFailuresArePublishedAndRetried() throws Exception {
        when(processor.process(any())).thenReturn(true);
        store.failNextLeases(2);
        store.send(QUEUE, event("r1"));
        QueueConsumer consumer = consumer(OpenTelemetry.noop());

        pool.submit(consumer);
        while (outcomes().isEmpty()) {
            Thread.sleep(10);
        }
        consumer.stop();

        assertTrue(consumer.awaitStopped(Duration.ofSeconds(5)));
        assertEquals(ConsumerState.STOPPED, consumer.state());
        assertEquals(2, errors().stream().filter(e -> e.errorType().equals(ErrorNotice.QUEUE_UNAVAILABLE)).count());
        assertTrue(store.leaseCalls() >= 3);
        assertEquals(0, store.length(QUEUE));
    }

    @Test
    @Timeout(10)
    public void stopFinishesTheCurrentBatch() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(processor.process(any())).thenAnswer(inv -> {
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
            return true;
        });
        for (int i = 0; i < 3; i++) {
            store.send(QUEUE, event("r" + i));
        }
        QueueConsumer consumer = consumer(OpenTelemetry.noop());
        pool.submit(consumer);

        assertTrue(entered.await(5, TimeUnit.SECONDS));
        consumer.stop();
        assertEquals(ConsumerState.DRAINING, consumer.state());
        release.countDown();

        assertTrue(consumer.awaitStopped(Duration.ofSeconds(5)));
        assertEquals(ConsumerState.STOPPED, consumer.state());
        verify(processor, times(3)).process(any());
        assertEquals(0, store.length(QUEUE));
    }

    @Test
    public void outcomesAreRecordedInMetrics() {
        InMemoryMetricReader reader = InMemoryMetricReader.create();
        OpenTelemetry ot = OpenTelemetrySdk.builder()
                .setMeterProvider(SdkMeterProvider.builder().registerMetricReader(reader).build())
                .build();
        when(processor.process(any())).thenAnswer(inv -> !"bad".equals(runIdOf(inv.getArgument(0))));
        store.send(QUEUE, event("good"));
        store.send(QUEUE, event("bad"));
        store.send(QUEUE, event("good2"));

        consumer(ot).pollOnce();

        List<MetricData> metrics = List.copyOf(reader.collectAllMetrics());
        assertEquals(3, sum(metrics, "queue_items_processed"));
        assertEquals(1, sum(metrics, "queue_dead_letter_moves"));
        MetricData duration = metrics.stream().filter(m -> m.getName().equals("queue_processing_duration"))
                .findFirst().orElseThrow();
        assertEquals(3, duration.getHistogramData().getPoints().stream().mapToLong(p -> p.getCount()).sum());
    }

    private static long sum(List<MetricData> metrics, String name) {
        return metrics.stream().filter(m -> m.getName().equals(name))
                .flatMap(m -> m.getLongSumData().getPoints().stream())
                .mapToLong(LongPointData::getValue)
                .sum();
    }
}
