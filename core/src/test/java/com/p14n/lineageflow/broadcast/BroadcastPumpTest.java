package com.p14n.lineageflow.broadcast;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import com.p14n.lineageflow.MutableClock;
import com.p14n.lineageflow.data.LivenessSettings;

import io.opentelemetry.api.OpenTelemetry;

public class BroadcastPumpTest {

    @Test
    @Timeout(10)
    public void drainsPayloadsInOrderBeforeStopping() throws Exception {
        MutableClock clock = new MutableClock();
        EventBroadcaster broadcaster = new EventBroadcaster(LivenessSettings.defaults(), clock, OpenTelemetry.noop());
        SubscriberSession session = broadcaster.subscribe(Set.of(Topic.JOB_STATUS));
        BroadcastPump pump = new BroadcastPump(broadcaster, clock);

        for (int i = 0; i < 20; i++) {
            pump.publish(new JobStatus("j", "r" + i, "RUNNING", i));
        }
        ExecutorService pool = Executors.newSingleThreadExecutor();
        pool.submit(pump);
        assertTrue(pump.stop(Duration.ofSeconds(5)));

        List<String> runs = new ArrayList<>();
        BroadcastEvent e;
        while ((e = session.next(Duration.ZERO)) != null) {
            runs.add(((JobStatus) e.payload()).runId());
        }
        assertEquals(20, runs.size());
        for (int i = 0; i < 20; i++) {
            assertEquals("r" + i, runs.get(i));
        }

        pump.publish(new JobStatus("j", "late", "RUNNING", null));
        assertEquals(0, pump.pending(), "payloads after stop are dropped");
        pool.shutdownNow();
        broadcaster.close();
    }

    @Test
    @Timeout(10)
    public void broadcasterFailureDoesNotStopThePump() throws Exception {
        MutableClock clock = new MutableClock();
        EventBroadcaster broadcaster = new EventBroadcaster(LivenessSettings.defaults(), clock, OpenTelemetry.noop());
        BroadcastPump pump = new BroadcastPump(broadcaster, clock);
        broadcaster.close();

        pump.publish(new JobStatus("j", "r1", "RUNNING", null));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        pool.submit(pump);

        assertTrue(pump.stop(Duration.ofSeconds(5)));
        assertEquals(0, pump.pending());
        pool.shutdownNow();
    }

    @Test
    @Timeout(10)
    public void fullChannelDropsPayloadsWithoutBlocking() throws Exception {
        MutableClock clock = new MutableClock();
        EventBroadcaster broadcaster = new EventBroadcaster(LivenessSettings.defaults(), clock, OpenTelemetry.noop());
        SubscriberSession session = broadcaster.subscribe(Set.of(Topic.JOB_STATUS));
        BroadcastPump pump = new BroadcastPump(broadcaster, clock, 5);

        for (int i = 0; i < 12; i++) {
            pump.publish(new JobStatus("j", "r" + i, "RUNNING", i));
        }
        assertEquals(5, pump.pending());
        assertEquals(7, pump.dropped());

        ExecutorService pool = Executors.newSingleThreadExecutor();
        pool.submit(pump);
        assertTrue(pump.stop(Duration.ofSeconds(5)));

        List<String> runs = new ArrayList<>();
        BroadcastEvent e;
        while ((e = session.next(Duration.ZERO)) != null) {
            runs.add(((JobStatus) e.payload()).runId());
        }
        assertEquals(List.of("r0", "r1", "r2", "r3", "r4"), runs);
        pool.shutdownNow();
        broadcaster.close();
    }

    @Test
    public void capacityMustBePositive() {
        EventBroadcaster broadcaster = new EventBroadcaster(LivenessSettings.defaults(), new MutableClock(),
                OpenTelemetry.noop());
        assertThrows(IllegalArgumentException.class, () -> new BroadcastPump(broadcaster, new MutableClock(), 0));
        broadcaster.close();
    }
}
