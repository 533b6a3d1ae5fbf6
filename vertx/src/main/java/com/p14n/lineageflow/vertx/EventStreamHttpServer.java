package com.p14n.lineageflow.vertx;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.lineageflow.LineageFlowServer;
import com.p14n.lineageflow.broadcast.EventBroadcaster;
import com.p14n.lineageflow.broadcast.SubscriberSession;
import com.p14n.lineageflow.broadcast.Topic;
import com.p14n.lineageflow.data.JsonSupport;

import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.HttpServer;
import io.vertx.core.http.HttpServerRequest;
import io.vertx.core.http.HttpServerResponse;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

/**
 * HTTP front end for the event stream.
 *
 * <p>
 * Routes:
 * </p>
 * <ul>
 * <li>{@code GET /events/stream?events=a,b} opens a server-sent event stream;
 * the session id is returned in the {@code X-Session-Id} header</li>
 * <li>{@code POST /events/ack} acknowledges a liveness probe with
 * {@code {"session_id", "probe_id"}}</li>
 * <li>{@code GET /events/stats}, {@code GET /events/zombies} and
 * {@code POST /events/zombies/cleanup} expose session health</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * EventStreamHttpServer http = new EventStreamHttpServer(vertx, server);
 * int port = http.start(8000);
 * }</pre>
 */
public class EventStreamHttpServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventStreamHttpServer.class);

    public static final String SESSION_HEADER = "X-Session-Id";
    private static final Duration WRITE_TIMEOUT = Duration.ofSeconds(10);
    private static final String JSON = "application/json";

    private final Vertx vertx;
    private final LineageFlowServer server;
    private HttpServer httpServer;

    public EventStreamHttpServer(Vertx vertx, LineageFlowServer server) {
        this.vertx = vertx;
        this.server = server;
    }

    /**
     * Binds the server and blocks until it is listening.
     *
     * @param port port to bind, 0 for any free port
     * @return the bound port
     * @throws Exception if the port cannot be bound
     */
    public int start(int port) throws Exception {
        httpServer = vertx.createHttpServer()
                .requestHandler(this::route)
                .listen(port)
                .toCompletionStage()
                .toCompletableFuture()
                .get(30, TimeUnit.SECONDS);
        logger.atInfo().addArgument(httpServer.actualPort()).log("Event stream listening on port {}");
        return httpServer.actualPort();
    }

    void route(HttpServerRequest request) {
        String path = request.path();
        HttpMethod method = request.method();
        try {
            if (HttpMethod.GET.equals(method) && "/events/stream".equals(path)) {
                stream(request);
            } else if (HttpMethod.POST.equals(method) && "/events/ack".equals(path)) {
                acknowledge(request);
            } else if (HttpMethod.GET.equals(method) && "/events/stats".equals(path)) {
                json(request.response(), 200, JsonSupport.toWireJson(broadcaster().stats()));
            } else if (HttpMethod.GET.equals(method) && "/events/zombies".equals(path)) {
                json(request.response(), 200, JsonSupport.toWireJson(broadcaster().zombieReport()));
            } else if (HttpMethod.POST.equals(method) && "/events/zombies/cleanup".equals(path)) {
                json(request.response(), 200, JsonSupport.toWireJson(broadcaster().cleanupZombies()));
            } else {
                error(request.response(), 404, "Not found");
            }
        } catch (RuntimeException e) {
            logger.atError().setCause(e).addArgument(method).addArgument(path).log("Request {} {} failed");
            if (!request.response().headWritten()) {
                error(request.response(), 500, "Internal error");
            }
        }
    }

    private void stream(HttpServerRequest request) {
        Set<Topic> topics;
        try {
            topics = parseTopics(request.getParam("events"));
        } catch (IllegalArgumentException e) {
            error(request.response(), 400, e.getMessage());
            return;
        }

        HttpServerResponse response = request.response();
        response.setChunked(true)
                .putHeader("Content-Type", "text/event-stream")
                .putHeader("Cache-Control", "no-cache")
                .putHeader("X-Accel-Buffering", "no");

        VertxSessionTransport transport = new VertxSessionTransport(response, WRITE_TIMEOUT);
        SubscriberSession session;
        try {
            session = server.connect(transport, topics);
        } catch (IllegalStateException e) {
            error(response, 503, "Server is shutting down");
            return;
        }
        String sessionId = session.id();
        response.closeHandler(v -> {
            logger.atDebug().addArgument(sessionId).log("Client for session {} disconnected");
            server.disconnect(sessionId);
        });
        transport.open(sessionId);
        logger.atDebug().addArgument(sessionId).addArgument(topics).log("Session {} streaming {}");
    }

    /**
     * Parses a comma separated list of topic names. A missing or blank list
     * selects the default topics.
     *
     * @throws IllegalArgumentException if a name is unknown or a liveness
     *                                  topic
     */
    static Set<Topic> parseTopics(String events) {
        if (events == null || events.isBlank()) {
            return Topic.defaults();
        }
        Set<Topic> topics = EnumSet.noneOf(Topic.class);
        for (String name : events.split(",")) {
            String trimmed = name.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            Topic t = Topic.fromWireName(trimmed);
            if (!t.subscribable()) {
                throw new IllegalArgumentException("Cannot subscribe to topic: " + trimmed);
            }
            topics.add(t);
        }
        return topics.isEmpty() ? Topic.defaults() : topics;
    }

    private void acknowledge(HttpServerRequest request) {
        request.body()
                .onSuccess(body -> handleAck(request.response(), body))
                .onFailure(e -> error(request.response(), 400, "Unreadable body"));
    }

    private void handleAck(HttpServerResponse response, Buffer body) {
        JsonObject ack;
        try {
            ack = body.toJsonObject();
        } catch (DecodeException e) {
            error(response, 400, "Body must be a JSON object");
            return;
        }
        String sessionId = ack.getString("session_id");
        String probeId = ack.getString("probe_id");
        if (sessionId == null || probeId == null) {
            error(response, 400, "session_id and probe_id are required");
            return;
        }
        if (!broadcaster().acknowledgeProbe(sessionId, probeId)) {
            error(response, 404, "Unknown session or probe");
            return;
        }
        json(response, 200, new JsonObject().put("status", "ok").encode());
    }

    private EventBroadcaster broadcaster() {
        return server.broadcaster();
    }

    private static void json(HttpServerResponse response, int status, String body) {
        response.setStatusCode(status).putHeader("Content-Type", JSON).end(body);
    }

    private static void error(HttpServerResponse response, int status, String message) {
        json(response, status, new JsonObject().put("error", message).encode());
    }

    @Override
    public void close() throws Exception {
        if (httpServer != null) {
            httpServer.close().toCompletionStage().toCompletableFuture().get(10, TimeUnit.SECONDS);
            logger.atInfo().log("Event stream stopped");
        }
    }
}
