package com.mediafleet.manager.http;

import com.mediafleet.core.error.InvalidStateTransitionException;
import com.mediafleet.core.error.NodeNotFoundException;
import com.mediafleet.core.error.UsageUnderflowException;
import com.mediafleet.core.model.MediaNode;
import com.mediafleet.core.util.JsonUtils;
import com.mediafleet.manager.config.ManagerConfig;
import com.mediafleet.manager.lifecycle.IMediaNodeManager;
import com.mediafleet.manager.metrics.PrometheusMetricsExporter;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;
import reactor.netty.http.server.HttpServerRoutes;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * HTTP server for media fleet endpoints.
 * <p>
 * Session routers that cannot link the manager in-process report usage through
 * the {@code /sessions} routes; operators inspect the fleet and drop idle nodes.
 * </p>
 */
public class HttpServer {
    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private static final String NODE_ROUTE = "/api/v1/media-nodes/{id}";

    private final ManagerConfig config;
    private final IMediaNodeManager manager;
    private final PrometheusMetricsExporter metricsExporter;

    private DisposableServer server;

    public HttpServer(ManagerConfig config, IMediaNodeManager manager, PrometheusMetricsExporter metricsExporter) {
        this.config = config;
        this.manager = manager;
        this.metricsExporter = metricsExporter;
    }

    /**
     * Starts the HTTP server.
     *
     * @return the bound server
     */
    public DisposableServer start() {
        server = reactor.netty.http.server.HttpServer.create()
            .port(config.getHttpPort())
            .route(this::configureRoutes)
            .bind()
            .doOnNext(bound -> log.info("HTTP server started on port {}", bound.port()))
            .doOnError(err -> log.error("Failed to start HTTP server", err))
            .block(Duration.ofSeconds(45));

        return server;
    }

    public void stop() {
        if (server != null) {
            server.disposeNow(Duration.ofSeconds(20));
        }
    }

    private void configureRoutes(HttpServerRoutes routes) {
        routes
            // Health check
            .get("/healthz", (req, res) ->
                res.status(200).sendString(Mono.just("OK"))
            )
            // Metrics endpoint
            .get("/metrics", (req, res) ->
                res.addHeader("Content-Type", "text/plain; version=0.0.4; charset=utf-8")
                    .sendString(Mono.just(metricsExporter.scrape()))
                    .then()
            )
            // Registry snapshot
            .get("/api/v1/media-nodes", (req, res) ->
                respond(res, () -> {
                    List<MediaNode> nodes = manager.getMediaNodes();
                    Map<String, Object> response = new HashMap<>();
                    response.put("count", nodes.size());
                    response.put("nodes", nodes);
                    return response;
                })
            )
            // Single node
            .get(NODE_ROUTE, (req, res) ->
                respond(res, () -> requireNode(req))
            )
            // Session attached
            .post(NODE_ROUTE + "/sessions", (req, res) ->
                respond(res, () -> {
                    MediaNode node = requireNode(req);
                    manager.mediaNodeUsageRegistration(node, System.currentTimeMillis(), manager.getMediaNodes());
                    return requireNode(req);
                })
            )
            // Session detached
            .delete(NODE_ROUTE + "/sessions", (req, res) ->
                respond(res, () -> {
                    MediaNode node = requireNode(req);
                    manager.mediaNodeUsageDeregistration(node, System.currentTimeMillis());
                    return requireNode(req);
                })
            )
            // Drop an idle node
            .post(NODE_ROUTE + "/drop", (req, res) ->
                respond(res, () -> {
                    String id = req.param("id");
                    manager.dropIdleMediaNode(id);
                    Map<String, Object> response = new HashMap<>();
                    response.put("nodeId", id);
                    response.put("terminating", manager.isTerminating(id));
                    return response;
                })
            );
    }

    private MediaNode requireNode(HttpServerRequest req) {
        String id = req.param("id");
        return manager.getMediaNode(id).orElseThrow(() -> new NodeNotFoundException(id));
    }

    private Mono<Void> respond(HttpServerResponse res, Callable<Object> action) {
        return Mono.fromCallable(() -> JsonUtils.writeValueAsString(action.call()))
            .flatMap(json ->
                res.header("Content-Type", "application/json")
                    .sendString(Mono.just(json)).then()
            )
            .onErrorResume(err -> {
                HttpResponseStatus status = statusFor(err);
                if (status == HttpResponseStatus.INTERNAL_SERVER_ERROR) {
                    log.error("Request failed", err);
                }
                return res.status(status)
                    .header("Content-Type", "application/json")
                    .sendString(Mono.just(errorBody(err))).then();
            });
    }

    static HttpResponseStatus statusFor(Throwable err) {
        if (err instanceof NodeNotFoundException) {
            return HttpResponseStatus.NOT_FOUND;
        }
        if (err instanceof InvalidStateTransitionException || err instanceof UsageUnderflowException) {
            return HttpResponseStatus.CONFLICT;
        }
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }

    static String errorBody(Throwable err) {
        Map<String, Object> body = new HashMap<>();
        body.put("error", String.valueOf(err.getMessage()));
        return JsonUtils.writeValueAsString(body);
    }
}
