package io.taulite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.taulite.core.Delta;
import io.taulite.core.TruncatedRecordException;
import io.taulite.core.lens.LensException;
import io.taulite.server.catalog.CatalogException;
import io.taulite.server.catalog.TauCatalog;
import io.taulite.server.dto.*;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link TauCatalog}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert catalog results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /admin/health
 *   - GET    /series                       list labels
 *   - POST   /series/{label}               create from {"deltas":[...]}
 *   - POST   /series/{label}/append        append {"deltas":[...]}
 *   - GET    /series/{label}               whole series | ?at=t | ?from=a&until=b
 *   - DELETE /series/{label}
 *   - GET    /groups                       list labels
 *   - POST   /groups/{label}               create from {"series":[...]}
 *   - POST   /groups/{label}/append        append {"series":[...]}
 *   - GET    /groups/{label}               whole group | ?lens=l apply lens to each member
 *   - DELETE /groups/{label}
 *   - GET    /lenses                       list labels
 *   - POST   /lenses/{label}               built-in or expression lens
 *   - POST   /lenses/{label}/compose       {"inputsFrom":..,"expressionFrom":..}
 *   - GET    /lenses/{label}               apply | ?at=t point query
 *   - DELETE /lenses/{label}
 *
 * Status mapping: bad input 400, unknown label 404, duplicate label or
 * unresolvable lens input 409, oversized body 413, full catalog 507, anything else 500.
 */
public final class WebServer {
    public static final int DEFAULT_MAX_BODY_BYTES = ServerConfig.DEFAULT_MAX_PAYLOAD_BYTES;

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final TauCatalog catalog;
    private final int maxBodyBytes;

    public WebServer(int port, TauCatalog catalog) {
        this(port, catalog, DEFAULT_MAX_BODY_BYTES);
    }

    public WebServer(int port, TauCatalog catalog, int maxBodyBytes) {
        this.catalog = catalog;
        this.maxBodyBytes = maxBodyBytes;
        // catalog calls may fsync, so requests run on worker threads in blocking mode
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(new BlockingHandler(this::route))
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** One routed request: returns the status and the body to serialize. */
    @FunctionalInterface
    private interface Action {
        Reply run() throws Exception;
    }

    private record Reply(int status, Object body) {
        static Reply ok(Object body) {
            return new Reply(200, body);
        }

        static Reply created(Object body) {
            return new Reply(201, body);
        }
    }

    private static final class BodyTooLargeException extends RuntimeException {
        BodyTooLargeException(int limit) {
            super("request body too large (limit " + limit + " bytes)");
        }
    }

    private void route(HttpServerExchange ex) {
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        List<String> parts = segments(path);
        String resource = parts.isEmpty() ? "" : parts.get(0);
        String label = parts.size() > 1 ? parts.get(1) : null;
        String sub = parts.size() > 2 ? parts.get(2) : null;

        if (parts.size() > 3 || (parts.size() == 3 && !("append".equals(sub) || "compose".equals(sub)))) {
            respond(ex, () -> new Reply(404, Map.of("error", "not found")));
            return;
        }

        switch (resource) {
            case "admin" -> {
                if ("health".equals(label) && "GET".equals(method)) {
                    respond(ex, () -> Reply.ok(Map.of("status", "ok")));
                } else {
                    respond(ex, () -> new Reply(404, Map.of("error", "not found")));
                }
            }
            case "series" -> respond(ex, () -> series(ex, method, label, sub));
            case "groups" -> respond(ex, () -> groups(ex, method, label, sub));
            case "lenses" -> respond(ex, () -> lenses(ex, method, label, sub));
            default -> respond(ex, () -> new Reply(404, Map.of("error", "not found")));
        }
    }

    // ---------- handlers ----------

    private Reply series(HttpServerExchange ex, String method, String label, String sub) throws IOException {
        if (label == null) {
            return "GET".equals(method) ? Reply.ok(catalog.listSeries()) : notAllowed();
        }
        if ("append".equals(sub)) {
            if (!"POST".equals(method)) return notAllowed();
            int size = catalog.append(label, deltas(read(ex, DeltasRequest.class)));
            return Reply.ok(Map.of("label", label, "size", size));
        }
        if (sub != null) return new Reply(404, Map.of("error", "not found"));
        switch (method) {
            case "POST" -> {
                List<Delta> deltas = deltas(read(ex, DeltasRequest.class));
                catalog.createSeries(label, deltas);
                return Reply.created(Map.of("label", label, "size", deltas.size()));
            }
            case "GET" -> {
                String at = query(ex, "at");
                String from = query(ex, "from");
                String until = query(ex, "until");
                if (at != null) {
                    return Reply.ok(PointResponse.of(catalog.queryPoint(label, Long.parseUnsignedLong(at))));
                }
                if (from != null || until != null) {
                    if (from == null || until == null) {
                        throw new IllegalArgumentException("range query needs both from and until");
                    }
                    List<Delta> hits = catalog.range(label, Long.parseUnsignedLong(from), Long.parseUnsignedLong(until));
                    return Reply.ok(hits.stream().map(DeltaView::of).toList());
                }
                return Reply.ok(SequenceView.of(catalog.series(label)));
            }
            case "DELETE" -> {
                catalog.dropSeries(label);
                return Reply.ok(Map.of("dropped", label));
            }
            default -> {
                return notAllowed();
            }
        }
    }

    private Reply groups(HttpServerExchange ex, String method, String label, String sub) throws IOException {
        if (label == null) {
            return "GET".equals(method) ? Reply.ok(catalog.listGroups()) : notAllowed();
        }
        if ("append".equals(sub)) {
            if (!"POST".equals(method)) return notAllowed();
            int size = catalog.appendToGroup(label, seriesLabels(read(ex, GroupRequest.class)));
            return Reply.ok(Map.of("label", label, "size", size));
        }
        if (sub != null) return new Reply(404, Map.of("error", "not found"));
        switch (method) {
            case "POST" -> {
                List<String> members = seriesLabels(read(ex, GroupRequest.class));
                catalog.createGroup(label, members);
                return Reply.created(Map.of("label", label, "size", members.size()));
            }
            case "GET" -> {
                String lens = query(ex, "lens");
                return Reply.ok(GroupView.of(lens == null
                        ? catalog.group(label)
                        : catalog.applyLensToGroup(lens, label)));
            }
            case "DELETE" -> {
                catalog.dropGroup(label);
                return Reply.ok(Map.of("dropped", label));
            }
            default -> {
                return notAllowed();
            }
        }
    }

    private Reply lenses(HttpServerExchange ex, String method, String label, String sub) throws IOException {
        if (label == null) {
            return "GET".equals(method) ? Reply.ok(catalog.listLenses()) : notAllowed();
        }
        if ("compose".equals(sub)) {
            if (!"POST".equals(method)) return notAllowed();
            ComposeRequest req = read(ex, ComposeRequest.class);
            catalog.composeLens(label, req.inputsFrom, req.expressionFrom);
            return Reply.created(catalog.lensDefinition(label));
        }
        if (sub != null) return new Reply(404, Map.of("error", "not found"));
        switch (method) {
            case "POST" -> {
                LensRequest req = read(ex, LensRequest.class);
                if (req.isBuiltin()) {
                    catalog.createLens(label, req.source, req.transform);
                } else {
                    catalog.defineLens(label, req.description, req.expression,
                            req.inputs == null ? Map.of() : req.inputs);
                }
                return Reply.created(catalog.lensDefinition(label));
            }
            case "GET" -> {
                String at = query(ex, "at");
                if (at != null) {
                    return Reply.ok(PointResponse.of(catalog.queryLens(label, Long.parseUnsignedLong(at))));
                }
                return Reply.ok(SequenceView.of(catalog.applyLens(label)));
            }
            case "DELETE" -> {
                catalog.dropLens(label);
                return Reply.ok(Map.of("dropped", label));
            }
            default -> {
                return notAllowed();
            }
        }
    }

    // ---------- plumbing ----------

    private void respond(HttpServerExchange ex, Action action) {
        long start = System.nanoTime();
        int status;
        Throwable error = null;
        Object body;
        try {
            Reply reply = action.run();
            status = reply.status();
            body = reply.body();
        } catch (BodyTooLargeException tooLarge) {
            status = 413;
            error = tooLarge;
            body = Map.of("error", "request body too large");
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            body = Map.of("error", "invalid JSON", "message", String.valueOf(jsonEx.getOriginalMessage()));
        } catch (Exception e) {
            status = statusFor(e);
            error = e;
            body = status == 500
                    ? Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage()))
                    : Map.of("error", String.valueOf(e.getMessage()));
        }
        send(ex, status, body);
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), ex.getStatusCode(), totalMs, error);
    }

    static int statusFor(Throwable e) {
        if (e instanceof CatalogException c) {
            if (c.isNotFound()) return 404;
            if (c.isConflict()) return 409;
            if (c.reason() == CatalogException.Reason.CATALOG_FULL) return 507;
            return 400;
        }
        if (e instanceof LensException) return 409;
        if (e instanceof TruncatedRecordException) return 400;
        // ValidationException, ExpressionException, NumberFormatException
        if (e instanceof IllegalArgumentException) return 400;
        return 500;
    }

    private <T> T read(HttpServerExchange ex, Class<T> type) throws IOException {
        byte[] data = readBody(ex);
        if (data.length == 0) {
            throw new IllegalArgumentException("request body must not be empty");
        }
        return json.readValue(data, type);
    }

    private byte[] readBody(HttpServerExchange ex) throws IOException {
        try (InputStream in = ex.getInputStream()) {
            byte[] data = in.readNBytes(maxBodyBytes + 1);
            if (data.length > maxBodyBytes) {
                throw new BodyTooLargeException(maxBodyBytes);
            }
            return data;
        }
    }

    private static List<Delta> deltas(DeltasRequest req) {
        if (req.deltas == null) {
            throw new IllegalArgumentException("deltas must be present");
        }
        List<Delta> out = new ArrayList<>(req.deltas.size());
        for (DeltaRequest d : req.deltas) {
            if (d == null) throw new IllegalArgumentException("delta must not be null");
            out.add(Delta.create(d.value, d.validFromNs, d.validUntilNs));
        }
        return out;
    }

    private static List<String> seriesLabels(GroupRequest req) {
        if (req.series == null) {
            throw new IllegalArgumentException("series must be present");
        }
        return req.series;
    }

    private static String query(HttpServerExchange ex, String name) {
        Deque<String> values = ex.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.peekFirst();
    }

    private static List<String> segments(String path) {
        List<String> out = new ArrayList<>();
        for (String s : path.split("/")) {
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    private static Reply notAllowed() {
        return new Reply(405, Map.of("error", "method not allowed"));
    }

    private void send(HttpServerExchange ex, int code, Object body) {
        ex.setStatusCode(code);
        try {
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
            RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), 500, 0, e);
        }
    }
}
