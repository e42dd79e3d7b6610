package com.sunorcnys;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Local HTTP endpoint receiving the provider's authorization redirect. Serves one callback, then stops.
 */
public class OAuthCallbackServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(OAuthCallbackServer.class);

    public record Callback(String code, String state) {}

    private final HttpServer server;
    private final ExecutorService executor;
    private final CompletableFuture<Callback> result = new CompletableFuture<>();

    private OAuthCallbackServer(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    public static OAuthCallbackServer start(int port) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", port), 0);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        OAuthCallbackServer callback = new OAuthCallbackServer(server, executor);
        server.createContext("/callback", callback::handle);
        server.setExecutor(executor);
        server.start();
        log.info("Waiting for OAuth callback on http://127.0.0.1:{}/callback", server.getAddress().getPort());
        return callback;
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /**
     * Blocks until the browser hits the callback.
     *
     * @throws IOException when the provider redirected with an error or nothing arrived in time
     */
    public Callback await(Duration timeout) throws IOException, InterruptedException {
        try {
            return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IOException(e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("No OAuth callback within " + timeout.toSeconds() + "s", e);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdown();
    }

    private void handle(HttpExchange exchange) throws IOException {
        Map<String, String> params = parseQuery(exchange.getRequestURI().getRawQuery());
        String error = params.get("error");
        String code = params.get("code");
        if (error != null) {
            respond(exchange, 400, "Authorization failed: " + error);
            result.completeExceptionally(new IOException("Provider returned error '" + error + "'"));
            return;
        }
        if (code == null || code.isBlank()) {
            respond(exchange, 400, "No 'code' in the callback URL, please try again.");
            return;
        }
        respond(exchange, 200, "Login complete. You can close this window.");
        result.complete(new Callback(code, params.get("state")));
    }

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isBlank()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8), URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static void respond(HttpExchange exchange, int status, String text) throws IOException {
        byte[] body = ("<html><body style=\"font-family:sans-serif\"><p>" + text + "</p></body></html>")
                .getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
