package com.alertsentinel.core.notification;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Loopback HTTP endpoint for channel tests. Records every request body and
 * answers with a configurable status.
 */
public final class LocalHttpEndpoint implements AutoCloseable {

    private final HttpServer server;
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private final Map<String, String> lastHeaders = new ConcurrentHashMap<>();
    private final AtomicBoolean stopped = new AtomicBoolean();
    private volatile int status = 200;
    private volatile String responseBody = "ok";
    private volatile long delayMs;

    private LocalHttpEndpoint(HttpServer server) {
        this.server = server;
    }

    public static LocalHttpEndpoint start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        LocalHttpEndpoint endpoint = new LocalHttpEndpoint(server);
        server.createContext("/", exchange -> {
            try (InputStream in = exchange.getRequestBody()) {
                endpoint.bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            exchange.getRequestHeaders().forEach((k, v) -> endpoint.lastHeaders.put(k.toLowerCase(Locale.ROOT), v.get(0)));
            if (endpoint.delayMs > 0) {
                try {
                    Thread.sleep(endpoint.delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            byte[] response = endpoint.responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(endpoint.status, response.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(response);
            }
        });
        server.start();
        return endpoint;
    }

    public String url() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/hook";
    }

    public LocalHttpEndpoint respondWith(int status, String body) {
        this.status = status;
        this.responseBody = body;
        return this;
    }

    public LocalHttpEndpoint respondAfter(Duration delay) {
        this.delayMs = delay.toMillis();
        return this;
    }

    public List<String> bodies() {
        return bodies;
    }

    public String header(String name) {
        return lastHeaders.get(name.toLowerCase(Locale.ROOT));
    }

    @Override
    public void close() {
        if (stopped.compareAndSet(false, true)) {
            server.stop(0);
        }
    }
}
