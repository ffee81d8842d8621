package org.Aayush.allocator.testutil;

import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * In-process HTTP server that replays scripted responses and records request uris.
 *
 * <p>Responses are served in order; the last one repeats once the script runs out.</p>
 */
public final class StubHttpServer implements AutoCloseable {
    private final HttpServer server;
    private final ConcurrentLinkedDeque<Reply> script = new ConcurrentLinkedDeque<>();
    private final List<URI> requests = Collections.synchronizedList(new ArrayList<>());
    private volatile Reply last = new Reply(500, "{}");

    private StubHttpServer(HttpServer server) {
        this.server = server;
    }

    public static StubHttpServer start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        StubHttpServer stub = new StubHttpServer(server);
        server.createContext("/", exchange -> {
            stub.requests.add(exchange.getRequestURI());
            Reply reply = stub.script.pollFirst();
            if (reply == null) {
                reply = stub.last;
            } else {
                stub.last = reply;
            }
            byte[] body = reply.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(reply.status(), body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.start();
        return stub;
    }

    public StubHttpServer reply(int status, String body) {
        script.addLast(new Reply(status, body));
        return this;
    }

    public String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    public List<URI> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    @Override
    public void close() {
        server.stop(0);
    }

    private record Reply(int status, String body) {
    }
}
