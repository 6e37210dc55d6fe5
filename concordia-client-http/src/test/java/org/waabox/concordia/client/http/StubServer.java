package org.waabox.concordia.client.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * A local HTTP server answering queued responses per path and recording
 * every request it gets.
 *
 * <p>The last queued response of a path is repeated once the queue holds a
 * single entry. Unknown paths answer 404.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class StubServer implements AutoCloseable {

  /** A request as received. */
  public record Recorded(String method, String path, String query,
      Map<String, String> headers, String body) {

    public String header(final String name) {
      return headers.get(name.toLowerCase());
    }
  }

  private record Response(int status, String body) {
  }

  private final HttpServer server;

  private final Map<String, Deque<Response>> responses = new HashMap<>();

  private final List<Recorded> requests = new CopyOnWriteArrayList<>();

  public StubServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
    server.createContext("/", this::handle);
    server.start();
  }

  public String baseUrl() {
    return "http://localhost:" + server.getAddress().getPort();
  }

  public synchronized StubServer respond(final String path, final int status,
      final String body) {
    responses.computeIfAbsent(path, k -> new ArrayDeque<>())
        .add(new Response(status, body));
    return this;
  }

  public List<Recorded> requests() {
    return requests;
  }

  public List<Recorded> requests(final String path) {
    return requests.stream().filter(r -> r.path().equals(path)).toList();
  }

  private void handle(final HttpExchange exchange) throws IOException {
    final String body;
    try (InputStream is = exchange.getRequestBody()) {
      body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
    }
    final Map<String, String> headers = new HashMap<>();
    exchange.getRequestHeaders().forEach((name, values) ->
        headers.put(name.toLowerCase(), values.get(0)));
    final String path = exchange.getRequestURI().getPath();
    requests.add(new Recorded(exchange.getRequestMethod(), path,
        exchange.getRequestURI().getRawQuery(), headers, body));

    final Response response = next(path);
    final byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
    exchange.sendResponseHeaders(response.status(),
        bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  private synchronized Response next(final String path) {
    final Deque<Response> queue = responses.get(path);
    if (queue == null || queue.isEmpty()) {
      return new Response(404, "{\"error\":\"not found\"}");
    }
    return queue.size() > 1 ? queue.poll() : queue.peek();
  }

  @Override
  public void close() {
    server.stop(0);
  }
}
