package io.yahoohistory.financial;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for the quote service: a landing page that sets the session cookie, a crumb endpoint
 * and the CSV download endpoint. Downloads require the cookie and the most recently issued crumb.
 */
final class FakeYahooServer implements AutoCloseable {
    static final String DOWNLOAD_PATH = "/v7/finance/download/";

    final AtomicInteger landingHits = new AtomicInteger();
    final AtomicInteger crumbHits = new AtomicInteger();
    final AtomicInteger downloadHits = new AtomicInteger();
    final List<Map<String, String>> downloadQueries = new CopyOnWriteArrayList<>();
    /** The next n downloads answer 401 whatever their credentials. */
    final AtomicInteger rejectNextDownloads = new AtomicInteger();

    private final HttpServer server;
    private final ExecutorService exec = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "fake-yahoo");
        t.setDaemon(true);
        return t;
    });
    private final Map<String, String> bodies = new ConcurrentHashMap<>();
    private final Map<String, Integer> statuses = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private volatile String issuedCrumb;
    private volatile int crumbStatus = 200;
    private volatile String crumbBody; // null: issue crumb-<n>
    private volatile CountDownLatch crumbGate;

    FakeYahooServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.setExecutor(exec);
        server.createContext("/", this::landing);
        server.createContext("/v1/test/getcrumb", this::crumb);
        server.createContext(DOWNLOAD_PATH, this::download);
        server.start();
    }

    URI root() {
        return URI.create("http://127.0.0.1:" + server.getAddress().getPort());
    }

    YahooConfig config() {
        return YahooConfig.defaults().withHost(root());
    }

    FakeYahooServer csv(String symbol, TickVariant variant, String body) {
        bodies.put(symbol + "|" + variant.events(), body);
        return this;
    }

    FakeYahooServer status(String symbol, int status) {
        statuses.put(symbol, status);
        return this;
    }

    FakeYahooServer delay(String symbol, Duration delay) {
        delays.put(symbol, delay);
        return this;
    }

    void crumbResponse(int status, String body) {
        this.crumbStatus = status;
        this.crumbBody = body;
    }

    /** Holds crumb responses until the latch opens. */
    void gateCrumbs(CountDownLatch gate) {
        this.crumbGate = gate;
    }

    String issuedCrumb() {
        return issuedCrumb;
    }

    private void landing(HttpExchange ex) throws IOException {
        int n = landingHits.incrementAndGet();
        ex.getResponseHeaders().add("Set-Cookie", "B=session-" + n + "; Path=/");
        send(ex, 404, "");
    }

    private void crumb(HttpExchange ex) throws IOException {
        int n = crumbHits.incrementAndGet();
        CountDownLatch gate = crumbGate;
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (!hasSessionCookie(ex)) {
            send(ex, 401, "no session");
            return;
        }
        if (crumbStatus != 200) {
            send(ex, crumbStatus, "error");
            return;
        }
        String body = crumbBody != null ? crumbBody : "crumb-" + n;
        issuedCrumb = body.trim();
        send(ex, 200, body);
    }

    private void download(HttpExchange ex) throws IOException {
        downloadHits.incrementAndGet();
        String raw = ex.getRequestURI().getRawPath().substring(DOWNLOAD_PATH.length());
        String symbol = URLDecoder.decode(raw, StandardCharsets.UTF_8);
        Map<String, String> query = query(ex.getRequestURI().getRawQuery());
        query.put("symbol", symbol);
        downloadQueries.add(query);

        Duration delay = delays.get(symbol);
        if (delay != null) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (rejectNextDownloads.getAndUpdate(v -> Math.max(0, v - 1)) > 0
                || !hasSessionCookie(ex) || issuedCrumb == null || !issuedCrumb.equals(query.get("crumb"))) {
            send(ex, 401, "{\"finance\":{\"error\":{\"code\":\"Unauthorized\"}}}");
            return;
        }
        Integer status = statuses.get(symbol);
        if (status != null) {
            send(ex, status, "error");
            return;
        }
        String body = bodies.get(symbol + "|" + query.get("events"));
        if (body == null) {
            send(ex, 404, "404 Not Found: No data found, symbol may be delisted");
            return;
        }
        send(ex, 200, body);
    }

    private static boolean hasSessionCookie(HttpExchange ex) {
        List<String> cookies = ex.getRequestHeaders().get("Cookie");
        return cookies != null && cookies.stream().anyMatch(c -> c.contains("B=session-"));
    }

    private static Map<String, String> query(String raw) {
        Map<String, String> out = new HashMap<>();
        if (raw == null) return out;
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            if (eq < 0) continue;
            out.put(URLDecoder.decode(pair.substring(0, eq), StandardCharsets.UTF_8),
                    URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8));
        }
        return out;
    }

    private static void send(HttpExchange ex, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            if (bytes.length > 0) os.write(bytes);
        }
    }

    @Override
    public void close() {
        server.stop(0);
        exec.shutdownNow();
    }
}
