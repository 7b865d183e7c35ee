package io.yahoohistory.financial;

import com.codahale.metrics.MetricRegistry;
import io.yahoohistory.runtime.Completions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Owns the session cookie + crumb pair shared by every download of the process.
 * <p>
 * Reads of a cached pair never lock and never touch the network. At most one acquisition runs at a time;
 * callers that need fresh credentials while one is running share its result. A new pair replaces the old
 * one only once both the cookie and the crumb have been obtained; a failed acquisition leaves the cached
 * pair as it was.
 */
public class CrumbSession {
    private static final Logger log = LoggerFactory.getLogger(CrumbSession.class);

    private final YahooConfig config;
    private final MetricRegistry registry; // optional
    private final Object lock = new Object();
    private volatile SessionCredentials current;
    private CompletableFuture<SessionCredentials> inFlight; // guarded by lock

    public CrumbSession(YahooConfig config) { this(config, null); }

    public CrumbSession(YahooConfig config, MetricRegistry registry) {
        this.config = Objects.requireNonNull(config);
        this.registry = registry;
    }

    /** Process-wide session configured from system properties and environment. */
    public static CrumbSession shared() {
        return Shared.INSTANCE;
    }

    /**
     * Cached credentials, or a new pair when forced or when nothing is cached yet.
     * Fails with {@link AuthException}.
     */
    public CompletableFuture<SessionCredentials> credentials(boolean forceRefresh) {
        return obtain(forceRefresh, null);
    }

    /**
     * Fresh credentials after the service rejected {@code rejected}. If another caller already replaced
     * them, the newer pair is returned without a new acquisition.
     */
    public CompletableFuture<SessionCredentials> renew(SessionCredentials rejected) {
        return obtain(true, Objects.requireNonNull(rejected));
    }

    /** The cached pair, or null before the first acquisition. */
    public SessionCredentials peek() {
        return current;
    }

    private CompletableFuture<SessionCredentials> obtain(boolean force, SessionCredentials rejected) {
        SessionCredentials cached = current;
        if (!force && cached != null) return CompletableFuture.completedFuture(cached);

        CompletableFuture<SessionCredentials> shared;
        boolean start = false;
        synchronized (lock) {
            cached = current;
            boolean usable = cached != null && (!force || (rejected != null && cached != rejected));
            if (usable) return CompletableFuture.completedFuture(cached);
            if (inFlight == null) {
                inFlight = new CompletableFuture<>();
                start = true;
            }
            shared = inFlight;
        }
        if (start) {
            acquire().whenComplete((creds, err) -> {
                synchronized (lock) {
                    if (err == null) current = creds;
                    inFlight = null;
                }
                if (err != null) shared.completeExceptionally(asAuthException(err));
                else shared.complete(creds);
            });
        }
        // a caller cancelling its copy must not cancel the acquisition for everyone else
        return shared.copy();
    }

    private CompletableFuture<SessionCredentials> acquire() {
        if (registry != null) registry.counter("yahoo.crumb.acquisitions").inc();
        log.info("Acquiring Yahoo session cookie and crumb");
        CookieManager cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        HttpClient client = HttpClient.newBuilder()
                .cookieHandler(cookies)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(config.requestTimeout())
                .build();
        return Completions.guard(() -> client.sendAsync(get(config.sessionUri()), HttpResponse.BodyHandlers.discarding()))
                .thenCompose(landing -> {
                    log.debug("session landing {} -> {}", config.sessionUri(), landing.statusCode());
                    if (cookies.getCookieStore().getCookies().isEmpty()) {
                        log.warn("session landing {} set no cookie (status {})", config.sessionUri(), landing.statusCode());
                    }
                    return client.sendAsync(get(config.crumbUri()), HttpResponse.BodyHandlers.ofString());
                })
                .thenApply(resp -> {
                    if (resp.statusCode() != 200) {
                        throw new AuthException("crumb endpoint " + config.crumbUri() + " returned " + resp.statusCode());
                    }
                    SessionCredentials creds = new SessionCredentials(client, cookies, parseCrumb(resp.body()));
                    log.info("Acquired Yahoo crumb ({} cookie(s))", cookies.getCookieStore().getCookies().size());
                    return creds;
                });
    }

    private HttpRequest get(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .GET()
                .build();
    }

    /** The crumb endpoint answers with the bare token; anything else means the session was refused. */
    static String parseCrumb(String body) {
        String crumb = body == null ? "" : body.trim();
        if (crumb.isEmpty()) throw new AuthException("crumb endpoint returned an empty body");
        for (int i = 0; i < crumb.length(); i++) {
            char c = crumb.charAt(i);
            if (Character.isWhitespace(c) || c == '<' || c == '{') {
                throw new AuthException("crumb endpoint returned an unparsable body");
            }
        }
        return crumb;
    }

    private static AuthException asAuthException(Throwable err) {
        Throwable t = Completions.unwrap(err);
        if (t instanceof AuthException a) return a;
        return new AuthException("session acquisition failed: " + t, t);
    }

    private static final class Shared {
        static final CrumbSession INSTANCE = new CrumbSession(YahooConfig.fromEnv());
    }
}
