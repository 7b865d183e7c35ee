package io.yahoohistory.financial;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import io.yahoohistory.core.AsyncTransform;
import io.yahoohistory.core.Record;
import io.yahoohistory.retry.BoundedRetryPolicy;
import io.yahoohistory.retry.RetryPolicy;
import io.yahoohistory.runtime.CancellationSignal;
import io.yahoohistory.runtime.Completions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

/**
 * Downloads and decodes one symbol within a fetch call.
 * <p>
 * Requesting with the cached credentials either ends the fetch (200: decoded ticks, 404: absent) or fails it.
 * A 401 on the first attempt renews the credentials and requests once more; a second 401 is final.
 * The cancellation signal is checked before each request, before the retry and on every decoded row.
 */
final class SymbolFetch implements AsyncTransform<FetchRequest, Optional<List<Tick>>> {
    private static final Logger log = LoggerFactory.getLogger(SymbolFetch.class);

    static final RetryPolicy RETRY_UNAUTHORIZED_ONCE =
            new BoundedRetryPolicy(2, e -> e instanceof TransportException t && t.isUnauthorized());

    private final CrumbSession session;
    private final YahooConfig config;
    private final Executor decodeExecutor;
    private final MetricRegistry registry; // optional
    private final CancellationSignal signal;
    private final RetryPolicy retry;

    SymbolFetch(CrumbSession session, YahooConfig config, Executor decodeExecutor, MetricRegistry registry,
                CancellationSignal signal) {
        this.session = session;
        this.config = config;
        this.decodeExecutor = decodeExecutor;
        this.registry = registry;
        this.signal = signal;
        this.retry = RETRY_UNAUTHORIZED_ONCE;
    }

    @Override
    public CompletionStage<Optional<List<Tick>>> applyAsync(Record<FetchRequest> input) {
        FetchRequest req = input.payload();
        Timer.Context timer = registry != null ? registry.timer("yahoo.fetch.time").time() : null;
        CompletableFuture<Optional<List<Tick>>> out = attempt(req, 1, session.credentials(false));
        return out.whenComplete((ticks, err) -> {
            if (timer != null) timer.stop();
            if (err == null) return;
            Throwable t = Completions.unwrap(err);
            if (t instanceof CancellationException) return;
            if (registry != null) registry.counter("yahoo.fetch.failures").inc();
            log.warn("{}: fetch failed: {}", req.symbol(), t.toString());
        });
    }

    private CompletableFuture<Optional<List<Tick>>> attempt(FetchRequest req, int attempt,
                                                           CompletableFuture<SessionCredentials> credentials) {
        return credentials.thenCompose(creds -> request(req, creds).exceptionallyCompose(err -> {
            Throwable t = Completions.unwrap(err);
            if (!retry.shouldRetry(attempt, t)) return Completions.failed(t);
            if (signal.isCancelled()) return Completions.failed(new CancellationException("cancelled"));
            if (registry != null) registry.counter("yahoo.fetch.unauthorized").inc();
            log.warn("{}: unauthorized, renewing crumb and retrying", req.symbol());
            return attempt(req, attempt + 1, session.renew(creds));
        }));
    }

    private CompletableFuture<Optional<List<Tick>>> request(FetchRequest req, SessionCredentials creds) {
        if (signal.isCancelled()) return Completions.failed(new CancellationException("cancelled"));
        URI uri = DownloadUrls.build(config.downloadUri(), req, creds.crumb());
        if (log.isDebugEnabled()) log.debug("GET {}", uri.toString().replace(creds.crumb(), "***"));
        if (registry != null) registry.counter("yahoo.fetch.requests").inc();

        HttpRequest httpReq = HttpRequest.newBuilder(uri)
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .GET()
                .build();
        CompletableFuture<HttpResponse<InputStream>> sent =
                creds.client().sendAsync(httpReq, HttpResponse.BodyHandlers.ofInputStream());
        Runnable unregister = signal.onCancel(() -> sent.cancel(true));
        return sent
                .exceptionallyCompose(err -> Completions.failed(transportFailure(req, err)))
                .thenApplyAsync(resp -> respond(req, resp), decodeExecutor)
                .whenComplete((ticks, err) -> unregister.run());
    }

    private Optional<List<Tick>> respond(FetchRequest req, HttpResponse<InputStream> resp) {
        int status = resp.statusCode();
        if (status == 200) return Optional.of(decode(req, resp.body()));
        discard(req, resp.body());
        if (status == 404) {
            if (registry != null) registry.counter("yahoo.fetch.notFound").inc();
            log.debug("{}: not found", req.symbol());
            return Optional.empty();
        }
        throw new TransportException(req.symbol(), status, req.symbol() + ": download returned HTTP " + status);
    }

    private List<Tick> decode(FetchRequest req, InputStream body) {
        Runnable unregister = signal.onCancel(() -> discard(req, body));
        try (TickReader reader = TickCsvDecoder.decode(body, req.variant())) {
            List<Tick> ticks = new ArrayList<>();
            while (reader.hasNext()) {
                signal.throwIfCancelled();
                ticks.add(reader.next());
            }
            if (registry != null) registry.counter("yahoo.rows.decoded").inc(ticks.size());
            if (reader.dropped() > 0) log.debug("{}: dropped {} unparsable row(s)", req.symbol(), reader.dropped());
            return Collections.unmodifiableList(ticks);
        } catch (IOException | UncheckedIOException e) {
            if (signal.isCancelled()) throw new CancellationException("cancelled");
            throw new TransportException(req.symbol(), req.symbol() + ": failed reading response body", e);
        } finally {
            unregister.run();
        }
    }

    private Throwable transportFailure(FetchRequest req, Throwable err) {
        Throwable t = Completions.unwrap(err);
        if (t instanceof CancellationException || signal.isCancelled()) return new CancellationException("cancelled");
        return new TransportException(req.symbol(), req.symbol() + ": request failed: " + t, t);
    }

    private static void discard(FetchRequest req, InputStream body) {
        try {
            body.close();
        } catch (IOException e) {
            log.debug("{}: closing response body failed", req.symbol(), e);
        }
    }
}
