package io.yahoohistory.financial;

import com.codahale.metrics.MetricRegistry;
import io.yahoohistory.runtime.CancellationSignal;
import io.yahoohistory.runtime.Completions;
import io.yahoohistory.runtime.FanOut;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

/**
 * Downloads price history, dividends or splits for many symbols at once.
 * <p>
 * Every symbol is fetched concurrently. The resulting map follows the input order; a symbol the service does
 * not know maps to {@link Optional#empty()}, while a known symbol without rows in the period maps to an empty
 * list. Any other per-symbol failure fails the whole call once every symbol has settled. Cancelling the
 * signal, or the returned future, fails the call with {@link java.util.concurrent.CancellationException}.
 * <p>
 * Symbol lists are validated before any request is made and rejected with {@link SymbolValidationException}.
 * <p>
 * Each instance owns a pool of decoding threads. Whoever created it, or the application holding the injector
 * that provided it, must {@link #close()} it; a closed instance rejects new calls.
 */
public class YahooHistory implements AutoCloseable {
    private final CrumbSession session;
    private final YahooConfig config;
    private final MetricRegistry registry; // optional
    private final ExecutorService decodeExecutor;
    private volatile boolean closed;

    /** Uses the process-wide session and configuration from system properties and environment. */
    public YahooHistory() {
        this(CrumbSession.shared(), YahooConfig.fromEnv(), null);
    }

    public YahooHistory(CrumbSession session, YahooConfig config, MetricRegistry registry) {
        this.session = Objects.requireNonNull(session);
        this.config = Objects.requireNonNull(config);
        this.registry = registry;
        this.decodeExecutor = Executors.newFixedThreadPool(config.ioThreads(), r -> {
            Thread t = new Thread(r, "yahoo-history-io");
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<Map<String, Optional<List<Tick>>>> fetchMany(List<String> symbols, PeriodSpec period,
                                                                         Frequency frequency, TickVariant variant) {
        return fetchMany(symbols, period, frequency, variant, new CancellationSignal());
    }

    public CompletableFuture<Map<String, Optional<List<Tick>>>> fetchMany(List<String> symbols, PeriodSpec period,
                                                                         Frequency frequency, TickVariant variant,
                                                                         CancellationSignal signal) {
        if (closed) throw new IllegalStateException("closed");
        List<String> checked = validate(symbols);
        Objects.requireNonNull(period, "period");
        Objects.requireNonNull(frequency, "frequency");
        Objects.requireNonNull(variant, "variant");
        Objects.requireNonNull(signal, "signal");

        List<FetchRequest> requests = checked.stream()
                .map(s -> new FetchRequest(s, period, frequency, variant))
                .toList();
        SymbolFetch fetch = new SymbolFetch(session, config, decodeExecutor, registry, signal);
        return Completions.derive(new FanOut<>(fetch).run(requests, signal), results -> {
            Map<String, Optional<List<Tick>>> bySymbol = new LinkedHashMap<>();
            for (int i = 0; i < checked.size(); i++) bySymbol.put(checked.get(i), results.get(i));
            return Collections.unmodifiableMap(bySymbol);
        });
    }

    public CompletableFuture<Map<String, Optional<List<HistoryTick>>>> history(List<String> symbols, PeriodSpec period) {
        return history(symbols, period, Frequency.DAILY);
    }

    public CompletableFuture<Map<String, Optional<List<HistoryTick>>>> history(List<String> symbols, PeriodSpec period,
                                                                              Frequency frequency) {
        return Completions.derive(fetchMany(symbols, period, frequency, TickVariant.HISTORY), m -> narrow(m, HistoryTick.class));
    }

    public CompletableFuture<Map<String, Optional<List<DividendTick>>>> dividends(List<String> symbols, PeriodSpec period) {
        return Completions.derive(fetchMany(symbols, period, Frequency.DAILY, TickVariant.DIVIDEND), m -> narrow(m, DividendTick.class));
    }

    public CompletableFuture<Map<String, Optional<List<SplitTick>>>> splits(List<String> symbols, PeriodSpec period) {
        return Completions.derive(fetchMany(symbols, period, Frequency.DAILY, TickVariant.SPLIT), m -> narrow(m, SplitTick.class));
    }

    public CompletableFuture<Optional<List<HistoryTick>>> history(String symbol, PeriodSpec period) {
        return history(symbol, period, Frequency.DAILY);
    }

    public CompletableFuture<Optional<List<HistoryTick>>> history(String symbol, PeriodSpec period, Frequency frequency) {
        return Completions.derive(history(List.of(checkSymbol(symbol)), period, frequency), m -> m.get(symbol));
    }

    public CompletableFuture<Optional<List<DividendTick>>> dividends(String symbol, PeriodSpec period) {
        return Completions.derive(dividends(List.of(checkSymbol(symbol)), period), m -> m.get(symbol));
    }

    public CompletableFuture<Optional<List<SplitTick>>> splits(String symbol, PeriodSpec period) {
        return Completions.derive(splits(List.of(checkSymbol(symbol)), period), m -> m.get(symbol));
    }

    /**
     * Rejects null, empty, blank and duplicate input. Duplicates are matched case-sensitively and all reported
     * in one message, e.g. {@code Duplicate symbol(s): "C", "X".}
     */
    static List<String> validate(List<String> symbols) {
        Objects.requireNonNull(symbols, "symbols");
        if (symbols.isEmpty()) throw new SymbolValidationException("Empty list.");
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (int i = 0; i < symbols.size(); i++) {
            String s = symbols.get(i);
            Objects.requireNonNull(s, "symbol at index " + i);
            if (s.isBlank()) throw new SymbolValidationException("Empty symbol at index " + i + ".");
            if (!seen.add(s)) duplicates.add(s);
        }
        if (!duplicates.isEmpty()) {
            throw new SymbolValidationException("Duplicate symbol(s): "
                    + duplicates.stream().map(d -> "\"" + d + "\"").collect(Collectors.joining(", ")) + ".");
        }
        return List.copyOf(symbols);
    }

    private static String checkSymbol(String symbol) {
        Objects.requireNonNull(symbol, "symbol");
        if (symbol.isBlank()) throw new SymbolValidationException("Empty string.");
        return symbol;
    }

    private static <T extends Tick> Map<String, Optional<List<T>>> narrow(Map<String, Optional<List<Tick>>> in, Class<T> type) {
        Map<String, Optional<List<T>>> out = new LinkedHashMap<>();
        in.forEach((symbol, ticks) -> out.put(symbol, ticks.map(list -> list.stream().map(type::cast).toList())));
        return Collections.unmodifiableMap(out);
    }

    @Override
    public void close() {
        closed = true;
        decodeExecutor.shutdown();
    }
}
