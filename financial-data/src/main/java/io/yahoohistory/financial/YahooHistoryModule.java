package io.yahoohistory.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

/**
 * Wires one session, one fetcher and one metric registry per injector.
 * Guice does not close the fetcher; close the {@link YahooHistory} singleton when the injector is discarded.
 */
public class YahooHistoryModule extends AbstractModule {
    private final YahooConfig config;

    public YahooHistoryModule() { this(YahooConfig.fromEnv()); }

    public YahooHistoryModule(YahooConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(YahooConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton CrumbSession crumbSession(YahooConfig config, MetricRegistry registry) {
        return new CrumbSession(config, registry);
    }

    @Provides @Singleton YahooHistory yahooHistory(CrumbSession session, YahooConfig config, MetricRegistry registry) {
        return new YahooHistory(session, config, registry);
    }
}
