package io.yahoohistory.financial;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

public record YahooConfig(
        URI downloadUri,
        URI sessionUri,
        URI crumbUri,
        String userAgent,
        Duration requestTimeout,
        int ioThreads
) {
    static final String DEFAULT_DOWNLOAD = "https://query1.finance.yahoo.com/v7/finance/download";
    static final String DEFAULT_SESSION = "https://fc.yahoo.com";
    static final String DEFAULT_CRUMB = "https://query1.finance.yahoo.com/v1/test/getcrumb";
    static final String DEFAULT_USER_AGENT = "Mozilla/5.0";
    static final long DEFAULT_TIMEOUT_MS = 30_000;
    static final int DEFAULT_IO_THREADS = 8;

    public YahooConfig {
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        if (ioThreads < 1) throw new IllegalArgumentException("ioThreads must be >= 1");
    }

    public static YahooConfig defaults() {
        return new YahooConfig(URI.create(DEFAULT_DOWNLOAD), URI.create(DEFAULT_SESSION), URI.create(DEFAULT_CRUMB),
                DEFAULT_USER_AGENT, Duration.ofMillis(DEFAULT_TIMEOUT_MS), DEFAULT_IO_THREADS);
    }

    public static YahooConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    // system property wins over environment variable
    static YahooConfig fromEnv(Map<String, String> env) {
        URI download = URI.create(System.getProperty("yahoo.download", env.getOrDefault("YAHOO_DOWNLOAD", DEFAULT_DOWNLOAD)));
        URI session = URI.create(System.getProperty("yahoo.session", env.getOrDefault("YAHOO_SESSION", DEFAULT_SESSION)));
        URI crumb = URI.create(System.getProperty("yahoo.crumb", env.getOrDefault("YAHOO_CRUMB", DEFAULT_CRUMB)));
        String ua = System.getProperty("yahoo.userAgent", env.getOrDefault("YAHOO_USER_AGENT", DEFAULT_USER_AGENT));
        long timeoutMs = Long.parseLong(System.getProperty("yahoo.timeoutMs", env.getOrDefault("YAHOO_TIMEOUT_MS", Long.toString(DEFAULT_TIMEOUT_MS))));
        int threads = Integer.parseInt(System.getProperty("yahoo.ioThreads", env.getOrDefault("YAHOO_IO_THREADS", Integer.toString(DEFAULT_IO_THREADS))));
        return new YahooConfig(download, session, crumb, ua, Duration.ofMillis(timeoutMs), threads);
    }

    /** Same settings with every endpoint rooted at another host, e.g. a local stand-in for tests. */
    public YahooConfig withHost(URI root) {
        String r = root.toString().endsWith("/") ? root.toString().substring(0, root.toString().length() - 1) : root.toString();
        return new YahooConfig(URI.create(r + downloadUri.getPath()), URI.create(r + "/"), URI.create(r + crumbUri.getPath()),
                userAgent, requestTimeout, ioThreads);
    }
}
