package io.yahoohistory.financial;

import com.codahale.metrics.MetricRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CrumbSessionTest {
    FakeYahooServer server;
    MetricRegistry registry;
    CrumbSession session;

    @BeforeEach
    void setUp() throws Exception {
        server = new FakeYahooServer();
        registry = new MetricRegistry();
        session = new CrumbSession(server.config(), registry);
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void acquiresCookieAndCrumb() throws Exception {
        assertNull(session.peek());
        SessionCredentials creds = session.credentials(false).get(5, TimeUnit.SECONDS);
        assertEquals("crumb-1", creds.crumb());
        assertFalse(creds.cookies().getCookieStore().getCookies().isEmpty());
        assertSame(creds, session.peek());
        assertEquals(1, server.landingHits.get());
        assertEquals(1, server.crumbHits.get());
        assertEquals(1, registry.counter("yahoo.crumb.acquisitions").getCount());
        assertFalse(creds.toString().contains("crumb-1"));
    }

    @Test
    void cachedCredentialsAreReusedWithoutNetwork() throws Exception {
        SessionCredentials first = session.credentials(false).get(5, TimeUnit.SECONDS);
        SessionCredentials second = session.credentials(false).get(5, TimeUnit.SECONDS);
        assertSame(first, second);
        assertEquals(1, server.landingHits.get());
        assertEquals(1, server.crumbHits.get());
    }

    @Test
    void forcedRefreshReplacesThePair() throws Exception {
        SessionCredentials first = session.credentials(false).get(5, TimeUnit.SECONDS);
        SessionCredentials second = session.credentials(true).get(5, TimeUnit.SECONDS);
        assertNotSame(first, second);
        assertEquals("crumb-2", second.crumb());
        assertSame(second, session.peek());
        assertEquals(2, server.landingHits.get());
    }

    @Test
    void concurrentRefreshesShareOneAcquisition() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        server.gateCrumbs(gate);
        List<CompletableFuture<SessionCredentials>> calls = new ArrayList<>();
        for (int i = 0; i < 10; i++) calls.add(session.credentials(true));
        gate.countDown();

        SessionCredentials expected = calls.get(0).get(5, TimeUnit.SECONDS);
        for (CompletableFuture<SessionCredentials> c : calls) assertSame(expected, c.get(5, TimeUnit.SECONDS));
        assertEquals(1, server.crumbHits.get());
        assertEquals(1, server.landingHits.get());
    }

    @Test
    void renewAfterAnotherCallerRefreshedReturnsTheNewerPair() throws Exception {
        SessionCredentials stale = session.credentials(false).get(5, TimeUnit.SECONDS);
        SessionCredentials fresh = session.renew(stale).get(5, TimeUnit.SECONDS);
        assertNotSame(stale, fresh);
        assertEquals(2, server.crumbHits.get());

        // a second holder of the stale pair gets the fresh one without another round trip
        assertSame(fresh, session.renew(stale).get(5, TimeUnit.SECONDS));
        assertEquals(2, server.crumbHits.get());
    }

    @Test
    void crumbEndpointErrorFailsWithAuthException() {
        server.crumbResponse(500, null);
        ExecutionException e = assertThrows(ExecutionException.class, () -> session.credentials(false).get(5, TimeUnit.SECONDS));
        assertInstanceOf(AuthException.class, e.getCause());
        assertNull(session.peek());
    }

    @Test
    void unparsableCrumbBodyFailsWithAuthException() {
        server.crumbResponse(200, "<html><body>consent</body></html>");
        ExecutionException e = assertThrows(ExecutionException.class, () -> session.credentials(false).get(5, TimeUnit.SECONDS));
        assertInstanceOf(AuthException.class, e.getCause());
    }

    @Test
    void failedRefreshLeavesCachedPairInPlace() throws Exception {
        SessionCredentials good = session.credentials(false).get(5, TimeUnit.SECONDS);
        server.crumbResponse(503, null);
        assertThrows(ExecutionException.class, () -> session.credentials(true).get(5, TimeUnit.SECONDS));
        assertSame(good, session.peek());
        assertSame(good, session.credentials(false).get(5, TimeUnit.SECONDS));
    }

    @Test
    void cancellingOneCallerDoesNotCancelTheAcquisition() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        server.gateCrumbs(gate);
        CompletableFuture<SessionCredentials> a = session.credentials(true);
        CompletableFuture<SessionCredentials> b = session.credentials(true);
        a.cancel(true);
        gate.countDown();
        assertEquals("crumb-1", b.get(5, TimeUnit.SECONDS).crumb());
    }

    @Test
    void parseCrumbTrimsAndRejectsMarkup() {
        assertEquals("AbC.d/e", CrumbSession.parseCrumb("  AbC.d/e\n"));
        assertThrows(AuthException.class, () -> CrumbSession.parseCrumb(""));
        assertThrows(AuthException.class, () -> CrumbSession.parseCrumb("   "));
        assertThrows(AuthException.class, () -> CrumbSession.parseCrumb(null));
        assertThrows(AuthException.class, () -> CrumbSession.parseCrumb("Too Many Requests"));
        assertThrows(AuthException.class, () -> CrumbSession.parseCrumb("{\"error\":1}"));
    }
}
