package io.yahoohistory.financial;

import java.net.CookieManager;
import java.net.http.HttpClient;

/**
 * A crumb together with the client whose cookie jar holds the session cookie it was issued for.
 * The two are only valid together and are replaced as a pair.
 */
public record SessionCredentials(HttpClient client, CookieManager cookies, String crumb) {
    @Override
    public String toString() {
        return "SessionCredentials{cookies=" + cookies.getCookieStore().getCookies().size() + ", crumb=***}";
    }
}
