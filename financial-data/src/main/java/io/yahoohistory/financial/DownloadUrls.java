package io.yahoohistory.financial;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;

final class DownloadUrls {
    private DownloadUrls() {}

    /**
     * {@code <base>/<symbol>?period1=..&period2=..&interval=1<freq>&events=<variant>&crumb=..}
     */
    static URI build(URI base, FetchRequest req, String crumb) {
        String b = base.toString();
        if (b.endsWith("/")) b = b.substring(0, b.length() - 1);
        String url = b + "/" + encode(req.symbol())
                + "?period1=" + req.period().startSeconds()
                + "&period2=" + req.period().endSeconds()
                + "&interval=" + encode(req.frequency().interval())
                + "&events=" + encode(req.variant().events())
                + "&crumb=" + encode(crumb);
        return URI.create(url);
    }

    // URLEncoder targets forms; a space must be %20 in both path and query here
    static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
