package org.netpreserve.sampler;

import org.netpreserve.sampler.config.SiteType;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * One input site to sample.
 *
 * @param rawUrl      URL or bare domain as given in the input
 * @param siteType    kind of resource to sample
 * @param resolvedUrl URL actually looked up in the archive
 */
public record UrlTask(String rawUrl, SiteType siteType, String resolvedUrl) {
    private static final String ROBOTS_SUFFIX = "/robots.txt";

    public UrlTask {
        Objects.requireNonNull(rawUrl, "rawUrl");
        Objects.requireNonNull(siteType, "siteType");
        Objects.requireNonNull(resolvedUrl, "resolvedUrl");
    }

    public static UrlTask of(String rawUrl, SiteType siteType) {
        String url = rawUrl.trim();
        return new UrlTask(url, siteType, resolve(url, siteType));
    }

    static String resolve(String rawUrl, SiteType siteType) {
        if (siteType != SiteType.ROBOTS) return rawUrl;
        if (rawUrl.toLowerCase(Locale.ROOT).endsWith(ROBOTS_SUFFIX)) return rawUrl;
        if (rawUrl.endsWith("/")) return rawUrl.substring(0, rawUrl.length() - 1) + ROBOTS_SUFFIX;
        return rawUrl + ROBOTS_SUFFIX;
    }

    /**
     * The lower-cased host of the URL. Used as the top-level key of the output dataset.
     */
    public String domain() {
        String url = rawUrl.contains("://") ? rawUrl : "http://" + rawUrl;
        try {
            String host = new URI(url).getHost();
            if (host != null) return host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            // fall through to the manual split below
        }
        String rest = url.substring(url.indexOf("://") + 3);
        int end = rest.length();
        for (char c : new char[]{'/', '?', '#', ':'}) {
            int i = rest.indexOf(c);
            if (i >= 0 && i < end) end = i;
        }
        return rest.substring(0, end).toLowerCase(Locale.ROOT);
    }
}
