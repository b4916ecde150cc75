package org.netpreserve.sampler.archive;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.CharacterCodingException;

/**
 * Retrieves captured bodies from the archive's replay endpoint.
 * <p>
 * Requests use the {@code id_} modifier ({@code /web/20240110123000id_/https://example.com/}) so the archive
 * returns the original bytes rather than a page rewritten for replay.
 */
public class ContentFetcher {
    private static final Logger log = LoggerFactory.getLogger(ContentFetcher.class);
    private final ArchiveHttpClient http;
    private final String replayPrefix;

    public ContentFetcher(ArchiveHttpClient http, URI replayUrl) {
        this.http = http;
        String prefix = replayUrl.toString();
        this.replayPrefix = prefix.endsWith("/") ? prefix : prefix + "/";
    }

    /**
     * Fetches the capture of {@code url} at {@code timestamp} and decodes it as text.
     */
    public String fetch(String url, String timestamp) throws FetchException, InterruptedException {
        return decode(url, timestamp, fetchRaw(url, timestamp));
    }

    /**
     * Fetches the capture of {@code url} at {@code timestamp} without decoding it.
     */
    public FetchedBody fetchRaw(String url, String timestamp) throws FetchException, InterruptedException {
        URI uri;
        try {
            uri = replayUri(url, timestamp);
        } catch (IllegalArgumentException e) {
            throw new FetchException(url, timestamp, "url", "Cannot build replay URL for " + url, e);
        }
        try {
            var response = http.get(uri);
            String contentType = response.headers().firstValue("Content-Type").orElse(null);
            log.atDebug().addKeyValue("url", url)
                    .addKeyValue("timestamp", timestamp)
                    .addKeyValue("bytes", response.body().length)
                    .log("Fetched snapshot");
            return new FetchedBody(response.body(), contentType);
        } catch (RequestFailedException e) {
            String reason = e.status() == -1 ? "network" : "http " + e.status();
            throw new FetchException(url, timestamp, reason, "Fetch of " + url + " at " + timestamp + " failed: "
                                                             + e.getMessage(), e);
        }
    }

    /**
     * Decodes a body previously returned by {@link #fetchRaw}.
     */
    public static String decode(String url, String timestamp, FetchedBody body) throws DecodeException {
        try {
            return TextDecoder.decode(body.body(), body.contentType());
        } catch (CharacterCodingException e) {
            throw new DecodeException(url, timestamp, "Cannot decode snapshot of " + url + " at " + timestamp
                                                      + " as text: " + e.getMessage(), e);
        }
    }

    URI replayUri(String url, String timestamp) {
        return URI.create(replayPrefix + timestamp + "id_/" + url);
    }
}
