package org.netpreserve.sampler.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.sampler.SnapshotRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Lists the captures of a URL using the archive's CDX index API.
 * <p>
 * The CDX server answers {@code output=json} queries with an array of rows whose first row names the fields. When a
 * {@code limit} is combined with {@code showResumeKey=true} the last page of rows is followed by an empty row and a
 * single-element row holding the key that continues the listing.
 */
public class IndexClient {
    private static final Logger log = LoggerFactory.getLogger(IndexClient.class);
    private static final DateTimeFormatter CDX_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final List<String> FIELDS = List.of("timestamp", "original", "mimetype", "statuscode", "digest");
    private static final List<String> FILTERS = List.of("!statuscode:404", "!mimetype:warc/revisit");
    private static final Pattern BARE_URL = Pattern.compile("(?i)[a-z0-9]([a-z0-9.-]*[a-z0-9])?(:\\d+)?([/?#].*)?");

    private final ArchiveHttpClient http;
    private final URI cdxUrl;
    private final int pageSize;
    private final ObjectMapper mapper;

    public IndexClient(ArchiveHttpClient http, URI cdxUrl, int pageSize, ObjectMapper mapper) {
        this.http = http;
        this.cdxUrl = cdxUrl;
        this.pageSize = pageSize;
        this.mapper = mapper;
    }

    /**
     * Returns the captures of {@code url} between the two dates (inclusive), ordered by timestamp.
     * Malformed rows are skipped.
     */
    public List<SnapshotRef> query(String url, LocalDate startDate, LocalDate endDate) throws IndexException, InterruptedException {
        if (startDate.isAfter(endDate)) {
            throw new IllegalArgumentException("startDate " + startDate + " is after endDate " + endDate);
        }
        if (!isWellFormed(url)) {
            throw new IndexException(url, "Not a well-formed URL: " + url);
        }
        var refs = new ArrayList<SnapshotRef>();
        String resumeKey = null;
        var seenKeys = new HashSet<String>();
        int pages = 0;
        do {
            URI uri = buildQuery(url, startDate, endDate, resumeKey);
            byte[] body;
            try {
                body = http.get(uri).body();
            } catch (RequestFailedException e) {
                throw new IndexException(url, "Index query failed for " + url + ": " + e.getMessage(), e);
            }
            resumeKey = parsePage(url, body, startDate, endDate, refs);
            pages++;
            if (resumeKey != null && !seenKeys.add(resumeKey)) {
                log.atWarn().addKeyValue("url", url)
                        .addKeyValue("resumeKey", resumeKey)
                        .log("Index returned a resume key it already gave, stopping paging");
                break;
            }
        } while (resumeKey != null && pageSize > 0);
        Collections.sort(refs);
        log.atDebug().addKeyValue("url", url)
                .addKeyValue("captures", refs.size())
                .addKeyValue("pages", pages)
                .log("Index query complete");
        return refs;
    }

    static boolean isWellFormed(String url) {
        if (url == null || url.isBlank() || url.chars().anyMatch(Character::isWhitespace)) return false;
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            try {
                return URI.create(url).getHost() != null;
            } catch (IllegalArgumentException e) {
                return false;
            }
        }
        return !url.contains("://") && BARE_URL.matcher(url).matches();
    }

    URI buildQuery(String url, LocalDate startDate, LocalDate endDate, @Nullable String resumeKey) {
        var query = new StringBuilder();
        query.append("url=").append(encode(url));
        query.append("&output=json");
        query.append("&from=").append(CDX_DATE.format(startDate));
        query.append("&to=").append(CDX_DATE.format(endDate));
        query.append("&fl=").append(String.join(",", FIELDS));
        for (String filter : FILTERS) {
            query.append("&filter=").append(encode(filter));
        }
        if (pageSize > 0) {
            query.append("&limit=").append(pageSize);
            query.append("&showResumeKey=true");
            if (resumeKey != null) query.append("&resumeKey=").append(encode(resumeKey));
        }
        String base = cdxUrl.toString();
        return URI.create(base + (base.contains("?") ? "&" : "?") + query);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    /**
     * Parses one page of CDX JSON into {@code refs}.
     *
     * @return the resume key if the server indicated more results, otherwise null
     */
    @Nullable String parsePage(String url, byte[] body, LocalDate startDate, LocalDate endDate,
                               List<SnapshotRef> refs) throws IndexException {
        if (body.length == 0 || new String(body, StandardCharsets.UTF_8).isBlank()) return null;
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new IndexException(url, "Unparsable index response for " + url + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new IndexException(url, "Unreadable index response for " + url, e);
        }
        if (root == null || !root.isArray()) {
            throw new IndexException(url, "Unexpected index response for " + url + ": expected a JSON array");
        }
        if (root.isEmpty()) return null;

        Map<String, Integer> fieldIndices = new HashMap<>();
        JsonNode header = root.get(0);
        if (!header.isArray()) {
            throw new IndexException(url, "Unexpected index response for " + url + ": missing header row");
        }
        for (int i = 0; i < header.size(); i++) {
            fieldIndices.put(header.get(i).asText(), i);
        }
        Integer timestampIndex = fieldIndices.get("timestamp");
        Integer digestIndex = fieldIndices.get("digest");
        if (timestampIndex == null || digestIndex == null) {
            throw new IndexException(url, "Index response for " + url + " lacks timestamp or digest fields");
        }

        String resumeKey = null;
        int dropped = 0;
        for (int i = 1; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (row.isArray() && row.isEmpty()) {
                // an empty row separates the captures from the resume key
                JsonNode keyRow = i + 1 < root.size() ? root.get(i + 1) : null;
                if (keyRow != null && keyRow.isArray() && keyRow.size() == 1 && keyRow.get(0).isTextual()) {
                    resumeKey = keyRow.get(0).asText();
                }
                break;
            }
            SnapshotRef ref = parseRow(row, timestampIndex, digestIndex, header.size());
            if (ref == null) {
                dropped++;
                log.debug("Dropping malformed index row for {}: {}", url, row);
                continue;
            }
            LocalDate date = ref.date();
            if (date.isBefore(startDate) || date.isAfter(endDate)) continue;
            refs.add(ref);
        }
        if (dropped > 0) {
            log.atInfo().addKeyValue("url", url).addKeyValue("dropped", dropped).log("Skipped malformed index rows");
        }
        return resumeKey == null || resumeKey.isEmpty() ? null : resumeKey;
    }

    private static @Nullable SnapshotRef parseRow(JsonNode row, int timestampIndex, int digestIndex, int width) {
        if (!row.isArray() || row.size() < width) return null;
        JsonNode timestamp = row.get(timestampIndex);
        JsonNode digest = row.get(digestIndex);
        if (!timestamp.isTextual() || !digest.isTextual()) return null;
        String digestText = digest.asText().trim();
        if (digestText.isEmpty() || digestText.equals("-")) return null;
        if (!SnapshotRef.isValidTimestamp(timestamp.asText())) return null;
        return new SnapshotRef(timestamp.asText(), digestText);
    }
}
