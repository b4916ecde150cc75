package org.netpreserve.sampler;

import org.netpreserve.sampler.config.SiteType;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads the input URL list. Accepts either one URL per line or a CSV file. If the first row names a {@code url},
 * {@code domain} or {@code site} column that column is used, otherwise the first column. Blank lines, comment lines
 * starting with '#' and duplicates are skipped.
 */
public class UrlListReader {
    private static final Set<String> URL_COLUMNS = Set.of("url", "domain", "site");

    public static List<UrlTask> read(Path path, SiteType siteType) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, siteType);
        }
    }

    static List<UrlTask> read(BufferedReader reader, SiteType siteType) throws IOException {
        Set<String> seen = new LinkedHashSet<>();
        int column = 0;
        boolean firstRow = true;
        String line;
        while ((line = reader.readLine()) != null) {
            if (firstRow && line.startsWith("\uFEFF")) line = line.substring(1);
            if (line.isBlank() || line.strip().startsWith("#")) continue;
            List<String> fields = splitCsv(line);
            if (firstRow) {
                firstRow = false;
                int header = headerColumn(fields);
                if (header >= 0) {
                    column = header;
                    continue;
                }
            }
            if (column >= fields.size()) continue;
            String value = fields.get(column).strip();
            if (!value.isEmpty()) seen.add(value);
        }
        List<UrlTask> tasks = new ArrayList<>(seen.size());
        for (String url : seen) {
            tasks.add(UrlTask.of(url, siteType));
        }
        return tasks;
    }

    private static int headerColumn(List<String> fields) {
        for (int i = 0; i < fields.size(); i++) {
            if (URL_COLUMNS.contains(fields.get(i).strip().toLowerCase(Locale.ROOT))) return i;
        }
        return -1;
    }

    /**
     * Splits a CSV line, honouring double-quoted fields with "" escapes.
     */
    static List<String> splitCsv(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        field.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(field.toString());
                field.setLength(0);
            } else {
                field.append(c);
            }
        }
        fields.add(field.toString());
        return fields;
    }
}
