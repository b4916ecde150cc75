package org.netpreserve.sampler.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads a byte count given either as a plain number or as a string like "5000MB" or "1.5 GB".
 */
public class ByteSizeDeserializer extends JsonDeserializer<Long> {
    private static final Pattern SIZE_PATTERN =
            Pattern.compile("(?i)\\s*(\\d+(?:\\.\\d+)?)\\s*([KMGT]?)(B?)\\s*");

    @Override
    public Long deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return jsonParser.getLongValue();
        return parse(jsonParser.getText());
    }

    public static long parse(String text) throws IOException {
        var matcher = SIZE_PATTERN.matcher(text);
        if (!matcher.matches()) {
            throw new IOException("Invalid byte size format: " + text);
        }
        double value = Double.parseDouble(matcher.group(1));
        long multiplier = switch (matcher.group(2).toUpperCase(Locale.ROOT)) {
            case "K" -> 1024L;
            case "M" -> 1024L * 1024;
            case "G" -> 1024L * 1024 * 1024;
            case "T" -> 1024L * 1024 * 1024 * 1024;
            default -> 1L;
        };
        return (long) (value * multiplier);
    }
}
