package org.netpreserve.sampler.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Reads a duration given as milliseconds, a short form like "1s" or "250ms", or an ISO-8601 duration.
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith("P")) return Duration.parse(text);
            if (text.endsWith("MS")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            return Duration.parse("PT" + text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IOException("Invalid duration: " + jsonParser.getText(), e);
        }
    }
}
