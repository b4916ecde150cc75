package org.netpreserve.sampler.archive;

import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort conversion of captured bytes to text. Candidate charsets are tried strictly in turn: the one declared
 * in the Content-Type, then UTF-8, then windows-1252. A UTF-8 byte order mark overrides the declared charset. Bodies
 * containing NUL bytes are treated as binary unless the declared charset decodes them. Nothing is silently replaced
 * or truncated.
 */
public class TextDecoder {
    private static final Pattern CHARSET_PARAM = Pattern.compile("(?i)charset\\s*=\\s*[\"']?([^\"';\\s]+)");
    private static final List<Charset> FALLBACKS = List.of(StandardCharsets.UTF_8, Charset.forName("windows-1252"));

    private TextDecoder() {
    }

    public static String decode(byte[] body, @Nullable String contentType) throws CharacterCodingException {
        if (body.length == 0) return "";
        if (hasUtf8Bom(body)) {
            rejectBinary(body);
            return strictDecode(StandardCharsets.UTF_8, body, 3);
        }
        CharacterCodingException lastError = null;
        // a declared charset may legitimately contain NUL bytes (UTF-16, UTF-32)
        Charset declared = declaredCharset(contentType);
        if (declared != null) {
            try {
                return strictDecode(declared, body, 0);
            } catch (CharacterCodingException e) {
                lastError = e;
            }
        }
        rejectBinary(body);
        for (Charset charset : FALLBACKS) {
            if (charset.equals(declared)) continue;
            try {
                return strictDecode(charset, body, 0);
            } catch (CharacterCodingException e) {
                lastError = e;
            }
        }
        throw lastError;
    }

    private static String strictDecode(Charset charset, byte[] body, int offset) throws CharacterCodingException {
        return charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(body, offset, body.length - offset))
                .toString();
    }

    private static void rejectBinary(byte[] body) throws BinaryContentException {
        for (byte b : body) {
            if (b == 0) throw new BinaryContentException();
        }
    }

    static @Nullable Charset declaredCharset(@Nullable String contentType) {
        if (contentType == null) return null;
        Matcher matcher = CHARSET_PARAM.matcher(contentType);
        if (!matcher.find()) return null;
        try {
            return Charset.forName(matcher.group(1));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null;
        }
    }

    private static boolean hasUtf8Bom(byte[] body) {
        return body.length >= 3 && (body[0] & 0xff) == 0xEF && (body[1] & 0xff) == 0xBB && (body[2] & 0xff) == 0xBF;
    }

    static class BinaryContentException extends CharacterCodingException {
        @Override
        public String getMessage() {
            return "binary content (NUL byte)";
        }
    }
}
