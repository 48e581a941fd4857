package com.lottoharvest.infrastructure.http;

import com.lottoharvest.domain.exception.DecodeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns response bytes into text.
 *
 * <p>Candidates are tried in order, each strictly (malformed input is an error, never
 * replaced): the charset declared in Content-Type, a charset declared in a meta tag,
 * UTF-8, then MS949. A Content-Type of ISO-8859-1 is treated as undeclared because
 * servers send it as a default. EUC-KR is widened to MS949, which is a superset.
 */
public class ResponseDecoder {

    private static final Logger logger = LoggerFactory.getLogger(ResponseDecoder.class);

    static final Charset MS949 = Charset.forName("MS949");

    private static final Pattern HEADER_CHARSET =
        Pattern.compile("charset\\s*=\\s*\"?([A-Za-z0-9_.:\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern META_CHARSET =
        Pattern.compile("<meta[^>]+charset\\s*=\\s*[\"']?([A-Za-z0-9_.:\\-]+)", Pattern.CASE_INSENSITIVE);
    private static final int META_SCAN_BYTES = 4096;

    public Decoded decode(byte[] body, String contentType, String url) throws DecodeException {
        if (body == null || body.length == 0) {
            return new Decoded("", StandardCharsets.UTF_8.name());
        }
        for (Charset charset : candidates(body, contentType)) {
            try {
                String text = strictDecode(body, charset);
                return new Decoded(text, charset.name());
            } catch (CharacterCodingException e) {
                logger.debug("Body of {} is not valid {}", url, charset.name());
            }
        }
        throw new DecodeException("Body of " + body.length + " bytes is not valid in any candidate charset", url);
    }

    List<Charset> candidates(byte[] body, String contentType) {
        List<Charset> out = new ArrayList<>();
        Charset declared = find(HEADER_CHARSET, contentType);
        if (declared != null && !declared.equals(StandardCharsets.ISO_8859_1)) {
            out.add(declared);
        }
        int scan = Math.min(body.length, META_SCAN_BYTES);
        Charset meta = find(META_CHARSET, new String(body, 0, scan, StandardCharsets.ISO_8859_1));
        if (meta != null && !out.contains(meta)) {
            out.add(meta);
        }
        if (!out.contains(StandardCharsets.UTF_8)) {
            out.add(StandardCharsets.UTF_8);
        }
        if (!out.contains(MS949)) {
            out.add(MS949);
        }
        return out;
    }

    private static Charset find(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher m = pattern.matcher(text);
        if (!m.find()) {
            return null;
        }
        return lookup(m.group(1));
    }

    private static Charset lookup(String name) {
        String n = name.trim().toUpperCase(Locale.ROOT);
        if (n.equals("EUC-KR") || n.equals("EUCKR") || n.equals("KS_C_5601-1987") || n.equals("CP949")) {
            return MS949;
        }
        try {
            return Charset.forName(n);
        } catch (IllegalArgumentException e) {
            logger.debug("Ignoring unknown charset {}", name);
            return null;
        }
    }

    private static String strictDecode(byte[] body, Charset charset) throws CharacterCodingException {
        return charset.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(ByteBuffer.wrap(body))
            .toString();
    }

    public record Decoded(String text, String charset) {}
}
