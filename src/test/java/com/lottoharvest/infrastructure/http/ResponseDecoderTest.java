package com.lottoharvest.infrastructure.http;

import com.lottoharvest.domain.exception.DecodeException;
import org.junit.jupiter.api.Test;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ResponseDecoder.
 */
class ResponseDecoderTest {

    private static final String URL = "https://dhlottery.co.kr/store.do";
    private static final String KOREAN = "1등 배출점 서울 강남구 테헤란로";

    private final ResponseDecoder decoder = new ResponseDecoder();

    @Test
    void testDeclaredEucKrIsDecodedAsMs949() throws Exception {
        byte[] body = KOREAN.getBytes(Charset.forName("EUC-KR"));

        ResponseDecoder.Decoded decoded = decoder.decode(body, "text/html; charset=EUC-KR", URL);

        assertEquals(KOREAN, decoded.text());
        assertEquals(ResponseDecoder.MS949.name(), decoded.charset());
    }

    @Test
    void testMetaCharsetWhenHeaderIsSilent() throws Exception {
        String html = "<html><head><meta http-equiv=\"Content-Type\" content=\"text/html; charset=euc-kr\">"
            + "</head><body>" + KOREAN + "</body></html>";

        ResponseDecoder.Decoded decoded = decoder.decode(html.getBytes(ResponseDecoder.MS949), "text/html", URL);

        assertTrue(decoded.text().contains(KOREAN));
        assertEquals(ResponseDecoder.MS949.name(), decoded.charset());
    }

    @Test
    void testWrongDeclaredCharsetFallsThrough() throws Exception {
        byte[] body = KOREAN.getBytes(ResponseDecoder.MS949);

        ResponseDecoder.Decoded decoded = decoder.decode(body, "text/html; charset=UTF-8", URL);

        assertEquals(KOREAN, decoded.text());
    }

    @Test
    void testIso88591HeaderCountsAsUndeclared() throws Exception {
        byte[] body = KOREAN.getBytes(StandardCharsets.UTF_8);

        ResponseDecoder.Decoded decoded = decoder.decode(body, "text/html; charset=ISO-8859-1", URL);

        assertEquals(KOREAN, decoded.text());
        assertEquals(StandardCharsets.UTF_8.name(), decoded.charset());
    }

    @Test
    void testCandidateOrder() {
        List<Charset> candidates = decoder.candidates("x".getBytes(StandardCharsets.US_ASCII), "text/html; charset=euc-kr");

        assertEquals(List.of(ResponseDecoder.MS949, StandardCharsets.UTF_8), candidates);
    }

    @Test
    void testUndecodableBodyFails() {
        byte[] body = {(byte) 0xFF, (byte) 0xFF, (byte) 0xFF};

        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(body, null, URL));
        assertEquals(URL, e.getUrl());
    }

    @Test
    void testEmptyBody() throws Exception {
        assertEquals("", decoder.decode(new byte[0], "text/html", URL).text());
    }
}
