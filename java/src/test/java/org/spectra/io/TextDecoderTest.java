package org.spectra.io;

import org.junit.jupiter.api.Test;
import org.spectra.core.DecodedText;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class TextDecoderTest {

    @Test
    void strips_utf8_bom() {
        byte[] raw = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'x', ',', 'y'};
        DecodedText decoded = TextDecoder.decode(raw);
        assertEquals("x,y", decoded.getText());
        assertEquals(TextDecoder.UTF_8_SIG, decoded.getEncoding());
    }

    @Test
    void plain_utf8_is_reported_as_utf8_sig() {
        DecodedText decoded = TextDecoder.decode("λ,flux".getBytes(StandardCharsets.UTF_8));
        assertEquals("λ,flux", decoded.getText());
        assertEquals("utf-8-sig", decoded.getEncoding());
    }

    @Test
    void invalid_utf8_falls_back_to_latin1() {
        byte[] raw = {'W', (byte) 0xE9, ',', '1'};
        DecodedText decoded = TextDecoder.decode(raw);
        assertEquals("Wé,1", decoded.getText());
        assertEquals("latin-1", decoded.getEncoding());
    }

    @Test
    void empty_payload_decodes_to_empty_text() {
        DecodedText decoded = TextDecoder.decode(new byte[0]);
        assertEquals("", decoded.getText());
        assertEquals(TextDecoder.UTF_8_SIG, decoded.getEncoding());
    }
}
