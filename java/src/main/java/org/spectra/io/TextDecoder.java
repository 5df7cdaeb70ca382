package org.spectra.io;

import org.spectra.core.DecodedText;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes raw payload bytes to text as {@code utf-8-sig} (UTF-8 with an
 * optional BOM), falling back to {@code latin-1}, which accepts any byte
 * sequence. Plain {@code utf-8} never gets reported: any input it accepts is
 * already accepted by {@code utf-8-sig}.
 */
public final class TextDecoder {

    public static final String UTF_8_SIG = "utf-8-sig";
    public static final String LATIN_1 = "latin-1";

    private static final char BOM = '\uFEFF';

    private TextDecoder() {
    }

    public static DecodedText decode(byte[] raw) {
        String text = tryUtf8(raw);
        if (text != null) {
            // utf-8-sig also accepts input without a BOM, so it wins whenever UTF-8 is valid
            if (!text.isEmpty() && text.charAt(0) == BOM) {
                text = text.substring(1);
            }
            return new DecodedText(text, UTF_8_SIG);
        }
        return new DecodedText(new String(raw, StandardCharsets.ISO_8859_1), LATIN_1);
    }

    /**
     * Strict UTF-8 decode of {@code raw}, or null if it is not valid UTF-8.
     */
    static String tryUtf8(byte[] raw) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(raw)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
