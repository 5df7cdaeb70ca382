package org.spectra.core;

/**
 * Text decoded from a raw payload, with the encoding that succeeded.
 */
public class DecodedText {
    private final String text;
    private final String encoding;

    public DecodedText(String text, String encoding) {
        this.text = text;
        this.encoding = encoding;
    }

    public String getText() { return text; }
    public String getEncoding() { return encoding; }
}
