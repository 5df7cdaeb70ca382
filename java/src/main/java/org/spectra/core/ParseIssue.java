package org.spectra.core;

/**
 * A data-quality problem found while parsing one item (header line, token,
 * table column). Issues become warnings; they never abort a parse.
 */
public class ParseIssue {
    private final String message;

    public ParseIssue(String message) {
        this.message = message;
    }

    public String getMessage() { return message; }

    @Override
    public String toString() {
        return message;
    }
}
