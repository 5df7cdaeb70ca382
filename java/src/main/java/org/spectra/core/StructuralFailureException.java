package org.spectra.core;

/**
 * The claimed binary container (FITS, gzip-wrapped FITS) could not be opened at all.
 */
public class StructuralFailureException extends Exception {

    public StructuralFailureException(String message) {
        super(message);
    }

    public StructuralFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
