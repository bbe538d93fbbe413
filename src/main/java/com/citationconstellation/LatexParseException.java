package com.citationconstellation;

/**
 * The flattened document could not be turned into a usable tree. Fatal for the paper being
 * analyzed, never for a batch.
 */
public class LatexParseException extends RuntimeException {

    public LatexParseException(String message) {
        super(message);
    }
}
