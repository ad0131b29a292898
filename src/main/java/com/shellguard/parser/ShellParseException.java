package com.shellguard.parser;

/**
 * Raised for input outside the supported grammar. Callers treat it as "cannot classify", never as an error to surface.
 */
public class ShellParseException extends Exception {

    public ShellParseException(String message) {
        super(message);
    }
}
