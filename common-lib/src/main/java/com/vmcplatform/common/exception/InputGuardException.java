package com.vmcplatform.common.exception;

/**
 * Raised when caller-supplied input cannot be acted on: malformed exclusion text,
 * negative selection counts, unknown annotations, impossible syllable counts.
 *
 * <p>Nothing is written when this is thrown. The caller may retry with corrected input.
 */
public class InputGuardException extends VmcException {

    public InputGuardException(String operation, String message) {
        super(operation, message);
    }

    public InputGuardException(String operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
