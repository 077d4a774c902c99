package com.vmcplatform.common.exception;

/**
 * Root of the domain failures raised by selection, pool and consensus code.
 *
 * <p>Each failure names the operation it came from ({@code "select"}, {@code "submit"},
 * {@code "aggregate"}, ...). The message is rendered as {@code "[operation] detail"} so log
 * lines and HTTP error bodies read the same, and {@link #getOperation()} lets the HTTP layer
 * report the operation as its own field.
 */
public abstract class VmcException extends RuntimeException {

    private final String operation;

    protected VmcException(String operation, String detail) {
        this(operation, detail, null);
    }

    protected VmcException(String operation, String detail, Throwable cause) {
        super(tagged(operation, detail), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }

    private static String tagged(String operation, String detail) {
        return operation == null ? detail : "[" + operation + "] " + detail;
    }
}
