package com.vmcplatform.common.exception;

/**
 * Stored data violates a precondition of a whole run, e.g. an utterance without exactly
 * one code per rater at aggregation time. The run is aborted; no partial output is produced.
 */
public class ConsistencyException extends VmcException {

    public ConsistencyException(String operation, String message) {
        super(operation, message);
    }
}
