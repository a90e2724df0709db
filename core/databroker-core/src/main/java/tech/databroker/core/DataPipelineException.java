package tech.databroker.core;

/**
 * Exception thrown when a request entering the data pipeline is missing or malformed.
 *
 * <p>This is the only exception the broker and its handlers propagate. Every other
 * failure is reported through the result envelopes.
 */
public class DataPipelineException extends RuntimeException {

    public DataPipelineException(String message) {
        super(message);
    }

    public DataPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
