package io.remint.runtime;

/**
 * Raised when a pipeline run aborts. The message carries the source position that was being processed.
 */
public class PipelineException extends RuntimeException {
    private final String position;

    public PipelineException(String position, Throwable cause) {
        super("Processing failed at " + (position == null || position.isEmpty() ? "<unknown>" : position)
                + ": " + cause.getMessage(), cause);
        this.position = position;
    }

    public String position() { return position; }
}
