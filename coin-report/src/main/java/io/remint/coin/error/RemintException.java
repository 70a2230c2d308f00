package io.remint.coin.error;

/**
 * Base of the failures that abort a remint run. Monitoring data is expected to be well formed,
 * so these are surfaced to the caller instead of being turned into defaults.
 */
public class RemintException extends RuntimeException {
    public RemintException(String message) { super(message); }
    public RemintException(String message, Throwable cause) { super(message, cause); }
}
