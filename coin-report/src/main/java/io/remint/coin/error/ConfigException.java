package io.remint.coin.error;

/** The category configuration does not have the expected shape. */
public class ConfigException extends RemintException {
    public ConfigException(String message) { super(message); }
    public ConfigException(String message, Throwable cause) { super(message, cause); }
}
