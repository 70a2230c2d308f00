package io.remint.coin.error;

/** A timestamp field or a window bound that none of the accepted date-time shapes matches. */
public class TimeParseException extends RemintException {
    private final String text;

    public TimeParseException(String text) {
        super("Unparseable timestamp: '" + text + "'");
        this.text = text;
    }

    public String text() { return text; }
}
