package io.remint.coin.error;

/** A configured identity, value or pivot column that is not part of a category's recorded header. */
public class UnknownColumnException extends RemintException {
    private final String category;
    private final String column;

    public UnknownColumnException(String category, String column) {
        super("Column '" + column + "' is not in the header of category '" + category + "'");
        this.category = category;
        this.column = column;
    }

    public String category() { return category; }
    public String column() { return column; }
}
