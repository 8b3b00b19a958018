package org.pragmatica.expr.tree;

/**
 * A position in expression text.
 *
 * @param line   1-based line number
 * @param column 1-based column within the line
 * @param offset 0-based char index into the text
 */
public record SourceLocation(int line, int column, int offset) {

    public static final SourceLocation START = new SourceLocation(1, 1, 0);

    /**
     * Location just after {@code consumed}, which is the character at this location.
     */
    public SourceLocation advance(char consumed) {
        return consumed == '\n'
               ? new SourceLocation(line + 1, 1, offset + 1)
               : new SourceLocation(line, column + 1, offset + 1);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
