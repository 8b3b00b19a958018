package org.pragmatica.expr.error;

import org.pragmatica.expr.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Printable report of an {@link ExpressionError}.
 *
 * <p>Example output:
 * <pre>
 * error[E0102]: Unexpected identifier 'a' at 1:5: variables are not supported
 *   --> 1:5
 *   |
 * 1 | 2 + a
 *   |     ^
 *   |
 *   = help: call it as a function: a(...)
 * </pre>
 *
 * @param code     error code of the underlying error
 * @param message  primary message
 * @param location source position, absent for evaluation errors
 * @param notes    additional notes or suggestions
 */
public record Diagnostic(
    String code,
    String message,
    Optional<SourceLocation> location,
    List<String> notes
) {
    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Build the diagnostic for an error, including its help text if it has one.
     */
    public static Diagnostic of(ExpressionError error) {
        var diagnostic = new Diagnostic(error.code(), error.message(), error.location(), List.of());
        return error.help()
                    .map(diagnostic::withHelp)
                    .orElse(diagnostic);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, location, newNotes);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic in Rust style, pointing into the given source text.
     */
    public String format(String source) {
        var sb = new StringBuilder();
        sb.append("error[").append(code).append("]: ").append(message).append("\n");

        if (location.isEmpty()) {
            for (var note : notes) {
                sb.append("  = ").append(note).append("\n");
            }
            return sb.toString();
        }

        var loc = location.get();
        var lines = source.split("\n", -1);
        var gutterWidth = String.valueOf(loc.line()).length();
        var gutter = " ".repeat(gutterWidth + 1);

        sb.append("  --> ").append(loc.line()).append(":").append(loc.column()).append("\n");
        sb.append(gutter).append("|\n");

        if (loc.line() >= 1 && loc.line() <= lines.length) {
            var lineNumStr = String.format("%" + gutterWidth + "d", loc.line());
            sb.append(lineNumStr).append(" | ").append(lines[loc.line() - 1]).append("\n");
            sb.append(" ".repeat(gutterWidth)).append(" | ")
              .append(" ".repeat(loc.column() - 1)).append("^\n");
        }

        sb.append(gutter).append("|\n");
        for (var note : notes) {
            sb.append(gutter).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form, e.g. {@code 1:5: error[E0102]: ...}.
     */
    public String formatSimple() {
        return location.map(loc -> loc.line() + ":" + loc.column() + ": ")
                       .orElse("")
               + "error[" + code + "]: " + message;
    }
}
