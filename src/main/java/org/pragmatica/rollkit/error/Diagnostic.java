package org.pragmatica.rollkit.error;

import org.pragmatica.rollkit.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Rust-style rendering of a parse error against the expression text.
 *
 * <p>Example output:
 * <pre>
 * error: Unexpected ')' at 1:5, expected expression
 *   --> 1:5
 *   |
 * 1 | 3 + )
 *   |     ^ expected expression
 *   |
 * </pre>
 *
 * @param message Primary error message
 * @param span    Source span where error occurred
 * @param label   Text printed next to the underline
 * @param notes   Additional notes or suggestions
 */
public record Diagnostic(String message, SourceSpan span, String label, List<String> notes) {

    public Diagnostic {
        notes = List.copyOf(notes);
    }

    /**
     * Create a diagnostic for a parse error.
     */
    public static Diagnostic of(ParseError error) {
        var diagnostic = new Diagnostic(error.message(), error.span(), labelFor(error), List.of());
        if (error instanceof ParseError.UnexpectedEof) {
            return diagnostic.withHelp("the expression ends before it is complete");
        }
        if (error instanceof ParseError.InvalidStep) {
            return diagnostic.withHelp("the sign of the step is ignored, use 1 or -1 to count every value");
        }
        return diagnostic;
    }

    private static String labelFor(ParseError error) {
        if (error instanceof ParseError.UnexpectedToken unexpected) {
            return "expected " + unexpected.expected();
        }
        if (error instanceof ParseError.UnexpectedEof eof) {
            return "expected " + eof.expected();
        }
        if (error instanceof ParseError.LexError) {
            return "unknown character";
        }
        if (error instanceof ParseError.IntegerOverflow) {
            return "does not fit in 64 bits";
        }
        if (error instanceof ParseError.InputTooLong) {
            return "input too long";
        }
        if (error instanceof ParseError.NestingTooDeep) {
            return "nested too deeply";
        }
        return "step must not be zero";
    }

    /**
     * Add a note.
     */
    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(message, span, label, newNotes);
    }

    /**
     * Add a help suggestion.
     */
    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format this diagnostic against the source it was produced from.
     */
    public String format(String source) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        sb.append("error: ").append(message).append("\n");

        var loc = span.start();
        sb.append("  --> ").append(loc.line()).append(":").append(loc.column()).append("\n");

        int gutterWidth = String.valueOf(span.end().line()).length();
        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (int lineNum = span.start().line(); lineNum <= span.end().line(); lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;

            var lineContent = lines[lineNum - 1];
            var lineNumStr = String.format("%" + gutterWidth + "d", lineNum);
            sb.append(lineNumStr).append(" | ").append(lineContent).append("\n");

            sb.append(" ".repeat(gutterWidth)).append(" | ");
            sb.append(underline(lineNum, lineContent));
            sb.append("\n");
        }

        sb.append(" ".repeat(gutterWidth + 1)).append("|\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }

        return sb.toString();
    }

    private String underline(int lineNum, String lineContent) {
        int startCol = span.start().line() == lineNum ? span.start().column() : 1;
        int endCol = span.end().line() == lineNum ? span.end().column() : lineContent.length() + 1;

        var sb = new StringBuilder();
        sb.append(" ".repeat(startCol - 1));
        sb.append("^".repeat(Math.max(1, endCol - startCol)));
        if (!label.isEmpty()) {
            sb.append(" ").append(label);
        }
        return sb.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple() {
        var loc = span.start();
        return String.format("%d:%d: error: %s", loc.line(), loc.column(), message);
    }
}
