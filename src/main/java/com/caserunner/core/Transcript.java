package com.caserunner.core;

/**
 * Append-only, human-readable record of one case's execution.
 */
public class Transcript {

    private final StringBuilder text = new StringBuilder();
    private final MessageFormatter formatter;

    public Transcript(MessageFormatter formatter) {
        this.formatter = formatter;
    }

    /** Formats {@code msg} with {@code args} and appends it as one line. */
    public void printOut(String msg, Object... args) {
        text.append(formatter.format(msg, args)).append('\n');
    }

    /** Appends {@code raw} exactly as given, without formatting or newline. */
    public void append(String raw) {
        text.append(raw);
    }

    public String getText() {
        return text.toString();
    }

    /** The transcript with every line prefixed by {@code indent} spaces and {@code header}. */
    public String reindented(int indent, String header) {
        return reindent(text.toString(), indent, header);
    }

    public static String reindent(String s, int indent, String header) {
        String prefix = " ".repeat(Math.max(0, indent)) + (header != null ? header : "");
        String[] lines = s.split("\n", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            sb.append(prefix).append(lines[i]);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return text.toString();
    }
}
