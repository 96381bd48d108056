package io.github.jbellis.wikimark.text;

import java.util.regex.Pattern;

public final class Whitespace {
    private static final Pattern RUNS = Pattern.compile("\\s+");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\s*\\R\\s*");

    private Whitespace() {
    }

    /**
     * Replaces non-breaking spaces and collapses every whitespace run to one space.
     * An all-whitespace input becomes a single space, never the empty string.
     */
    public static String collapse(String text) {
        return RUNS.matcher(text.replace('\u00a0', ' ')).replaceAll(" ");
    }

    /**
     * Joins lines with single spaces, for contexts that must stay on one line.
     */
    public static String singleLine(String text) {
        return LINE_BREAKS.matcher(text.strip()).replaceAll(" ");
    }

    public static String leading(String text) {
        return text.substring(0, text.length() - text.stripLeading().length());
    }

    public static String trailing(String text) {
        return text.substring(text.stripTrailing().length());
    }
}
