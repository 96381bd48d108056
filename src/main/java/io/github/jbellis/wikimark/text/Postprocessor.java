package io.github.jbellis.wikimark.text;

import java.util.regex.Pattern;

/**
 * Final cleanup of converted output: at most one blank line in a row, no surrounding whitespace.
 */
public final class Postprocessor {
    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\n{3,}");

    private Postprocessor() {
    }

    public static String collapseBlankLines(String text) {
        return EXCESS_NEWLINES.matcher(text).replaceAll("\n\n");
    }

    public static String clean(String text) {
        return collapseBlankLines(text).strip();
    }
}
