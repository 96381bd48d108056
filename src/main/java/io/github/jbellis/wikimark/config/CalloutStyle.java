package io.github.jbellis.wikimark.config;

import java.util.Locale;

/**
 * How info/note style macros are rendered. Chosen once per converter.
 */
public enum CalloutStyle {
    /**
     * Quoted title and body lines; nested code fences break out of the quote.
     */
    BLOCKQUOTE,
    /**
     * Numbered START/END marker lines around the body, for a downstream step that builds native callouts.
     */
    MARKER_PAIR;

    public static CalloutStyle parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
