package io.github.jbellis.wikimark.embed;

/**
 * An attachment embed found during conversion, resolved after the tree walk.
 *
 * @param index    position of the embed in document order, unique within one conversion
 * @param filename attachment filename as referenced by the page
 */
public record EmbedRequest(int index, String filename) {
    static final char PLACEHOLDER_START = '\uE002';
    static final char PLACEHOLDER_END = '\uE003';

    /**
     * Opaque token standing in for the embed until it is resolved. Uses private-use characters so it
     * cannot collide with page text.
     */
    public String placeholder() {
        return PLACEHOLDER_START + Integer.toString(index) + PLACEHOLDER_END;
    }
}
