package io.github.jbellis.wikimark.embed;

/**
 * Outcome of resolving one {@link EmbedRequest}.
 *
 * @param request   the embed
 * @param reference public reference returned by the publisher, or null when the embed was dropped
 */
public record ResolvedEmbed(EmbedRequest request, String reference) {

    public static ResolvedEmbed dropped(EmbedRequest request) {
        return new ResolvedEmbed(request, null);
    }

    public boolean isResolved() {
        return reference != null;
    }

    /**
     * Target-dialect rendering: an image embed, or nothing for a dropped embed. Line breaks around
     * the embed belong to the placeholder's surroundings.
     */
    public String render() {
        if (reference == null) {
            return "";
        }
        return "![" + request.filename() + "](" + reference + ")";
    }
}
