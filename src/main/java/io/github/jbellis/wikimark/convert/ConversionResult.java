package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.embed.ResolvedEmbed;

import java.util.List;

/**
 * Output of a full-document conversion.
 *
 * @param markdown     the converted document
 * @param embeds       every attachment embed found, in document order, with its resolution
 * @param calloutCount number of info/note callouts rendered
 */
public record ConversionResult(String markdown, List<ResolvedEmbed> embeds, int calloutCount) {
    public ConversionResult {
        embeds = List.copyOf(embeds);
    }

    public long droppedEmbeds() {
        return embeds.stream().filter(e -> !e.isResolved()).count();
    }
}
