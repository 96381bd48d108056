package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.embed.EmbedRequest;
import io.github.jbellis.wikimark.tree.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * State of a single document conversion, threaded through every handler.
 *
 * Owns all mutable state of the walk, such as the callout counter.
 * A context is created per conversion and must not be reused or shared between threads.
 */
public final class ConversionContext {
    /**
     * Marks a block that has to leave any enclosing blockquote; see {@link #standalone(String)}.
     */
    public static final char BREAKOUT_START = '\uE000';
    public static final char BREAKOUT_END = '\uE001';

    private final RecursiveConverter converter;
    private final List<EmbedRequest> embeds = new ArrayList<>();
    private int nextCallout;
    private int quoteDepth;

    public ConversionContext(RecursiveConverter converter) {
        this.converter = converter;
    }

    /**
     * The recursion callback handed to handlers.
     */
    public String convert(Node node) {
        return converter.convert(node, this);
    }

    /**
     * Converts every child in order and concatenates the results.
     */
    public String convertChildren(Node.Element element) {
        var sb = new StringBuilder();
        for (var child : element.children()) {
            sb.append(convert(child));
        }
        return sb.toString();
    }

    /**
     * Converts children for a context that renders on a single line, such as a table cell. Blocks
     * produced there stay in place, so no break-out markers are emitted even inside a quote.
     */
    public String convertChildrenInline(Node.Element element) {
        int savedDepth = quoteDepth;
        quoteDepth = 0;
        try {
            return convertChildren(element);
        } finally {
            quoteDepth = savedDepth;
        }
    }

    /**
     * Allocates the next callout number, starting at 0, in traversal order.
     */
    public int nextCalloutIndex() {
        return nextCallout++;
    }

    public int calloutCount() {
        return nextCallout;
    }

    /**
     * Records an attachment embed and returns the placeholder to emit in its place.
     */
    public String requestEmbed(String filename) {
        var request = new EmbedRequest(embeds.size(), filename);
        embeds.add(request);
        return request.placeholder();
    }

    public List<EmbedRequest> embedRequests() {
        return List.copyOf(embeds);
    }

    public void enterQuote() {
        quoteDepth++;
    }

    public void exitQuote() {
        if (quoteDepth == 0) {
            throw new IllegalStateException("exitQuote without matching enterQuote");
        }
        quoteDepth--;
    }

    public boolean inQuote() {
        return quoteDepth > 0;
    }

    /**
     * Emits a block that the target dialect cannot nest in a blockquote. Inside a quote the block is
     * wrapped in break-out markers so the enclosing callout can lift it out; elsewhere it is returned
     * unchanged.
     */
    public String standalone(String block) {
        if (!inQuote() || block.isEmpty()) {
            return block;
        }
        return BREAKOUT_START + block + BREAKOUT_END;
    }
}
