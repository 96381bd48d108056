package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.text.Whitespace;
import io.github.jbellis.wikimark.tree.Node;

/**
 * Handlers for inline formatting, links and lists.
 */
public final class InlineHandlers {
    public static final String EMPHASIS_MARKER = "_";
    public static final String STRONG_MARKER = "**";

    private InlineHandlers() {
    }

    public static String emphasis(Node.Element element, ConversionContext context) {
        return wrap(context.convertChildren(element), EMPHASIS_MARKER);
    }

    public static String strong(Node.Element element, ConversionContext context) {
        return wrap(context.convertChildren(element), STRONG_MARKER);
    }

    /**
     * Wraps the non-whitespace core of {@code content} in {@code marker}, keeping leading and trailing
     * whitespace outside the markers. Pure whitespace is returned unchanged.
     */
    public static String wrap(String content, String marker) {
        String core = content.strip();
        if (core.isEmpty()) {
            return content;
        }
        return Whitespace.leading(content) + marker + core + marker + Whitespace.trailing(content);
    }

    /**
     * Link handler resolving site-relative hrefs against {@code siteBaseUrl}.
     */
    public static NodeHandler link(String siteBaseUrl) {
        return (element, context) -> {
            String text = context.convertChildren(element).strip();
            String href = element.attr("href").strip();
            if (href.startsWith("/")) {
                href = siteBaseUrl + href;
            }
            if (text.isEmpty()) {
                return href;
            }
            if (href.isEmpty()) {
                return text;
            }
            return "[" + text + "](" + href + ")";
        };
    }

    public static String lineBreak(Node.Element element, ConversionContext context) {
        return "\n";
    }

    public static String listItem(Node.Element element, ConversionContext context) {
        return "* " + context.convertChildren(element).strip() + "\n";
    }

    /**
     * Lists contribute no markup of their own; items carry the bullets. Whitespace between items is
     * dropped so every bullet starts its own line.
     */
    public static String list(Node.Element element, ConversionContext context) {
        var sb = new StringBuilder();
        for (var child : element.children()) {
            if (child instanceof Node.Text text && text.isBlank()) {
                continue;
            }
            sb.append(context.convert(child));
        }
        return sb.toString();
    }
}
