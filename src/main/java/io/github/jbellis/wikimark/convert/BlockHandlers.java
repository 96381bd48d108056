package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.tree.Node;
import io.github.jbellis.wikimark.tree.NodeKind;

public final class BlockHandlers {

    private BlockHandlers() {
    }

    /**
     * Paragraph followed by a blank line. A paragraph with no visible text is elided unless it wraps
     * block-producing content (an image or a macro), which may render without text of its own.
     */
    public static String paragraph(Node.Element element, ConversionContext context) {
        String content = context.convertChildren(element);
        if (content.isBlank() && !element.hasDescendant(BlockHandlers::producesBlock)) {
            return "";
        }
        return content + "\n\n";
    }

    private static boolean producesBlock(Node.Element element) {
        var kind = element.kind();
        return kind == NodeKind.IMAGE || kind == NodeKind.STRUCTURED_MACRO;
    }

    /**
     * Heading handler; levels deeper than {@code maxLevel} are rendered at {@code maxLevel}.
     * A heading without text still emits its markers.
     */
    public static NodeHandler heading(int maxLevel) {
        return (element, context) -> {
            String content = context.convertChildren(element).strip();
            int level = Math.min(NodeKind.headingLevel(element.name()), maxLevel);
            return "#".repeat(level) + " " + content + "\n\n";
        };
    }
}
