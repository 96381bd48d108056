package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.text.Whitespace;
import io.github.jbellis.wikimark.tree.Node;
import io.github.jbellis.wikimark.tree.NodeKind;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Walks the tree and dispatches each element to its handler.
 *
 * Text is whitespace-collapsed unless it is raw. Elements without a handler are flattened: their
 * children are joined with a blank line when any child is block-level, and concatenated otherwise.
 */
public class RecursiveConverter {
    private static final Logger logger = LogManager.getLogger(RecursiveConverter.class);

    private final HandlerRegistry registry;

    public RecursiveConverter(HandlerRegistry registry) {
        this.registry = registry;
    }

    public String convert(Node node, ConversionContext context) {
        if (node instanceof Node.Text text) {
            return text.raw() ? text.value() : Whitespace.collapse(text.value());
        }
        if (node instanceof Node.Element element) {
            var handler = registry.handlerFor(element.kind());
            if (handler != null) {
                return handler.handle(element, context);
            }
            return flatten(element, context);
        }
        throw new IllegalStateException("Unexpected node type: " + node.getClass().getName());
    }

    private String flatten(Node.Element element, ConversionContext context) {
        boolean hasBlockChild = element.childElements().stream()
                .anyMatch(child -> NodeKind.BLOCK_LEVEL.contains(child.name()));
        logger.debug("Flattening unhandled element <{}> (block join: {})", element.name(), hasBlockChild);

        if (!hasBlockChild) {
            return context.convertChildren(element);
        }

        var sb = new StringBuilder();
        for (var child : element.children()) {
            String converted = context.convert(child);
            // whitespace between blocks carries no content
            if (converted.isBlank()) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(converted);
        }
        return sb.toString();
    }
}
