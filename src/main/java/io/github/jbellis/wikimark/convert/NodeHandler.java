package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.tree.Node;

/**
 * Renders one kind of element. Handlers recurse through {@link ConversionContext#convert(Node)} and
 * decide themselves how to join their children's output.
 */
@FunctionalInterface
public interface NodeHandler {
    String handle(Node.Element element, ConversionContext context);
}
