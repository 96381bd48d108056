package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.convert.NodeHandler;
import io.github.jbellis.wikimark.tree.Node;

/**
 * Emits the {@code datetime} attribute of a {@code <time>} element as written, or nothing when it is absent.
 */
public class TimestampHandler implements NodeHandler {
    @Override
    public String handle(Node.Element element, ConversionContext context) {
        // HTML parsing ignores the self-closing slash on <time/>, so text that followed it ends up as children
        return element.attr("datetime") + context.convertChildren(element);
    }
}
