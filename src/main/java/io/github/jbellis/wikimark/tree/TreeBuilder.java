package io.github.jbellis.wikimark.tree;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Builds the immutable {@link Node} tree from storage-format markup using Jsoup.
 *
 * Jsoup keeps namespaced tags such as {@code ac:structured-macro} and {@code ri:attachment} as
 * ordinary unknown elements, so the walk only has to copy names, attributes and children.
 * Comments, doctypes and script/style data are dropped.
 */
public class TreeBuilder {
    private static final Logger logger = LogManager.getLogger(TreeBuilder.class);

    /**
     * Containers whose text is literal: whitespace inside them is significant.
     */
    public static final Set<String> LITERAL_CONTAINERS = Set.of("ac:plain-text-body", "pre");

    /**
     * Parses markup and returns the document body as the root element.
     *
     * @param markup storage-format markup, possibly a fragment
     * @return the root element, named {@code body}
     */
    public Node.Element parse(String markup) {
        var doc = Jsoup.parse(markup);
        var root = adapt(doc.body(), false);
        logger.debug("Built tree with {} top-level children", root.children().size());
        return root;
    }

    private Node.Element adapt(org.jsoup.nodes.Element element, boolean raw) {
        String name = element.tagName();
        boolean childRaw = raw || LITERAL_CONTAINERS.contains(name);

        var attributes = new LinkedHashMap<String, String>();
        element.attributes().forEach(attr -> attributes.put(attr.getKey(), attr.getValue()));

        List<Node> children = new ArrayList<>();
        for (var child : element.childNodes()) {
            if (child instanceof org.jsoup.nodes.Element childElement) {
                children.add(adapt(childElement, childRaw));
            } else if (child instanceof CDataNode cdata) {
                // CDATA content is always literal
                children.add(new Node.Text(cdata.getWholeText(), true));
            } else if (child instanceof TextNode textNode) {
                children.add(new Node.Text(textNode.getWholeText(), childRaw));
            }
            // Comments, data nodes, etc. are ignored
        }
        return new Node.Element(name, attributes, children);
    }
}
