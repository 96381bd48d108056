package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.tree.Node;

import java.util.Optional;

/**
 * Read-only view of a structured macro element: its name, its parameters and its body.
 *
 * Only direct children are inspected, so the parameters and body of a nested macro are never
 * mistaken for those of the enclosing one.
 */
public final class MacroNode {
    public static final String NAME_ATTR = "ac:name";
    public static final String PARAMETER = "ac:parameter";
    public static final String PLAIN_TEXT_BODY = "ac:plain-text-body";
    public static final String RICH_TEXT_BODY = "ac:rich-text-body";

    private final Node.Element element;

    public MacroNode(Node.Element element) {
        this.element = element;
    }

    public Node.Element element() {
        return element;
    }

    public String name() {
        return element.attr(NAME_ATTR);
    }

    /**
     * @return the trimmed text of the named parameter, or empty when absent or blank
     */
    public Optional<String> parameter(String parameterName) {
        return element.childElements(PARAMETER).stream()
                .filter(p -> p.attr(NAME_ATTR).equals(parameterName))
                .map(p -> p.text().strip())
                .filter(v -> !v.isEmpty())
                .findFirst();
    }

    public Optional<Node.Element> plainTextBody() {
        return element.firstChild(PLAIN_TEXT_BODY);
    }

    public Optional<Node.Element> richTextBody() {
        return element.firstChild(RICH_TEXT_BODY);
    }
}
