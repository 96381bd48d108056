package io.github.jbellis.wikimark.tree;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Closed set of element kinds the converter knows how to render. Anything else is {@link #OTHER}
 * and gets flattened by the driver.
 */
public enum NodeKind {
    PARAGRAPH("p"),
    HEADING("h1", "h2", "h3", "h4", "h5", "h6"),
    EMPHASIS("em", "i"),
    STRONG("strong", "b"),
    LINK("a"),
    LIST("ul", "ol"),
    LIST_ITEM("li"),
    LINE_BREAK("br"),
    TABLE("table"),
    STRUCTURED_MACRO("ac:structured-macro"),
    IMAGE("ac:image"),
    TASK_LIST("ac:task-list"),
    TASK("ac:task"),
    USER_LINK("ac:link"),
    TIME("time"),
    OTHER;

    private static final Map<String, NodeKind> BY_NAME = new HashMap<>();

    static {
        for (var kind : values()) {
            for (var name : kind.names) {
                BY_NAME.put(name, kind);
            }
        }
    }

    /**
     * Element names whose presence among an unhandled element's children switches the
     * driver to blank-line joining.
     */
    public static final Set<String> BLOCK_LEVEL = Set.of(
            "p", "h1", "h2", "h3", "h4", "h5", "h6",
            "ul", "ol", "table", "blockquote", "pre", "div", "hr",
            "ac:structured-macro", "ac:image", "ac:task-list", "ac:layout", "ac:layout-section", "ac:layout-cell");

    private final String[] names;

    NodeKind(String... names) {
        this.names = names;
    }

    public static NodeKind of(String elementName) {
        return BY_NAME.getOrDefault(elementName, OTHER);
    }

    /**
     * Heading level encoded in the element name, e.g. 2 for {@code h2}. Only meaningful for {@link #HEADING}.
     */
    public static int headingLevel(String elementName) {
        if (elementName.length() == 2 && elementName.charAt(0) == 'h' && Character.isDigit(elementName.charAt(1))) {
            return elementName.charAt(1) - '0';
        }
        throw new IllegalArgumentException("Not a heading element: " + elementName);
    }
}
