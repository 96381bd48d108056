package io.github.jbellis.wikimark.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Immutable storage-format tree. A node is either a run of text or an element with
 * attributes and ordered children.
 */
public sealed interface Node permits Node.Text, Node.Element {

    /**
     * A run of character data.
     *
     * @param value the decoded text
     * @param raw   true when the text sits inside a literal container and must not be whitespace-collapsed
     */
    record Text(String value, boolean raw) implements Node {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        public boolean isBlank() {
            return value.isBlank();
        }
    }

    /**
     * An element. Names are lower-case and keep their namespace prefix, e.g. {@code ac:structured-macro}.
     */
    record Element(String name, Map<String, String> attributes, List<Node> children) implements Node {
        public Element {
            Objects.requireNonNull(name, "name");
            attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = List.copyOf(children);
        }

        public NodeKind kind() {
            return NodeKind.of(name);
        }

        /**
         * @return the attribute value, or the empty string when absent
         */
        public String attr(String key) {
            return attributes.getOrDefault(key, "");
        }

        public List<Element> childElements() {
            var result = new ArrayList<Element>();
            for (var child : children) {
                if (child instanceof Element e) {
                    result.add(e);
                }
            }
            return result;
        }

        public List<Element> childElements(String childName) {
            return childElements().stream().filter(e -> e.name.equals(childName)).toList();
        }

        public Optional<Element> firstChild(String childName) {
            return childElements().stream().filter(e -> e.name.equals(childName)).findFirst();
        }

        /**
         * Depth-first, document-order search of descendants (not including this element).
         */
        public Optional<Element> findFirst(Predicate<Element> predicate) {
            for (var child : children) {
                if (child instanceof Element e) {
                    if (predicate.test(e)) {
                        return Optional.of(e);
                    }
                    var nested = e.findFirst(predicate);
                    if (nested.isPresent()) {
                        return nested;
                    }
                }
            }
            return Optional.empty();
        }

        public Optional<Element> findFirst(String descendantName) {
            return findFirst(e -> e.name.equals(descendantName));
        }

        public boolean hasDescendant(Predicate<Element> predicate) {
            return findFirst(predicate).isPresent();
        }

        /**
         * Concatenated text of every descendant text node, without any normalization.
         */
        public String text() {
            var sb = new StringBuilder();
            appendText(this, sb);
            return sb.toString();
        }

        private static void appendText(Element element, StringBuilder sb) {
            for (var child : element.children) {
                if (child instanceof Text t) {
                    sb.append(t.value());
                } else if (child instanceof Element e) {
                    appendText(e, sb);
                }
            }
        }
    }
}
