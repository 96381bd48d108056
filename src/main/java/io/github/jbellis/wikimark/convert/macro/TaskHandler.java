package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.text.Whitespace;
import io.github.jbellis.wikimark.tree.Node;

/**
 * Task lists and their tasks. A task renders as a checkbox line; its body is flattened to plain text.
 */
public final class TaskHandler {
    public static final String TASK = "ac:task";
    public static final String STATUS = "ac:task-status";
    public static final String BODY = "ac:task-body";
    public static final String COMPLETE = "complete";

    private TaskHandler() {
    }

    public static String taskList(Node.Element element, ConversionContext context) {
        var sb = new StringBuilder();
        for (var child : element.childElements()) {
            sb.append(context.convert(child));
        }
        if (sb.length() == 0) {
            return "";
        }
        return sb.append('\n').toString();
    }

    public static String task(Node.Element element, ConversionContext context) {
        boolean complete = element.firstChild(STATUS)
                .map(status -> status.text().strip().equals(COMPLETE))
                .orElse(false);
        String body = element.firstChild(BODY)
                .map(b -> Whitespace.collapse(b.text()).strip())
                .orElse("");
        return (complete ? "- [x] " : "- [ ] ") + body + "\n";
    }
}
