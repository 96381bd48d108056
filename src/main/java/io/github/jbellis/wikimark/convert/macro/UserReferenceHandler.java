package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.convert.NodeHandler;
import io.github.jbellis.wikimark.tree.Node;

/**
 * Renders an {@code ac:link} to a user as a mention placeholder {@code @{userkey}}. The placeholder is
 * turned into a display name by {@link io.github.jbellis.wikimark.mention.MentionEnricher}.
 * Links that do not point at a user are flattened to their link body.
 */
public class UserReferenceHandler implements NodeHandler {
    public static final String USER = "ri:user";
    public static final String UNKNOWN_USER = "unknown-user";

    @Override
    public String handle(Node.Element element, ConversionContext context) {
        var user = element.findFirst(USER);
        if (user.isEmpty()) {
            return context.convertChildren(element);
        }
        String key = user.get().attr("ri:userkey").strip();
        if (key.isEmpty()) {
            key = user.get().attr("ri:account-id").strip();
        }
        return mention(key.isEmpty() ? UNKNOWN_USER : key);
    }

    public static String mention(String key) {
        return "@{" + key + "}";
    }
}
