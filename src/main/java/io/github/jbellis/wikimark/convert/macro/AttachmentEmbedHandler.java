package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.convert.NodeHandler;
import io.github.jbellis.wikimark.tree.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * First pass of attachment embedding, shared by {@code ac:image} and the multimedia macro.
 *
 * Records the referenced attachment with the conversion and emits a placeholder; no I/O happens
 * here. {@link io.github.jbellis.wikimark.embed.EmbedResolver} fetches, publishes and substitutes later.
 */
public class AttachmentEmbedHandler implements NodeHandler, MacroHandler {
    private static final Logger logger = LogManager.getLogger(AttachmentEmbedHandler.class);

    public static final String ATTACHMENT = "ri:attachment";
    public static final String FILENAME_ATTR = "ri:filename";

    @Override
    public String handle(Node.Element element, ConversionContext context) {
        var attachment = element.findFirst(ATTACHMENT);
        if (attachment.isEmpty()) {
            logger.debug("<{}> without an attachment reference, skipping", element.name());
            return "";
        }
        String filename = attachment.get().attr(FILENAME_ATTR).strip();
        if (filename.isEmpty()) {
            logger.debug("Attachment reference without a filename, skipping");
            return "";
        }
        return context.requestEmbed(filename) + "\n\n";
    }

    @Override
    public String render(MacroNode macro, ConversionContext context) {
        return handle(macro.element(), context);
    }
}
