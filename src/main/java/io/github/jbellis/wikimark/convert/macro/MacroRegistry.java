package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.config.CalloutStyle;
import io.github.jbellis.wikimark.config.ConverterConfig;
import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.convert.NodeHandler;
import io.github.jbellis.wikimark.tree.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;

/**
 * Dispatches structured macros by their {@code ac:name}. Unknown macros keep their content: every
 * child is converted and concatenated.
 */
public class MacroRegistry implements NodeHandler {
    private static final Logger logger = LogManager.getLogger(MacroRegistry.class);

    private final Map<MacroKind, MacroHandler> handlers = new EnumMap<>(MacroKind.class);

    public MacroRegistry(ConverterConfig config) {
        var callouts = calloutRenderer(config.calloutStyle());
        var embeds = new AttachmentEmbedHandler();
        var code = new CodeMacroHandler();
        var jira = new JiraMacroHandler(config.issueTrackerBaseUrl());
        for (var kind : MacroKind.values()) {
            handlers.put(kind, switch (kind) {
                case CODE -> code;
                case INFO, NOTE, TIP, WARNING -> callouts;
                case JIRA -> jira;
                case MULTIMEDIA -> embeds;
            });
        }
    }

    private static MacroHandler calloutRenderer(CalloutStyle style) {
        return switch (style) {
            case BLOCKQUOTE -> new BlockquoteCalloutRenderer();
            case MARKER_PAIR -> new MarkerPairCalloutRenderer();
        };
    }

    @Override
    public String handle(Node.Element element, ConversionContext context) {
        var macro = new MacroNode(element);
        var kind = MacroKind.of(macro.name());
        if (kind.isEmpty()) {
            logger.debug("Unknown macro '{}', flattening its content", macro.name());
            return context.convertChildren(element);
        }
        logger.debug("Rendering {} macro", kind.get());
        return handlers.get(kind.get()).render(macro, context);
    }
}
