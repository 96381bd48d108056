package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.config.ConverterConfig;
import io.github.jbellis.wikimark.convert.macro.AttachmentEmbedHandler;
import io.github.jbellis.wikimark.convert.macro.MacroRegistry;
import io.github.jbellis.wikimark.convert.macro.TaskHandler;
import io.github.jbellis.wikimark.convert.macro.TimestampHandler;
import io.github.jbellis.wikimark.convert.macro.UserReferenceHandler;
import io.github.jbellis.wikimark.convert.table.TableHandler;
import io.github.jbellis.wikimark.tree.NodeKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Maps every {@link NodeKind} to its handler. The mapping is a switch over the enum, so a new kind
 * does not compile until it is given a handler (or explicitly left to the driver).
 */
public final class HandlerRegistry {
    private final Map<NodeKind, NodeHandler> handlers = new EnumMap<>(NodeKind.class);

    public HandlerRegistry(ConverterConfig config) {
        var macros = new MacroRegistry(config);
        var embeds = new AttachmentEmbedHandler();
        for (var kind : NodeKind.values()) {
            var handler = select(kind, config, macros, embeds);
            if (handler != null) {
                handlers.put(kind, handler);
            }
        }
    }

    private static NodeHandler select(NodeKind kind,
                                      ConverterConfig config,
                                      MacroRegistry macros,
                                      AttachmentEmbedHandler embeds) {
        return switch (kind) {
            case PARAGRAPH -> BlockHandlers::paragraph;
            case HEADING -> BlockHandlers.heading(config.maxHeadingLevel());
            case EMPHASIS -> InlineHandlers::emphasis;
            case STRONG -> InlineHandlers::strong;
            case LINK -> InlineHandlers.link(config.siteBaseUrl());
            case LIST -> InlineHandlers::list;
            case LIST_ITEM -> InlineHandlers::listItem;
            case LINE_BREAK -> InlineHandlers::lineBreak;
            case TABLE -> new TableHandler();
            case STRUCTURED_MACRO -> macros;
            case IMAGE -> embeds;
            case TASK_LIST -> TaskHandler::taskList;
            case TASK -> TaskHandler::task;
            case USER_LINK -> new UserReferenceHandler();
            case TIME -> new TimestampHandler();
            case OTHER -> null;
        };
    }

    /**
     * @return the handler for {@code kind}, or null when the driver should flatten the element
     */
    public NodeHandler handlerFor(NodeKind kind) {
        return handlers.get(kind);
    }
}
