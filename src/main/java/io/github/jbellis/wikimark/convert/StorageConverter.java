package io.github.jbellis.wikimark.convert;

import io.github.jbellis.wikimark.config.ConverterConfig;
import io.github.jbellis.wikimark.embed.EmbedResolver;
import io.github.jbellis.wikimark.text.Postprocessor;
import io.github.jbellis.wikimark.text.Preprocessor;
import io.github.jbellis.wikimark.tree.Node;
import io.github.jbellis.wikimark.tree.TreeBuilder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;

/**
 * Converts storage-format pages to the target markdown dialect.
 *
 * A conversion runs: literal payload protection, tree construction, the recursive walk,
 * embed resolution, and the final blank-line cleanup. Each call gets its own
 * {@link ConversionContext}, so one converter can serve concurrent conversions.
 */
public final class StorageConverter {
    private static final Logger logger = LogManager.getLogger(StorageConverter.class);

    private final RecursiveConverter converter;
    private final TreeBuilder treeBuilder = new TreeBuilder();
    private final EmbedResolver embedResolver;

    public StorageConverter(ConverterConfig config) {
        this(config, EmbedResolver.disabled());
    }

    public StorageConverter(ConverterConfig config, EmbedResolver embedResolver) {
        Objects.requireNonNull(config, "config");
        this.embedResolver = Objects.requireNonNull(embedResolver, "embedResolver");
        this.converter = new RecursiveConverter(new HandlerRegistry(config));
        logger.debug("Initialized StorageConverter with {}", config);
    }

    /**
     * Converts a full page.
     *
     * @param storageMarkup the page body in storage format
     * @return the converted document and the outcome of each attachment embed
     */
    public ConversionResult convert(String storageMarkup) {
        Objects.requireNonNull(storageMarkup, "storageMarkup");
        if (storageMarkup.isBlank()) {
            return new ConversionResult("", List.of(), 0);
        }

        var root = treeBuilder.parse(Preprocessor.protectLiteralPayloads(storageMarkup));
        var context = newContext();
        String raw = context.convert(root);

        var resolved = embedResolver.resolveAll(context.embedRequests());
        String markdown = Postprocessor.clean(EmbedResolver.substitute(raw, resolved));
        logger.debug("Converted page: {} chars in, {} chars out, {} callouts, {} embeds",
                     storageMarkup.length(), markdown.length(), context.calloutCount(), resolved.size());
        return new ConversionResult(markdown, resolved, context.calloutCount());
    }

    /**
     * Converts a single tree node with a fresh context, without pre- or post-processing and without
     * resolving embeds.
     */
    public String convertNode(Node node) {
        return newContext().convert(node);
    }

    /**
     * Starts a new conversion over this converter's handlers.
     */
    public ConversionContext newContext() {
        return new ConversionContext(converter);
    }
}
