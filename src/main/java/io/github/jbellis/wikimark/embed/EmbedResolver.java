package io.github.jbellis.wikimark.embed;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Second pass of embed handling: fetches and publishes every attachment collected during conversion,
 * then swaps each placeholder for the rendered image line.
 *
 * A failing or empty collaborator result drops that single embed; it never fails the document.
 */
public class EmbedResolver {
    private static final Logger logger = LogManager.getLogger(EmbedResolver.class);

    private static final Pattern PLACEHOLDER = Pattern.compile(
            EmbedRequest.PLACEHOLDER_START + "(\\d+)" + EmbedRequest.PLACEHOLDER_END);

    private final AttachmentFetcher fetcher;
    private final AttachmentPublisher publisher;
    private final Executor executor;

    /**
     * Resolves embeds one after another on the calling thread.
     */
    public EmbedResolver(AttachmentFetcher fetcher, AttachmentPublisher publisher) {
        this(fetcher, publisher, null);
    }

    /**
     * @param executor runs the fetch/publish of each embed; null resolves sequentially on the calling thread
     */
    public EmbedResolver(AttachmentFetcher fetcher, AttachmentPublisher publisher, Executor executor) {
        this.fetcher = fetcher;
        this.publisher = publisher;
        this.executor = executor;
    }

    /**
     * A resolver without collaborators: every embed is dropped.
     */
    public static EmbedResolver disabled() {
        return new EmbedResolver(filename -> Optional.empty(), handle -> Optional.empty());
    }

    public List<ResolvedEmbed> resolveAll(List<EmbedRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        if (executor == null) {
            var result = new ArrayList<ResolvedEmbed>(requests.size());
            for (var request : requests) {
                result.add(resolve(request));
            }
            return result;
        }

        var futures = requests.stream()
                .map(request -> CompletableFuture.supplyAsync(() -> resolve(request), executor))
                .toList();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    /**
     * Fetches and publishes one attachment.
     */
    public ResolvedEmbed resolve(EmbedRequest request) {
        String filename = request.filename();
        try {
            Optional<Path> local = fetcher.fetchBinaryByName(filename);
            if (local.isEmpty()) {
                logger.warn("Attachment {} could not be fetched, dropping embed", filename);
                return ResolvedEmbed.dropped(request);
            }
            Optional<String> reference = publisher.publishBinary(local.get());
            if (reference.isEmpty() || reference.get().isBlank()) {
                logger.warn("Attachment {} could not be published, dropping embed", filename);
                return ResolvedEmbed.dropped(request);
            }
            logger.debug("Resolved attachment {} to {}", filename, reference.get());
            return new ResolvedEmbed(request, reference.get());
        } catch (Exception e) {
            logger.warn("Failed to embed attachment {}: {}", filename, e.getMessage(), e);
            return ResolvedEmbed.dropped(request);
        }
    }

    /**
     * Replaces every embed placeholder in {@code text}. Placeholders without a matching resolution
     * are removed.
     */
    public static String substitute(String text, List<ResolvedEmbed> resolved) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        var sb = new StringBuilder(text.length());
        while (matcher.find()) {
            int index = Integer.parseInt(matcher.group(1));
            String rendered = resolved.stream()
                    .filter(r -> r.request().index() == index)
                    .findFirst()
                    .map(ResolvedEmbed::render)
                    .orElse("");
            matcher.appendReplacement(sb, Matcher.quoteReplacement(rendered));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
