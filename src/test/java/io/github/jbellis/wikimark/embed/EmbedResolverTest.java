package io.github.jbellis.wikimark.embed;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class EmbedResolverTest {

    private static final AttachmentPublisher PUBLISH_BY_NAME =
            handle -> Optional.of("https://cdn.test/" + handle.getFileName());

    private static AttachmentFetcher fetchFromTmp() {
        return filename -> Optional.of(Path.of("/tmp/attachments", filename));
    }

    private static List<EmbedRequest> requests(String... filenames) {
        var result = new ArrayList<EmbedRequest>();
        for (int i = 0; i < filenames.length; i++) {
            result.add(new EmbedRequest(i, filenames[i]));
        }
        return result;
    }

    @Test
    void resolvesInRequestOrder() {
        var resolver = new EmbedResolver(fetchFromTmp(), PUBLISH_BY_NAME);

        var resolved = resolver.resolveAll(requests("a.png", "b.gif"));

        assertEquals(2, resolved.size());
        assertEquals("![a.png](https://cdn.test/a.png)", resolved.get(0).render());
        assertEquals("https://cdn.test/b.gif", resolved.get(1).reference());
    }

    @Test
    void failuresDropOnlyTheAffectedEmbed() {
        AttachmentFetcher fetcher = filename -> switch (filename) {
            case "missing.png" -> Optional.empty();
            case "io.png" -> throw new IOException("connection reset");
            case "bug.png" -> throw new IllegalStateException("boom");
            default -> Optional.of(Path.of(filename));
        };
        AttachmentPublisher publisher = handle -> handle.toString().equals("blank.png")
                ? Optional.of("  ")
                : Optional.of("ref:" + handle);
        var resolver = new EmbedResolver(fetcher, publisher);

        var resolved = resolver.resolveAll(requests("missing.png", "io.png", "ok.png", "bug.png", "blank.png"));

        assertEquals(List.of(false, false, true, false, false),
                     resolved.stream().map(ResolvedEmbed::isResolved).toList());
        assertEquals("", resolved.get(0).render());
        assertEquals("![ok.png](ref:ok.png)", resolved.get(2).render());
    }

    @Test
    void executorModeKeepsRequestOrder() {
        var threads = ConcurrentHashMap.<String>newKeySet();
        AttachmentFetcher fetcher = filename -> {
            threads.add(Thread.currentThread().getName());
            return Optional.of(Path.of(filename));
        };
        var pool = Executors.newFixedThreadPool(4);
        try {
            var resolver = new EmbedResolver(fetcher, PUBLISH_BY_NAME, pool);
            var names = new String[20];
            for (int i = 0; i < names.length; i++) {
                names[i] = "img" + i + ".png";
            }

            var resolved = resolver.resolveAll(requests(names));

            for (int i = 0; i < names.length; i++) {
                assertEquals(i, resolved.get(i).request().index());
                assertEquals("https://cdn.test/" + names[i], resolved.get(i).reference());
            }
            assertFalse(threads.contains(Thread.currentThread().getName()));
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void disabledResolverDropsEverything() {
        var resolved = EmbedResolver.disabled().resolveAll(requests("a.png"));
        assertFalse(resolved.get(0).isResolved());
        assertTrue(EmbedResolver.disabled().resolveAll(List.of()).isEmpty());
    }

    @Test
    void substituteReplacesPlaceholders() {
        var first = new EmbedRequest(0, "a.png");
        var second = new EmbedRequest(1, "b.png");
        var third = new EmbedRequest(2, "c.png");
        var text = "x " + first.placeholder() + " y " + second.placeholder() + " z " + third.placeholder();
        var resolved = List.of(new ResolvedEmbed(first, "https://cdn.test/$1\\a"),
                               ResolvedEmbed.dropped(second));

        var result = EmbedResolver.substitute(text, resolved);

        // dropped and unknown placeholders disappear
        assertEquals("x ![a.png](https://cdn.test/$1\\a) y  z ", result);
    }

    @Test
    void substituteLeavesPlainTextAlone() {
        assertEquals("no embeds {0} here", EmbedResolver.substitute("no embeds {0} here", List.of()));
    }

    @Test
    void placeholdersAreDistinctPerIndex() {
        Set<String> placeholders = Set.of(new EmbedRequest(0, "a").placeholder(),
                                          new EmbedRequest(1, "a").placeholder(),
                                          new EmbedRequest(10, "a").placeholder());
        assertEquals(3, placeholders.size());
    }
}
