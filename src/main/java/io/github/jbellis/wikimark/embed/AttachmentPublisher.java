package io.github.jbellis.wikimark.embed;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Publishes a local binary somewhere the converted document can link to.
 */
@FunctionalInterface
public interface AttachmentPublisher {
    /**
     * @param handle local binary returned by an {@link AttachmentFetcher}
     * @return the public reference (usually a URL), or empty if publishing was refused
     * @throws IOException on transport failure
     */
    Optional<String> publishBinary(Path handle) throws IOException;
}
