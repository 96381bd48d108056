package io.github.jbellis.wikimark.embed;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Retrieves an attachment of the page being converted.
 */
@FunctionalInterface
public interface AttachmentFetcher {
    /**
     * @param filename attachment filename
     * @return a local handle to the downloaded binary, or empty if the attachment is unavailable
     * @throws IOException on transport or storage failure
     */
    Optional<Path> fetchBinaryByName(String filename) throws IOException;
}
