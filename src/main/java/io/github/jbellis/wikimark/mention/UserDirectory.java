package io.github.jbellis.wikimark.mention;

import java.io.IOException;
import java.util.Optional;

/**
 * Looks up people referenced by a page.
 */
@FunctionalInterface
public interface UserDirectory {
    /**
     * @param userKey the key carried by a user reference
     * @return the user's display name, or empty if the key is unknown
     * @throws IOException on lookup failure
     */
    Optional<String> resolveUserDisplayName(String userKey) throws IOException;
}
