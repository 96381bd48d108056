package io.github.jbellis.wikimark.mention;

import io.github.jbellis.wikimark.convert.macro.UserReferenceHandler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.HashMap;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code @{userkey}} mention placeholders in converted output with {@code @Display Name}.
 *
 * Runs on the caller's side after conversion. A key that cannot be resolved keeps its placeholder.
 * Each key is looked up at most once per call to {@link #enrich(String)}.
 */
public class MentionEnricher {
    private static final Logger logger = LogManager.getLogger(MentionEnricher.class);

    private static final Pattern MENTION = Pattern.compile("@\\{([^}\\s]+)}");

    private final UserDirectory directory;

    public MentionEnricher(UserDirectory directory) {
        this.directory = directory;
    }

    public String enrich(String markdown) {
        var cache = new HashMap<String, Optional<String>>();
        Matcher matcher = MENTION.matcher(markdown);
        var sb = new StringBuilder(markdown.length());
        while (matcher.find()) {
            String key = matcher.group(1);
            var name = cache.computeIfAbsent(key, this::lookup);
            String replacement = name.map(n -> "@" + n).orElse(matcher.group());
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private Optional<String> lookup(String key) {
        if (key.equals(UserReferenceHandler.UNKNOWN_USER)) {
            return Optional.empty();
        }
        try {
            var name = directory.resolveUserDisplayName(key).map(String::strip).filter(n -> !n.isEmpty());
            if (name.isEmpty()) {
                logger.warn("No display name for user {}", key);
            }
            return name;
        } catch (Exception e) {
            logger.warn("Failed to resolve user {}: {}", key, e.getMessage(), e);
            return Optional.empty();
        }
    }
}
