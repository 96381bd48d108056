package io.github.jbellis.wikimark.convert.macro;

import java.util.Locale;
import java.util.Optional;

/**
 * Structured macros with dedicated rendering. Unlisted macro names are flattened to their content.
 */
public enum MacroKind {
    CODE("code"),
    INFO("info"),
    NOTE("note"),
    TIP("tip"),
    WARNING("warning"),
    JIRA("jira"),
    MULTIMEDIA("multimedia");

    private final String macroName;

    MacroKind(String macroName) {
        this.macroName = macroName;
    }

    public static Optional<MacroKind> of(String macroName) {
        if (macroName == null) {
            return Optional.empty();
        }
        String normalized = macroName.strip().toLowerCase(Locale.ROOT);
        for (var kind : values()) {
            if (kind.macroName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
