package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;

/**
 * Renders an issue macro as a link to the issue tracker. Without a {@code key} parameter nothing is emitted.
 */
public class JiraMacroHandler implements MacroHandler {
    private final String issueTrackerBaseUrl;

    public JiraMacroHandler(String issueTrackerBaseUrl) {
        this.issueTrackerBaseUrl = issueTrackerBaseUrl;
    }

    @Override
    public String render(MacroNode macro, ConversionContext context) {
        return macro.parameter("key")
                .map(key -> "[" + key + "](" + issueUrl(key) + ")\n\n")
                .orElse("");
    }

    public String issueUrl(String key) {
        return issueTrackerBaseUrl + key;
    }
}
