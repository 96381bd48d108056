package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.text.LiteralPayloadCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Renders a code macro as a fenced block tagged with its {@code language} parameter.
 *
 * The payload was entity-encoded by the preprocessor and is decoded here. Inside a callout the fence
 * is emitted as a standalone block, since a blockquote cannot hold it.
 */
public class CodeMacroHandler implements MacroHandler {
    private static final Logger logger = LogManager.getLogger(CodeMacroHandler.class);

    public static final String FENCE = "```";

    @Override
    public String render(MacroNode macro, ConversionContext context) {
        var body = macro.plainTextBody();
        if (body.isEmpty()) {
            return "";
        }
        String code = trimBlankLines(LiteralPayloadCodec.decode(body.get().text()));
        if (code.isBlank()) {
            return "";
        }
        String language = macro.parameter("language").orElse("");
        logger.debug("Rendering code block, language={}, content length={}", language, code.length());
        return context.standalone(fence(language, code));
    }

    public static String fence(String language, String code) {
        return FENCE + language + "\n" + code + "\n" + FENCE + "\n\n";
    }

    /**
     * Drops blank lines around the payload but keeps the indentation of its first line.
     */
    static String trimBlankLines(String code) {
        var lines = code.split("\\R", -1);
        int start = 0;
        int end = lines.length;
        while (start < end && lines[start].isBlank()) {
            start++;
        }
        while (end > start && lines[end - 1].isBlank()) {
            end--;
        }
        var sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            if (i > start) {
                sb.append('\n');
            }
            sb.append(i == end - 1 ? lines[i].stripTrailing() : lines[i]);
        }
        return sb.toString();
    }
}
