package io.github.jbellis.wikimark.text;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Protects literal code payloads before the markup is parsed.
 *
 * A plain-text body normally wraps its payload in CDATA. The payload is replaced with an
 * entity-encoded copy, encoded twice: the parser decodes the outer layer, which leaves the
 * {@link LiteralPayloadCodec} encoding in the tree for the code macro to reverse. Markup
 * metacharacters in the payload therefore never reach the parser as structure.
 *
 * A body is only rewritten when it consists of CDATA sections and whitespace. The end of each
 * section is located before the closing body tag is looked for, so a payload that itself contains
 * {@code </ac:plain-text-body>} stays intact.
 */
public final class Preprocessor {
    private static final Logger logger = LogManager.getLogger(Preprocessor.class);

    private static final String BODY_OPEN = "<ac:plain-text-body>";
    private static final String BODY_CLOSE = "</ac:plain-text-body>";
    private static final String CDATA_OPEN = "<![CDATA[";
    private static final String CDATA_CLOSE = "]]>";

    private Preprocessor() {
    }

    public static String protectLiteralPayloads(String markup) {
        var sb = new StringBuilder(markup.length());
        int protectedCount = 0;
        int pos = 0;
        while (true) {
            int open = markup.indexOf(BODY_OPEN, pos);
            if (open < 0) {
                break;
            }
            int contentStart = open + BODY_OPEN.length();
            var payload = new StringBuilder();
            int end = readCdataSections(markup, contentStart, payload);
            if (end < 0) {
                // not a CDATA body; copy the opening tag and keep scanning after it
                sb.append(markup, pos, contentStart);
                pos = contentStart;
                continue;
            }
            sb.append(markup, pos, open)
                    .append(BODY_OPEN)
                    .append(encodeForParser(payload.toString()))
                    .append(BODY_CLOSE);
            protectedCount++;
            pos = end;
        }
        sb.append(markup, pos, markup.length());
        logger.debug("Protected {} literal payload(s)", protectedCount);
        return sb.toString();
    }

    /**
     * Reads one or more CDATA sections, separated by whitespace, starting at {@code from} and
     * followed by the closing body tag. A payload containing "]]>" is split across several adjacent
     * sections; their contents are appended to {@code payload}.
     *
     * @return the index just past the closing body tag, or -1 if the body is not CDATA only
     */
    private static int readCdataSections(String markup, int from, StringBuilder payload) {
        int pos = skipWhitespace(markup, from);
        int sections = 0;
        while (markup.startsWith(CDATA_OPEN, pos)) {
            int close = markup.indexOf(CDATA_CLOSE, pos + CDATA_OPEN.length());
            if (close < 0) {
                return -1;
            }
            payload.append(markup, pos + CDATA_OPEN.length(), close);
            sections++;
            pos = skipWhitespace(markup, close + CDATA_CLOSE.length());
        }
        if (sections == 0 || !markup.startsWith(BODY_CLOSE, pos)) {
            return -1;
        }
        return pos + BODY_CLOSE.length();
    }

    private static int skipWhitespace(String text, int from) {
        int pos = from;
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static String encodeForParser(String payload) {
        return LiteralPayloadCodec.encode(LiteralPayloadCodec.encode(payload));
    }
}
