package io.github.jbellis.wikimark.text;

import java.util.regex.Pattern;

/**
 * Entity encoding for literal payloads (code macro bodies). {@link #decode(String)} exactly
 * reverses {@link #encode(String)} for any input.
 */
public final class LiteralPayloadCodec {
    private static final Pattern ENTITY = Pattern.compile("&(amp|lt|gt);");

    private LiteralPayloadCodec() {
    }

    public static String encode(String text) {
        var sb = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Single pass, so {@code &amp;lt;} becomes {@code &lt;} rather than {@code <}.
     */
    public static String decode(String text) {
        var matcher = ENTITY.matcher(text);
        var sb = new StringBuilder(text.length());
        while (matcher.find()) {
            String replacement = switch (matcher.group(1)) {
                case "amp" -> "&";
                case "lt" -> "<";
                default -> ">";
            };
            matcher.appendReplacement(sb, replacement);
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
