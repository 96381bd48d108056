package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.config.CalloutStyle;
import io.github.jbellis.wikimark.config.ConverterConfig;
import io.github.jbellis.wikimark.convert.StorageConverter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CalloutRendererTest {

    private static String callout(String name, String title, String body) {
        var sb = new StringBuilder("<ac:structured-macro ac:name=\"").append(name).append("\">");
        if (title != null) {
            sb.append("<ac:parameter ac:name=\"title\">").append(title).append("</ac:parameter>");
        }
        if (body != null) {
            sb.append("<ac:rich-text-body>").append(body).append("</ac:rich-text-body>");
        }
        return sb.append("</ac:structured-macro>").toString();
    }

    private static String code(String payload) {
        return "<ac:structured-macro ac:name=\"code\"><ac:plain-text-body><![CDATA["
               + payload + "]]></ac:plain-text-body></ac:structured-macro>";
    }

    private static String convert(CalloutStyle style, String markup) {
        var converter = new StorageConverter(ConverterConfig.defaults().withCalloutStyle(style));
        return converter.convert(markup).markdown();
    }

    @Test
    void markerPairNumbersCalloutsInTraversalOrder() {
        var page = callout("info", "Outer", "<p>a</p>" + callout("note", null, "<p>b</p>"))
                   + "<p>between</p>"
                   + callout("tip", null, "<p>c</p>");

        var markdown = convert(CalloutStyle.MARKER_PAIR, page);

        int start0 = markdown.indexOf(MarkerPairCalloutRenderer.startMarker(0));
        int start1 = markdown.indexOf(MarkerPairCalloutRenderer.startMarker(1));
        int end1 = markdown.indexOf(MarkerPairCalloutRenderer.endMarker(1));
        int end0 = markdown.indexOf(MarkerPairCalloutRenderer.endMarker(0));
        int start2 = markdown.indexOf(MarkerPairCalloutRenderer.startMarker(2));
        assertEquals(0, start0);
        assertTrue(start0 < start1 && start1 < end1 && end1 < end0 && end0 < start2, markdown);
        assertFalse(markdown.contains("CALLOUT 3"));
    }

    @Test
    void markerPairWithoutTitleOrBody() {
        var markdown = convert(CalloutStyle.MARKER_PAIR, callout("info", null, null));
        // the empty slot between the markers collapses into a single blank line
        assertEquals("===========START CALLOUT 0==========\n\n===========END CALLOUT 0==========", markdown);
    }

    @Test
    void blockquoteQuotesEveryLine() {
        var markdown = convert(CalloutStyle.BLOCKQUOTE,
                               callout("info", "Heads up", "<p>first</p><ul><li>one</li><li>two</li></ul>"));
        assertEquals("> **Heads up**\n> first\n>\n> * one\n> * two", markdown);
    }

    @Test
    void blockquoteWithoutTitle() {
        assertEquals("> just body", convert(CalloutStyle.BLOCKQUOTE, callout("note", null, "<p>just body</p>")));
    }

    @Test
    void emptyBlockquoteCalloutRendersNothing() {
        assertEquals("before\n\nafter",
                     convert(CalloutStyle.BLOCKQUOTE, "<p>before</p>" + callout("info", null, "<p> </p>") + "<p>after</p>"));
    }

    @Test
    void codeBreaksOutOfBlockquote() {
        var markdown = convert(CalloutStyle.BLOCKQUOTE,
                               callout("warning", "Careful", code("rm -rf build") + "<p>then rebuild</p>"));
        assertEquals("> **Careful**\n\n```\nrm -rf build\n```\n\n> then rebuild", markdown);
    }

    @Test
    void codeBreaksOutOfNestedBlockquotes() {
        var page = callout("info", null, "<p>Outer</p>" + callout("note", null, "<p>Inner</p>" + code("x")));

        var markdown = convert(CalloutStyle.BLOCKQUOTE, page);

        assertEquals("> Outer\n>\n> > Inner\n\n```\nx\n```", markdown);
    }

    @Test
    void codeInsideTableCellIsNotLiftedOutOfQuote() {
        var table = "<table><tbody><tr><td>k</td><td>v</td></tr>"
                    + "<tr><td>x</td><td>" + code("ls") + "</td></tr></tbody></table>";

        var markdown = convert(CalloutStyle.BLOCKQUOTE, callout("info", null, table));

        assertEquals("> | k | v |\n> | --- | --- |\n> | x | ``` ls ``` |", markdown);
    }

    @Test
    void blockquoteCalloutsStillTakeNumbers() {
        var converter = new StorageConverter(ConverterConfig.defaults());
        var result = converter.convert(callout("info", null, "<p>a</p>") + callout("note", null, "<p>b</p>"));
        assertEquals(2, result.calloutCount());
        assertFalse(result.markdown().contains("CALLOUT"));
    }
}
