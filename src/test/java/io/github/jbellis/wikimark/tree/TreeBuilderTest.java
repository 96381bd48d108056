package io.github.jbellis.wikimark.tree;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the TreeBuilder class.
 */
public class TreeBuilderTest {

    private TreeBuilder builder;

    @BeforeEach
    void setUp() {
        builder = new TreeBuilder();
    }

    @Test
    void testParseSimpleParagraph() {
        var root = builder.parse("<p>This is a <strong>simple</strong> paragraph.</p>");

        assertEquals("body", root.name());
        assertEquals(1, root.children().size());
        var p = (Node.Element) root.children().get(0);
        assertEquals(NodeKind.PARAGRAPH, p.kind());
        assertEquals(3, p.children().size());
        assertEquals("This is a simple paragraph.", p.text());
    }

    @Test
    void testNamespacedMacroKeepsNameAndAttributes() {
        var root = builder.parse("<ac:structured-macro ac:name=\"code\" ac:schema-version=\"1\">"
                                 + "<ac:parameter ac:name=\"language\">java</ac:parameter>"
                                 + "</ac:structured-macro>");

        var macro = (Node.Element) root.children().get(0);
        assertEquals("ac:structured-macro", macro.name());
        assertEquals(NodeKind.STRUCTURED_MACRO, macro.kind());
        assertEquals("code", macro.attr("ac:name"));
        assertEquals("1", macro.attr("ac:schema-version"));
        assertEquals("", macro.attr("missing"));

        var param = macro.firstChild("ac:parameter").orElseThrow();
        assertEquals("language", param.attr("ac:name"));
        assertEquals("java", param.text());
    }

    @Test
    void testSelfClosingReferencesAreEmptyElements() {
        var root = builder.parse("<p>Hi <ac:link><ri:user ri:userkey=\"abc\" /></ac:link> there</p>");

        var p = (Node.Element) root.children().get(0);
        var link = p.firstChild("ac:link").orElseThrow();
        var user = link.firstChild("ri:user").orElseThrow();
        assertEquals("abc", user.attr("ri:userkey"));
        assertTrue(user.children().isEmpty());
        // the text after the link stays a sibling of the link
        assertTrue(p.text().endsWith(" there"));
    }

    @Test
    void testLiteralContainerTextIsRaw() {
        var root = builder.parse("<ac:structured-macro ac:name=\"code\">"
                                 + "<ac:plain-text-body>a   b\n  c</ac:plain-text-body>"
                                 + "</ac:structured-macro><p>x   y</p>");

        var macro = (Node.Element) root.children().get(0);
        var body = macro.firstChild("ac:plain-text-body").orElseThrow();
        var literal = (Node.Text) body.children().get(0);
        assertTrue(literal.raw());
        assertEquals("a   b\n  c", literal.value());

        var p = (Node.Element) root.children().get(1);
        assertFalse(((Node.Text) p.children().get(0)).raw());
    }

    @Test
    void testCommentsAreDropped() {
        var root = builder.parse("<p>x<!-- hidden --></p>");

        var p = (Node.Element) root.children().get(0);
        assertEquals(1, p.children().size());
        assertEquals("x", p.text());
    }

    @Test
    void testFindFirstSearchesInDocumentOrder() {
        var root = builder.parse("<div><span><ri:attachment ri:filename=\"first.png\"/></span>"
                                 + "<ri:attachment ri:filename=\"second.png\"/></div>");

        var found = root.findFirst("ri:attachment").orElseThrow();
        assertEquals("first.png", found.attr("ri:filename"));
        assertTrue(root.hasDescendant(e -> e.attr("ri:filename").equals("second.png")));
    }

    @Test
    void testEmptyInputGivesEmptyBody() {
        var root = builder.parse("");
        assertEquals("body", root.name());
        assertTrue(root.children().isEmpty());
    }
}
