package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.config.ConverterConfig;
import io.github.jbellis.wikimark.convert.StorageConverter;
import io.github.jbellis.wikimark.tree.TreeBuilder;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MacroRegistryTest {
    private final StorageConverter converter = new StorageConverter(ConverterConfig.defaults());

    @Test
    void unknownMacroKeepsItsContent() {
        var markup = "<ac:structured-macro ac:name=\"expand\">"
                     + "<ac:rich-text-body><p>hidden <em>detail</em></p></ac:rich-text-body>"
                     + "</ac:structured-macro>";
        assertEquals("hidden _detail_", converter.convert(markup).markdown());
    }

    @Test
    void macroWithoutNameIsFlattened() {
        assertEquals("text", converter.convert("<ac:structured-macro><p>text</p></ac:structured-macro>").markdown());
    }

    @Test
    void macroNamesAreMatchedCaseInsensitively() {
        assertEquals(MacroKind.INFO, MacroKind.of(" Info ").orElseThrow());
        assertTrue(MacroKind.of("toc").isEmpty());
        assertTrue(MacroKind.of(null).isEmpty());
    }

    @Test
    void parametersComeFromDirectChildrenOnly() {
        var root = new TreeBuilder().parse("<ac:structured-macro ac:name=\"info\">"
                                           + "<ac:rich-text-body><ac:structured-macro ac:name=\"jira\">"
                                           + "<ac:parameter ac:name=\"title\">inner</ac:parameter>"
                                           + "</ac:structured-macro></ac:rich-text-body>"
                                           + "<ac:parameter ac:name=\"key\">  </ac:parameter>"
                                           + "</ac:structured-macro>");
        var macro = new MacroNode(root.childElements().get(0));

        assertEquals("info", macro.name());
        assertTrue(macro.parameter("title").isEmpty());
        assertTrue(macro.parameter("key").isEmpty(), "blank parameters count as absent");
        assertTrue(macro.richTextBody().isPresent());
        assertTrue(macro.plainTextBody().isEmpty());
    }

    @Test
    void jiraMacroLinksToIssue() {
        var custom = new StorageConverter(ConverterConfig.defaults().withIssueTrackerBaseUrl("https://jira.test/browse/"));
        var markup = "<ac:structured-macro ac:name=\"jira\">"
                     + "<ac:parameter ac:name=\"server\">Main</ac:parameter>"
                     + "<ac:parameter ac:name=\"key\">OPS-7</ac:parameter>"
                     + "</ac:structured-macro>";
        assertEquals("[OPS-7](https://jira.test/browse/OPS-7)", custom.convert(markup).markdown());
    }

    @Test
    void jiraMacroWithoutKeyRendersNothing() {
        var markup = "<p>a</p><ac:structured-macro ac:name=\"jira\">"
                     + "<ac:parameter ac:name=\"server\">Main</ac:parameter></ac:structured-macro>";
        assertEquals("a", converter.convert(markup).markdown());
    }
}
