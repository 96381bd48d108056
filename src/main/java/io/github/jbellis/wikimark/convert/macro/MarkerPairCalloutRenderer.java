package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;

import java.util.ArrayList;
import java.util.Optional;

/**
 * Encloses the callout between numbered START/END marker lines. A later step can find the pair and
 * build a native callout from whatever sits between the markers.
 */
public class MarkerPairCalloutRenderer extends CalloutRenderer {

    public static String startMarker(int index) {
        return "===========START CALLOUT " + index + "==========";
    }

    public static String endMarker(int index) {
        return "===========END CALLOUT " + index + "==========";
    }

    @Override
    protected String render(int index, Optional<String> boldTitle, MacroNode macro, ConversionContext context) {
        var parts = new ArrayList<String>();
        parts.add(startMarker(index) + "\n");
        boldTitle.ifPresent(title -> parts.add(title + "\n"));
        macro.richTextBody()
                .map(body -> context.convertChildren(body).strip())
                .filter(body -> !body.isEmpty())
                .ifPresent(parts::add);
        parts.add("\n" + endMarker(index) + "\n");
        return String.join("\n", parts) + "\n\n";
    }
}
