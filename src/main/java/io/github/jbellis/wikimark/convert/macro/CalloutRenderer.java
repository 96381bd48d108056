package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.convert.InlineHandlers;

import java.util.Optional;

/**
 * Base for info/note/tip/warning macros. Every callout takes a number from the conversion's
 * counter in traversal order, whether or not the style displays it.
 */
public abstract class CalloutRenderer implements MacroHandler {

    @Override
    public final String render(MacroNode macro, ConversionContext context) {
        int index = context.nextCalloutIndex();
        var title = macro.parameter("title").map(t -> InlineHandlers.wrap(t, InlineHandlers.STRONG_MARKER));
        return render(index, title, macro, context);
    }

    protected abstract String render(int index, Optional<String> boldTitle, MacroNode macro, ConversionContext context);
}
