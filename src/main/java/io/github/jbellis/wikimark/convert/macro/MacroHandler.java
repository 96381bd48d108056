package io.github.jbellis.wikimark.convert.macro;

import io.github.jbellis.wikimark.convert.ConversionContext;

@FunctionalInterface
public interface MacroHandler {
    String render(MacroNode macro, ConversionContext context);
}
