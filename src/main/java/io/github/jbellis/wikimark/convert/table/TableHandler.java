package io.github.jbellis.wikimark.convert.table;

import io.github.jbellis.wikimark.convert.ConversionContext;
import io.github.jbellis.wikimark.convert.NodeHandler;
import io.github.jbellis.wikimark.tree.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

public class TableHandler implements NodeHandler {
    private static final Logger logger = LogManager.getLogger(TableHandler.class);

    @Override
    public String handle(Node.Element element, ConversionContext context) {
        var model = TableModel.from(element, context);
        logger.debug("Rendering table with {} rows, {} columns, first column header: {}",
                     model.rows().size(), model.columnCount(), model.firstColumnHeader());
        return TableRenderer.render(model);
    }
}
