package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code Name@n : [TEMPORARY] Type [INDATASET] [WITHEVENTS] [RUNONCLIENT] [SECURITYFILTERING(x)];}
 */
public record VariableDeclaration(
        String name,
        Token nameToken,
        DataType dataType,
        boolean temporary,
        boolean inDataSet,
        boolean withEvents,
        boolean runOnClient,
        String securityFiltering,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(dataType);
    }
}
