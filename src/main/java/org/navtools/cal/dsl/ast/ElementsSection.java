package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

public record ElementsSection(List<XmlPortElement> elements, Token startToken, Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(elements);
    }
}
