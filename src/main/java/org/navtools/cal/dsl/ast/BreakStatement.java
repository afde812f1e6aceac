package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

public record BreakStatement(Token startToken, Token endToken) implements Statement {
}
