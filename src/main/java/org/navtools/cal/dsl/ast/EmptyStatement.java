package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

public record EmptyStatement(Token startToken, Token endToken) implements Statement {
}
