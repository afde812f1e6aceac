package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code [Name]} or {@code [Name(args)]} before a procedure. The argument tokens are kept
 * unevaluated in {@code rawTokens}, parentheses included.
 */
public record ProcedureAttribute(String name, Token nameToken, List<Token> rawTokens, boolean hasArguments,
        Token startToken, Token endToken) implements Node {
}
