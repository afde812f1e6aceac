package org.navtools.cal.dsl;

import org.navtools.cal.dsl.ast.Expression;

import java.util.List;

/**
 * Raised when a CASE branch fails after some of its values were parsed, so the
 * partial branch can be kept.
 */
public class CaseBranchParseError extends ParseError {

    private final List<Expression> values;
    private final Token branchStartToken;

    public CaseBranchParseError(String message, Token token, List<Expression> values, Token branchStartToken,
            ParseErrorCode code) {
        super(message, token, code);
        this.values = List.copyOf(values);
        this.branchStartToken = branchStartToken;
    }

    public List<Expression> getValues() {
        return values;
    }

    public Token getBranchStartToken() {
        return branchStartToken;
    }
}
