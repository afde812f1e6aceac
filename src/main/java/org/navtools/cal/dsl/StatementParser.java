package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.dsl.ast.AssignmentStatement;
import org.navtools.cal.dsl.ast.BinaryExpression;
import org.navtools.cal.dsl.ast.BlockStatement;
import org.navtools.cal.dsl.ast.BreakStatement;
import org.navtools.cal.dsl.ast.CallStatement;
import org.navtools.cal.dsl.ast.CaseBranch;
import org.navtools.cal.dsl.ast.CaseStatement;
import org.navtools.cal.dsl.ast.EmptyStatement;
import org.navtools.cal.dsl.ast.ExitStatement;
import org.navtools.cal.dsl.ast.Expression;
import org.navtools.cal.dsl.ast.ForStatement;
import org.navtools.cal.dsl.ast.Identifier;
import org.navtools.cal.dsl.ast.IfStatement;
import org.navtools.cal.dsl.ast.MemberExpression;
import org.navtools.cal.dsl.ast.RangeExpression;
import org.navtools.cal.dsl.ast.RepeatStatement;
import org.navtools.cal.dsl.ast.Statement;
import org.navtools.cal.dsl.ast.WhileStatement;
import org.navtools.cal.dsl.ast.WithStatement;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Statement layer: BEGIN/END blocks and the C/AL control-flow statements.
 */
abstract class StatementParser extends ExpressionParser {

    /** Statement keywords that mean a CASE is missing its END. */
    private static final Set<TokenType> CASE_EXIT_KEYWORDS = EnumSet.of(
            TokenType.IF, TokenType.WHILE, TokenType.FOR, TokenType.REPEAT, TokenType.WITH);

    /** Tokens before which an orphaned keyword is still an expression operand. */
    private static final Set<TokenType> EXPRESSION_CONTINUATION = EnumSet.of(
            TokenType.EXIT, TokenType.ASSIGN, TokenType.LPAREN, TokenType.COMMA);

    private static final Set<TokenType> IDENTIFIER_USAGE = EnumSet.of(
            TokenType.DOT, TokenType.ASSIGN, TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN,
            TokenType.MULTIPLY_ASSIGN, TokenType.DIVIDE_ASSIGN, TokenType.LPAREN, TokenType.DOUBLE_COLON,
            TokenType.LBRACKET, TokenType.SEMICOLON);

    private static final Map<TokenType, String> ORPHAN_HINTS = new EnumMap<>(TokenType.class);

    static {
        ORPHAN_HINTS.put(TokenType.DO, "DO must follow WHILE or FOR.");
        ORPHAN_HINTS.put(TokenType.OF, "OF must follow CASE expression.");
        ORPHAN_HINTS.put(TokenType.THEN, "THEN must follow IF condition.");
        ORPHAN_HINTS.put(TokenType.TO, "TO must be part of FOR loop.");
        ORPHAN_HINTS.put(TokenType.DOWNTO, "DOWNTO must be part of FOR loop.");
        ORPHAN_HINTS.put(TokenType.UNTIL, "UNTIL must follow REPEAT body.");
    }

    protected StatementParser(List<Token> tokens) {
        super(tokens);
    }

    // ==================== Blocks ====================

    protected BlockStatement parseBlock() {
        Token start = consume(TokenType.BEGIN, "Expected BEGIN");
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.END) && !isAtEnd()) {
            try {
                Statement statement = parseStatement();
                if (statement != null) {
                    statements.add(statement);
                }
                if (isProcedureBoundary()) {
                    break;
                }
            } catch (ParseError e) {
                addError(e);
                recoverToTokensDepthAware(true);
                if (isProcedureBoundary()) {
                    break;
                }
            }
        }

        Token end;
        if (isProcedureBoundary()) {
            recordError("Expected END to close BEGIN block", previous(), ParseErrorCode.UNCLOSED_BLOCK);
            end = previous();
        } else {
            end = consumeExpected(TokenType.END, "Expected END to close BEGIN block");
        }
        return new BlockStatement(statements, start, end);
    }

    /**
     * Parses one statement. Returns null when the token was reported and dropped.
     */
    protected Statement parseStatement() {
        Token token = peek();
        if (isProcedureBoundary()) {
            throw error("Unexpected " + token.value() + " - expected statement or END", token,
                    ParseErrorCode.GENERIC);
        }

        if (token.type() == TokenType.ELSE) {
            recordError("Unexpected ELSE - cannot start a statement. ELSE must follow IF or CASE.", token);
            advance();
            return null;
        }

        String hint = ORPHAN_HINTS.get(token.type());
        if (hint != null && !(position > 0 && EXPRESSION_CONTINUATION.contains(previous().type()))) {
            recordError("Unexpected " + token.type() + " - cannot start a statement. " + hint, token);
            advance();
            return null;
        }

        if (token.type() == TokenType.AL_ONLY_ACCESS_MODIFIER || token.type() == TokenType.AL_ONLY_KEYWORD) {
            if (!IDENTIFIER_USAGE.contains(peekAhead(1).type())) {
                checkAndReportAlOnlyToken();
                advance();
                return null;
            }
        }
        if (token.type() == TokenType.TERNARY_OPERATOR || token.type() == TokenType.PREPROCESSOR_DIRECTIVE) {
            checkAndReportAlOnlyToken();
            advance();
            return null;
        }

        switch (token.type()) {
            case IF:
                return parseIfStatement();
            case WHILE:
                return parseWhileStatement();
            case REPEAT:
                return parseRepeatStatement();
            case FOR:
                return parseForStatement();
            case CASE:
                return parseCaseStatement();
            case EXIT:
                return parseExitStatement();
            case BREAK:
                return parseBreakStatement();
            case WITH:
                return parseWithStatement();
            case BEGIN:
                return parseBlock();
            case SEMICOLON:
                return parseEmptyStatement();
            default:
                return parseAssignmentOrCall();
        }
    }

    private boolean isStatementStarter() {
        TokenType type = peek().type();
        switch (type) {
            case IF:
            case WHILE:
            case REPEAT:
            case FOR:
            case CASE:
            case EXIT:
            case BREAK:
            case WITH:
            case BEGIN:
                return true;
            default:
                return canBeUsedAsIdentifier();
        }
    }

    /**
     * Whether a semicolon closed the statement, which stops an enclosing IF from claiming a following ELSE.
     */
    private boolean isTerminatedBySemicolon(Statement statement) {
        if (statement instanceof WhileStatement whileStatement) {
            return isTerminatedBySemicolon(whileStatement.body());
        }
        if (statement instanceof ForStatement forStatement) {
            return isTerminatedBySemicolon(forStatement.body());
        }
        if (statement instanceof WithStatement withStatement) {
            return isTerminatedBySemicolon(withStatement.body());
        }
        if (statement instanceof IfStatement ifStatement) {
            return ifStatement.elseBranch() != null && isTerminatedBySemicolon(ifStatement.elseBranch());
        }
        return statement.endToken().type() == TokenType.SEMICOLON;
    }

    /**
     * Body of THEN, ELSE, DO. Empty bodies produce an empty statement instead of an error.
     */
    private Statement parseBody(String after, boolean elseEndsBody) {
        if (check(TokenType.BEGIN)) {
            return parseBlock();
        }
        if (check(TokenType.SEMICOLON)) {
            return parseEmptyStatement();
        }
        if (check(TokenType.END) || (elseEndsBody && check(TokenType.ELSE))) {
            return new EmptyStatement(previous(), previous());
        }
        if (!isStatementStarter()) {
            recordError("Expected statement after " + after);
            return new BlockStatement(List.of(), previous(), previous());
        }
        Statement statement = parseStatement();
        if (statement == null) {
            throw error("Expected statement after " + after, peek(), ParseErrorCode.GENERIC);
        }
        return statement;
    }

    // ==================== Control flow ====================

    private IfStatement parseIfStatement() {
        Token start = consume(TokenType.IF, "Expected IF");
        Expression condition = parseExpression();
        consumeExpected(TokenType.THEN, "Expected THEN");
        Statement thenBranch = parseBody("THEN", true);

        Statement elseBranch = null;
        if (check(TokenType.ELSE) && !isTerminatedBySemicolon(thenBranch)) {
            advance();
            elseBranch = parseBody("ELSE", false);
        }
        return new IfStatement(condition, thenBranch, elseBranch, start, previous());
    }

    private WhileStatement parseWhileStatement() {
        Token start = consume(TokenType.WHILE, "Expected WHILE");
        Expression condition = parseExpression();
        consumeExpected(TokenType.DO, "Expected DO after WHILE condition");
        Statement body = parseBody("DO", false);
        return new WhileStatement(condition, body, start, previous());
    }

    private RepeatStatement parseRepeatStatement() {
        Token start = consume(TokenType.REPEAT, "Expected REPEAT");
        List<Statement> body = new ArrayList<>();
        while (!check(TokenType.UNTIL) && !isAtEnd()) {
            if (check(TokenType.END) || isProcedureBoundary()) {
                break;
            }
            try {
                Statement statement = parseStatement();
                if (statement != null) {
                    body.add(statement);
                }
            } catch (ParseError e) {
                addError(e);
                recoverToTokensDepthAware(true);
                if (isProcedureBoundary()) {
                    break;
                }
            }
        }

        if (match(TokenType.UNTIL)) {
            Expression condition = parseExpression();
            match(TokenType.SEMICOLON);
            return new RepeatStatement(body, condition, start, previous());
        }
        recordError("Expected UNTIL to close REPEAT statement", start, ParseErrorCode.UNCLOSED_BLOCK);
        return new RepeatStatement(body, Identifier.error(start), start, previous());
    }

    private ForStatement parseForStatement() {
        Token start = consume(TokenType.FOR, "Expected FOR");
        Expression variable = parseExpression();
        if (!isValidLoopVariable(variable)) {
            recordError("Invalid FOR loop variable: expected identifier or field reference", variable.startToken());
            variable = Identifier.error(previous());
        }
        consume(TokenType.ASSIGN, "Expected :=");
        Expression from = parseExpression();
        boolean downto = match(TokenType.DOWNTO);
        if (!downto) {
            consumeExpected(TokenType.TO, "Expected TO or DOWNTO");
        }
        Expression to = parseExpression();
        consumeExpected(TokenType.DO, "Expected DO after FOR range");
        Statement body = parseBody("DO", false);
        return new ForStatement(variable, from, to, downto, body, start, previous());
    }

    private static boolean isValidLoopVariable(Expression variable) {
        if (variable instanceof Identifier) {
            return true;
        }
        if (variable instanceof MemberExpression member) {
            return member.object() instanceof Identifier || member.object() instanceof MemberExpression;
        }
        return false;
    }

    private WithStatement parseWithStatement() {
        Token start = consume(TokenType.WITH, "Expected WITH");
        Expression record = parseExpression();
        consumeExpected(TokenType.DO, "Expected DO after WITH record");
        Statement body = parseBody("DO", false);
        match(TokenType.SEMICOLON);
        return new WithStatement(record, body, start, previous());
    }

    // ==================== CASE ====================

    private CaseStatement parseCaseStatement() {
        Token start = consume(TokenType.CASE, "Expected CASE");
        Expression expression = parseExpression();
        consumeExpected(TokenType.OF, "Expected OF after CASE");

        List<CaseBranch> branches = new ArrayList<>();
        List<Statement> elseBranch = null;
        while (!check(TokenType.END) && !isAtEnd() && !isProcedureBoundary()
                && !CASE_EXIT_KEYWORDS.contains(peek().type())) {
            if (check(TokenType.ELSE)) {
                elseBranch = parseCaseElseBranch();
                break;
            }
            int branchPosition = position;
            try {
                branches.add(parseCaseBranch());
            } catch (ParseError e) {
                addError(e);
                if (position == branchPosition) {
                    advance();
                }
                recoverWithinCase();
                if (e instanceof CaseBranchParseError partial) {
                    branches.add(new CaseBranch(partial.getValues(), List.of(), partial.getBranchStartToken(),
                            previous()));
                }
            }
        }

        if (isProcedureBoundary() || CASE_EXIT_KEYWORDS.contains(peek().type()) || isEndForOuterStructure()) {
            recordError("Expected END to close CASE statement", peek(), ParseErrorCode.UNCLOSED_BLOCK);
            return new CaseStatement(expression, branches, elseBranch, start, previous());
        }
        consumeExpected(TokenType.END, "Expected END to close CASE statement");
        match(TokenType.SEMICOLON);
        return new CaseStatement(expression, branches, elseBranch, start, previous());
    }

    private void recoverWithinCase() {
        while (!isAtEnd()) {
            if (checkAny(TokenType.END, TokenType.ELSE) || isProcedureBoundary()
                    || CASE_EXIT_KEYWORDS.contains(peek().type())) {
                return;
            }
            if (match(TokenType.SEMICOLON)) {
                return;
            }
            TokenType next = peekAhead(1).type();
            if (checkAny(TokenType.INTEGER, TokenType.DECIMAL, TokenType.STRING)
                    && (next == TokenType.COLON || next == TokenType.DOT_DOT || next == TokenType.COMMA)) {
                return;
            }
            if (checkAny(TokenType.IDENTIFIER, TokenType.QUOTED_IDENTIFIER)
                    && (next == TokenType.COLON || next == TokenType.DOT_DOT)) {
                return;
            }
            advance();
        }
    }

    private CaseBranch parseCaseBranch() {
        Token branchStart = peek();
        List<Expression> values = new ArrayList<>();
        int savedPosition = position;
        int savedDepth = braceDepth;
        try {
            values.add(parseCaseValue());
            while (match(TokenType.COMMA)) {
                values.add(parseCaseValue());
            }
        } catch (ParseError e) {
            if (!values.isEmpty()) {
                throw new CaseBranchParseError("Expected : after case branch value", e.getToken(), values,
                        branchStart, ParseErrorCode.EXPECTED_TOKEN);
            }
            position = savedPosition;
            braceDepth = savedDepth;
            throw e;
        }

        if (!check(TokenType.COLON)) {
            throw new CaseBranchParseError("Expected : after case branch value, but found " + describe(peek()),
                    previous(), values, branchStart, ParseErrorCode.EXPECTED_TOKEN);
        }
        advance();

        List<Statement> statements = new ArrayList<>();
        TokenType next = peekAhead(1).type();
        if (check(TokenType.BEGIN)) {
            statements.addAll(parseBlock().statements());
        } else if (checkAny(TokenType.END, TokenType.ELSE, TokenType.INTEGER, TokenType.DECIMAL, TokenType.STRING)
                || (checkAny(TokenType.IDENTIFIER, TokenType.QUOTED_IDENTIFIER)
                        && (next == TokenType.COLON || next == TokenType.DOT_DOT))) {
            statements.add(new EmptyStatement(previous(), previous()));
        } else {
            Statement statement = parseStatement();
            if (statement != null) {
                statements.add(statement);
            }
        }
        match(TokenType.SEMICOLON);
        return new CaseBranch(values, statements, branchStart, previous());
    }

    private Expression parseCaseValue() {
        Expression value = parseExpression();
        if (!check(TokenType.DOT_DOT)) {
            return value;
        }
        advance();
        if (isAtEnd() || checkAny(TokenType.COLON, TokenType.COMMA, TokenType.RPAREN, TokenType.SEMICOLON,
                TokenType.END, TokenType.ELSE)) {
            recordError("Expected expression after '..' in range");
            return new RangeExpression(value, null, value.startToken(), previous());
        }
        Expression upper = parseExpression();
        return new RangeExpression(value, upper, value.startToken(), upper.endToken());
    }

    private List<Statement> parseCaseElseBranch() {
        advance();
        List<Statement> statements = new ArrayList<>();
        while (!check(TokenType.END) && !isAtEnd() && !isProcedureBoundary()) {
            try {
                Statement statement = parseStatement();
                if (statement != null) {
                    statements.add(statement);
                }
                if (isProcedureBoundary()) {
                    break;
                }
            } catch (ParseError e) {
                addError(e);
                recoverToTokensDepthAware(true);
                if (isProcedureBoundary()) {
                    break;
                }
            }
        }
        return statements;
    }

    // ==================== Simple statements ====================

    private ExitStatement parseExitStatement() {
        Token start = consume(TokenType.EXIT, "Expected EXIT");
        Expression value = null;
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN) && !NEVER_PRIMARY_THROW.contains(peek().type())) {
                value = parseExpression();
            }
            consumeExpected(TokenType.RPAREN, "Expected ) after EXIT value");
        }
        match(TokenType.SEMICOLON);
        return new ExitStatement(value, start, previous());
    }

    private BreakStatement parseBreakStatement() {
        Token start = consume(TokenType.BREAK, "Expected BREAK");
        match(TokenType.SEMICOLON);
        return new BreakStatement(start, previous());
    }

    private EmptyStatement parseEmptyStatement() {
        Token semicolon = consume(TokenType.SEMICOLON, "Expected ; after statement");
        return new EmptyStatement(semicolon, semicolon);
    }

    private Statement parseAssignmentOrCall() {
        Token start = peek();
        Expression target = parseExpression();
        if (checkAny(TokenType.ASSIGN, TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MULTIPLY_ASSIGN,
                TokenType.DIVIDE_ASSIGN)) {
            Token operator = advance();
            Expression value = parseExpression();
            match(TokenType.SEMICOLON);
            String compound = compoundOperator(operator.type());
            if (compound != null) {
                value = new BinaryExpression(compound, target, value, target.startToken(), value.endToken());
            }
            return new AssignmentStatement(target, value, start, previous());
        }
        match(TokenType.SEMICOLON);
        return new CallStatement(target, start, previous());
    }

    private static String compoundOperator(TokenType type) {
        switch (type) {
            case PLUS_ASSIGN:
                return "+";
            case MINUS_ASSIGN:
                return "-";
            case MULTIPLY_ASSIGN:
                return "*";
            case DIVIDE_ASSIGN:
                return "/";
            default:
                return null;
        }
    }
}
