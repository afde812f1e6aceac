package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.dsl.ast.ArrayAccessExpression;
import org.navtools.cal.dsl.ast.BinaryExpression;
import org.navtools.cal.dsl.ast.CallExpression;
import org.navtools.cal.dsl.ast.Expression;
import org.navtools.cal.dsl.ast.Identifier;
import org.navtools.cal.dsl.ast.Literal;
import org.navtools.cal.dsl.ast.Literal.LiteralType;
import org.navtools.cal.dsl.ast.MemberExpression;
import org.navtools.cal.dsl.ast.RangeExpression;
import org.navtools.cal.dsl.ast.SetLiteral;
import org.navtools.cal.dsl.ast.UnaryExpression;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Expression layer of the C/AL parser.
 *
 * Precedence, loosest first: OR/XOR, AND, = and &lt;&gt;, relational and IN, + and -,
 * * / DIV MOD, unary NOT and -, then primaries with postfix member, option, call and index access.
 */
abstract class ExpressionParser extends ParserSupport {

    static final Set<TokenType> CONTROL_FLOW_KEYWORDS = EnumSet.of(
            TokenType.THEN, TokenType.ELSE, TokenType.DO, TokenType.OF, TokenType.TO, TokenType.DOWNTO,
            TokenType.UNTIL, TokenType.BEGIN, TokenType.END);

    /** Tokens after which a control-flow keyword means an expression operand is missing. */
    private static final Set<TokenType> EXPRESSION_CONTEXT = EnumSet.of(
            TokenType.LBRACKET, TokenType.LPAREN, TokenType.COMMA, TokenType.COLON, TokenType.DOT_DOT,
            TokenType.PLUS, TokenType.MINUS, TokenType.MULTIPLY, TokenType.DIVIDE,
            TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
            TokenType.GREATER, TokenType.GREATER_EQUAL,
            TokenType.ASSIGN, TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MULTIPLY_ASSIGN,
            TokenType.DIVIDE_ASSIGN,
            TokenType.NOT, TokenType.AND, TokenType.OR, TokenType.XOR, TokenType.DIV, TokenType.MOD,
            TokenType.IN, TokenType.EXIT);

    /** Structural tokens that end an expression without being consumed. */
    static final Set<TokenType> NEVER_PRIMARY_THROW = EnumSet.of(
            TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE, TokenType.SEMICOLON, TokenType.LBRACE,
            TokenType.IF, TokenType.WHILE, TokenType.REPEAT, TokenType.FOR, TokenType.CASE, TokenType.EXIT,
            TokenType.WITH, TokenType.EOF);

    /** Binary operators that cannot start an operand; consumed and reported. */
    private static final Set<TokenType> NEVER_PRIMARY_CONSUME = EnumSet.of(
            TokenType.PLUS, TokenType.MULTIPLY, TokenType.DIVIDE,
            TokenType.ASSIGN, TokenType.PLUS_ASSIGN, TokenType.MINUS_ASSIGN, TokenType.MULTIPLY_ASSIGN,
            TokenType.DIVIDE_ASSIGN,
            TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.LESS, TokenType.LESS_EQUAL,
            TokenType.GREATER, TokenType.GREATER_EQUAL,
            TokenType.DOT, TokenType.DOUBLE_COLON, TokenType.COLON, TokenType.COMMA,
            TokenType.AND, TokenType.OR, TokenType.XOR, TokenType.DIV, TokenType.MOD, TokenType.IN);

    protected ExpressionParser(List<Token> tokens) {
        super(tokens);
    }

    // ==================== Binary operators ====================

    protected Expression parseExpression() {
        return parseOr();
    }

    private Expression parseBinary(Supplier<Expression> operand, boolean upperCase, TokenType... operators) {
        Expression left = operand.get();
        while (checkAny(operators)) {
            Token operator = advance();
            Expression right = operand.get();
            left = new BinaryExpression(operatorText(operator, upperCase), left, right, left.startToken(),
                    right.endToken());
        }
        return left;
    }

    private static String operatorText(Token operator, boolean upperCase) {
        return upperCase ? operator.value().toUpperCase(Locale.ROOT) : operator.value();
    }

    private Expression parseOr() {
        return parseBinary(this::parseAnd, true, TokenType.OR, TokenType.XOR);
    }

    private Expression parseAnd() {
        return parseBinary(this::parseEquality, true, TokenType.AND);
    }

    private Expression parseEquality() {
        return parseBinary(this::parseComparison, false, TokenType.EQUAL, TokenType.NOT_EQUAL);
    }

    private Expression parseComparison() {
        Expression left = parseTerm();
        while (checkAny(TokenType.LESS, TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL,
                TokenType.IN)) {
            Token operator = advance();
            Expression right = operator.type() == TokenType.IN && check(TokenType.LBRACKET)
                    ? parseSetLiteral()
                    : parseTerm();
            left = new BinaryExpression(operatorText(operator, true), left, right, left.startToken(),
                    right.endToken());
        }
        return left;
    }

    private Expression parseTerm() {
        return parseBinary(this::parseFactor, false, TokenType.PLUS, TokenType.MINUS);
    }

    private Expression parseFactor() {
        return parseBinary(this::parseUnary, true, TokenType.MULTIPLY, TokenType.DIVIDE, TokenType.DIV,
                TokenType.MOD);
    }

    private Expression parseUnary() {
        if (checkAny(TokenType.NOT, TokenType.MINUS)) {
            Token operator = advance();
            Expression operand = parseUnary();
            return new UnaryExpression(operatorText(operator, true), operand, operator, operand.endToken());
        }
        return parsePrimary();
    }

    // ==================== Primaries ====================

    private Literal parseLiteral() {
        Token token = peek();
        LiteralType literalType;
        switch (token.type()) {
            case INTEGER:
                literalType = LiteralType.INTEGER;
                break;
            case DECIMAL:
                literalType = LiteralType.DECIMAL;
                break;
            case STRING:
                literalType = LiteralType.STRING;
                break;
            case TRUE:
            case FALSE:
                literalType = LiteralType.BOOLEAN;
                break;
            case DATE:
                literalType = LiteralType.DATE;
                break;
            case TIME:
                literalType = LiteralType.TIME;
                break;
            case DATETIME:
                literalType = LiteralType.DATETIME;
                break;
            default:
                return null;
        }
        advance();
        String value = literalType == LiteralType.BOOLEAN
                ? (token.type() == TokenType.TRUE ? "TRUE" : "FALSE")
                : token.value();
        return new Literal(value, literalType, token, token);
    }

    private Expression parsePrimary() {
        Token current = peek();
        if (current.type() == TokenType.TERNARY_OPERATOR || current.type() == TokenType.PREPROCESSOR_DIRECTIVE) {
            checkAndReportAlOnlyToken();
            advance();
            String name = current.type() == TokenType.TERNARY_OPERATOR ? "?" : current.value();
            return new Identifier(name, false, current, current);
        }

        Literal literal = parseLiteral();
        if (literal != null) {
            return literal;
        }

        if (check(TokenType.LPAREN)) {
            advance();
            Expression inner = parseExpression();
            consumeExpected(TokenType.RPAREN, "Expected ) after expression");
            return inner;
        }

        if (check(TokenType.LBRACKET)) {
            return parseSetLiteral();
        }

        if (canBeUsedAsIdentifier()) {
            Token name = advance();
            return parsePostfixOperations(Identifier.of(name));
        }

        if (isProcedureBoundary()) {
            throw error("Unexpected " + current.value() + " in expression - expected value or identifier",
                    current, ParseErrorCode.GENERIC);
        }

        if (CONTROL_FLOW_KEYWORDS.contains(current.type())) {
            if (position > 0 && EXPRESSION_CONTEXT.contains(previous().type())) {
                recordError("Unexpected keyword '" + current.value() + "' in expression. Missing statement or "
                        + "operator before '" + current.value() + "'.", current);
                advance();
                return Identifier.error(current);
            }
            throw error("Unexpected keyword '" + current.value() + "' - expected expression or statement",
                    current, ParseErrorCode.GENERIC);
        }

        if (NEVER_PRIMARY_THROW.contains(current.type())) {
            throw error("Unexpected '" + current.value() + "' - expected expression", current,
                    ParseErrorCode.GENERIC);
        }

        if (NEVER_PRIMARY_CONSUME.contains(current.type())) {
            advance();
            recordError("Unexpected operator '" + current.value() + "' - expected expression", current);
            return Identifier.error(current);
        }

        advance();
        recordError("Unexpected token '" + current.value() + "' - expected expression", current);
        return parsePostfixOperations(Identifier.error(current));
    }

    // ==================== Postfix ====================

    /**
     * Applies member, option, call and index suffixes until none matches.
     */
    protected Expression parsePostfixOperations(Expression expression) {
        Expression result = expression;
        while (true) {
            Expression before = result;
            result = parseMemberAccess(result);
            result = parseOptionAccess(result);
            result = parseCall(result);
            result = parseIndex(result);
            if (result == before) {
                return result;
            }
        }
    }

    private Expression parseMemberAccess(Expression target) {
        if (!check(TokenType.DOT)) {
            return target;
        }
        advance();
        if (!canBeUsedAsIdentifier()) {
            recordError("Expected member name after '.'");
            return target;
        }
        Token member = advance();
        return new MemberExpression(target, Identifier.of(member), false, target.startToken(), member);
    }

    private Expression parseOptionAccess(Expression target) {
        if (!check(TokenType.DOUBLE_COLON)) {
            return target;
        }
        advance();
        if (isAtEnd() || checkAny(TokenType.SEMICOLON, TokenType.COMMA, TokenType.RPAREN, TokenType.RBRACKET,
                TokenType.THEN, TokenType.DO, TokenType.OF)) {
            recordError("Expected identifier after :: operator, got '" + peek().value() + "'");
            return target;
        }
        Token member = advance();
        return new MemberExpression(target, Identifier.of(member), true, target.startToken(), member);
    }

    private Expression parseCall(Expression callee) {
        if (!check(TokenType.LPAREN)) {
            return callee;
        }
        advance();
        List<Expression> arguments = new ArrayList<>();
        while (!check(TokenType.RPAREN) && !isAtEnd()) {
            arguments.add(parseExpression());
            if (check(TokenType.COLON)) {
                throw error("Expected ',' or ')' in function arguments, but found '" + peek().value() + "'",
                        peek(), ParseErrorCode.EXPECTED_TOKEN);
            }
            match(TokenType.COMMA);
        }
        Token end = check(TokenType.RPAREN) ? advance() : previous();
        return new CallExpression(callee, arguments, callee.startToken(), end);
    }

    private Expression parseIndex(Expression array) {
        if (!check(TokenType.LBRACKET)) {
            return array;
        }
        advance();
        List<Expression> indices = new ArrayList<>();
        indices.add(parseExpression());
        while (match(TokenType.COMMA)) {
            indices.add(parseExpression());
        }
        Token end = consumeExpected(TokenType.RBRACKET, "Expected ] after array index");
        return new ArrayAccessExpression(array, indices, array.startToken(), end);
    }

    // ==================== Sets ====================

    private boolean atRangeTerminator() {
        return isAtEnd() || checkAny(TokenType.SEMICOLON, TokenType.END, TokenType.THEN, TokenType.DO,
                TokenType.ELSE);
    }

    /**
     * Parses {@code [a, b..c, ..d, e..]}. A missing closing bracket is reported and the
     * literal ends at the last consumed token.
     */
    protected Expression parseSetLiteral() {
        Token start = consume(TokenType.LBRACKET, "Expected [ to open set literal");
        List<Expression> elements = new ArrayList<>();
        if (check(TokenType.RBRACKET)) {
            return new SetLiteral(elements, start, advance());
        }

        do {
            try {
                elements.add(parseSetElement());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            } catch (ParseError e) {
                addError(e);
                while (!isAtEnd() && !checkAny(TokenType.RBRACKET, TokenType.COMMA, TokenType.SEMICOLON,
                        TokenType.THEN, TokenType.DO, TokenType.END)) {
                    advance();
                }
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
        } while (!isAtEnd() && !checkAny(TokenType.RBRACKET, TokenType.THEN, TokenType.DO, TokenType.END,
                TokenType.ELSE));

        Token end;
        if (check(TokenType.RBRACKET)) {
            end = advance();
        } else {
            recordError("Expected ] after set literal");
            end = previous();
        }
        return new SetLiteral(elements, start, end);
    }

    private Expression parseSetElement() {
        if (check(TokenType.DOT_DOT)) {
            Token operator = advance();
            if (atRangeTerminator() || checkAny(TokenType.COMMA, TokenType.RBRACKET)) {
                recordError("Expected expression after '..' in set range");
                return new RangeExpression(null, null, operator, previous());
            }
            Expression upper = parseExpression();
            return new RangeExpression(null, upper, operator, upper.endToken());
        }

        Expression lower = parseExpression();
        if (!check(TokenType.DOT_DOT)) {
            return lower;
        }
        advance();
        if (checkAny(TokenType.COMMA, TokenType.RBRACKET)) {
            return new RangeExpression(lower, null, lower.startToken(), previous());
        }
        if (atRangeTerminator()) {
            recordError("Expected expression after '..' in set range");
            return new RangeExpression(lower, null, lower.startToken(), previous());
        }
        Expression upper = parseExpression();
        return new RangeExpression(lower, upper, lower.startToken(), upper.endToken());
    }
}
