package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.dsl.ast.BlockStatement;
import org.navtools.cal.dsl.ast.CodeSection;
import org.navtools.cal.dsl.ast.DataType;
import org.navtools.cal.dsl.ast.DataType.AutomationReference;
import org.navtools.cal.dsl.ast.EventDeclaration;
import org.navtools.cal.dsl.ast.ParameterDeclaration;
import org.navtools.cal.dsl.ast.ProcedureAttribute;
import org.navtools.cal.dsl.ast.ProcedureDeclaration;
import org.navtools.cal.dsl.ast.TriggerDeclaration;
import org.navtools.cal.dsl.ast.VariableDeclaration;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Declaration layer: data types, VAR blocks, procedures, triggers, events and the CODE section.
 */
abstract class DeclarationParser extends StatementParser {

    static final int MAX_ARRAY_DIMENSIONS = 10;

    private static final Set<String> OBJECT_REFERENCE_TYPES = Set.of(
            "RECORD", "CODEUNIT", "PAGE", "REPORT", "QUERY", "XMLPORT");
    private static final Set<String> SIZED_TYPES = Set.of("CODE", "TEXT", "DECIMAL");

    private static final Pattern EMBEDDED_SIZE = Pattern.compile("^([A-Za-z]+)(\\d+)$");
    private static final Pattern DOTNET_ASSEMBLY = Pattern.compile("^'((?:[^']|'')+)'\\.");
    private static final Pattern AUTOMATION = Pattern.compile(
            "^\\{([^}]+)\\}\\s+([\\d.]+):\\{([^}]+)\\}:'((?:[^']|'')+)'\\.(.+)$");

    protected DeclarationParser(List<Token> tokens) {
        super(tokens);
    }

    // ==================== Data types ====================

    protected DataType parseDataType() {
        Token start = peek();
        Token typeToken = advance();
        String typeName = typeToken.value();
        String upper = typeName.toUpperCase(Locale.ROOT);

        if (upper.equals("ARRAY") && check(TokenType.LBRACKET)) {
            return parseArrayType(start);
        }

        Integer tableId = null;
        if (OBJECT_REFERENCE_TYPES.contains(upper) && check(TokenType.INTEGER)) {
            int objectId = parseInteger(advance(), "table/page/report ID");
            if (upper.equals("RECORD")) {
                tableId = objectId;
            }
            typeName = typeName + " " + objectId;
        }

        Integer length = null;
        Matcher sized = EMBEDDED_SIZE.matcher(typeName);
        if (sized.matches() && SIZED_TYPES.contains(sized.group(1).toUpperCase(Locale.ROOT))) {
            length = Integer.parseInt(sized.group(2));
        }

        if (check(TokenType.LBRACKET)) {
            advance();
            length = parseInteger(consume(TokenType.INTEGER, "Expected length"), "string/code length");
            consume(TokenType.RBRACKET, "Expected ] after type length");
            typeName = typeName + "[" + length + "]";
        }

        if (upper.equals("TEXTCONST") && check(TokenType.STRING)) {
            advance();
        }
        if (upper.equals("DOTNET") && check(TokenType.QUOTED_IDENTIFIER)) {
            return parseDotNetType(start);
        }
        if (upper.equals("AUTOMATION") && check(TokenType.QUOTED_IDENTIFIER)) {
            return parseAutomationType(start);
        }

        String optionString = null;
        if (typeName.contains(",") && !typeName.contains(".")) {
            optionString = typeName;
            if (typeToken.type() == TokenType.STRING) {
                typeName = "'" + typeName + "'";
            }
        }
        return new DataType(typeName, length, List.of(), tableId, optionString, false, null, null, null, start,
                previous());
    }

    private DataType parseArrayType(Token start) {
        advance();
        List<Integer> dimensions = new ArrayList<>();
        dimensions.add(parseInteger(consume(TokenType.INTEGER, "Expected array size"), "array size"));
        while (match(TokenType.COMMA)) {
            dimensions.add(parseInteger(consume(TokenType.INTEGER, "Expected array dimension"), "array dimension"));
        }
        if (dimensions.size() > MAX_ARRAY_DIMENSIONS) {
            recordError("Array cannot have more than " + MAX_ARRAY_DIMENSIONS + " dimensions (found "
                    + dimensions.size() + ")");
        }
        consume(TokenType.RBRACKET, "Expected ] after array dimensions");

        String typeName = "ARRAY";
        boolean temporary = false;
        if (match(TokenType.OF)) {
            temporary = match(TokenType.TEMPORARY);
            DataType element = parseDataType();
            StringBuilder name = new StringBuilder("ARRAY[");
            for (int i = 0; i < dimensions.size(); i++) {
                if (i > 0) {
                    name.append(',');
                }
                name.append(dimensions.get(i));
            }
            typeName = name.append("] OF ").append(element.typeName()).toString();
        }
        return new DataType(typeName, dimensions.get(0), dimensions, null, null, temporary, null, null, null, start,
                previous());
    }

    private DataType parseDotNetType(Token start) {
        Token typeToken = advance();
        Matcher matcher = DOTNET_ASSEMBLY.matcher(typeToken.value());
        if (!matcher.find()) {
            recordError("Invalid DotNet type format, expected 'assembly'.TypeName");
            return DataType.named("DotNet", start, previous());
        }
        String assembly = unescapeQuotes(matcher.group(1));
        String typeName = unescapeQuotes(typeToken.value().substring(matcher.end()));
        if (typeName.isBlank()) {
            recordError("Expected type name after assembly reference", typeToken);
            return new DataType("DotNet", null, List.of(), null, null, false, assembly, null, null, start,
                    previous());
        }
        return new DataType("DotNet", null, List.of(), null, null, false, assembly, typeName, null, start,
                previous());
    }

    private DataType parseAutomationType(Token start) {
        Token typeToken = advance();
        Matcher matcher = AUTOMATION.matcher(typeToken.value());
        if (!matcher.matches()) {
            recordError("Invalid Automation type format, expected "
                    + "\"{TypeLibGUID} Version:{ClassGUID}:'TypeLibName'.ClassName\"", typeToken);
            return DataType.named("Automation", start, previous());
        }
        AutomationReference automation = new AutomationReference(matcher.group(1), matcher.group(2),
                matcher.group(3), unescapeQuotes(matcher.group(4)), matcher.group(5));
        return new DataType("Automation", null, List.of(), null, null, false, null, null, automation, start,
                previous());
    }

    private static String unescapeQuotes(String value) {
        return value.replace("''", "'");
    }

    // ==================== Variables ====================

    private boolean isVariableSectionBoundary() {
        return checkAny(TokenType.PROCEDURE, TokenType.FUNCTION, TokenType.LOCAL, TokenType.TRIGGER,
                TokenType.CODE, TokenType.RBRACE) || isProcedureBoundary();
    }

    /**
     * Parses a VAR block into {@code variables}. Stops at the first token that cannot start a declaration.
     */
    protected void parseVariableDeclarations(List<VariableDeclaration> variables) {
        consume(TokenType.VAR, "Expected VAR");
        while (!isAtEnd()) {
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            if (isVariableSectionBoundary()) {
                break;
            }
            if (canBeUsedAsIdentifier()) {
                variables.add(parseVariable());
                continue;
            }

            Token token = peek();
            Token next = peekAhead(1);
            boolean attempted = next.type() == TokenType.COLON
                    || (next.type() == TokenType.UNKNOWN && "@".equals(next.value()));
            if (!attempted) {
                break;
            }
            recordError("Cannot use reserved keyword '" + token.value() + "' as variable name", token);
            while (!isAtEnd() && !check(TokenType.SEMICOLON) && !isVariableSectionBoundary()) {
                advance();
            }
            match(TokenType.SEMICOLON);
        }
    }

    private VariableDeclaration parseVariable() {
        Token start = peek();
        Token nameToken = advance();
        skipAutoNumberSuffix();
        consume(TokenType.COLON, "Expected : after variable name in variable declaration");
        boolean temporary = match(TokenType.TEMPORARY);
        DataType dataType = parseDataType();
        temporary = temporary || dataType.temporary();
        Modifiers modifiers = parseModifiers(true);
        consumeExpected(TokenType.SEMICOLON, "Expected ; after variable declaration");
        return new VariableDeclaration(nameToken.value(), nameToken, dataType, temporary, modifiers.inDataSet,
                modifiers.withEvents, modifiers.runOnClient, modifiers.securityFiltering, start, previous());
    }

    private static final class Modifiers {
        boolean inDataSet;
        boolean withEvents;
        boolean runOnClient;
        String securityFiltering;
    }

    private Modifiers parseModifiers(boolean allowInDataSet) {
        Modifiers modifiers = new Modifiers();
        if (allowInDataSet && match(TokenType.INDATASET)) {
            modifiers.inDataSet = true;
        }
        for (int i = 0; i < 2; i++) {
            if (check(TokenType.WITHEVENTS) && !modifiers.withEvents) {
                advance();
                modifiers.withEvents = true;
            } else if (check(TokenType.RUNONCLIENT) && !modifiers.runOnClient) {
                advance();
                modifiers.runOnClient = true;
            }
        }
        if (match(TokenType.SECURITYFILTERING)) {
            consume(TokenType.LPAREN, "Expected ( after SECURITYFILTERING");
            modifiers.securityFiltering = consume(TokenType.IDENTIFIER, "Expected security filtering value").value();
            consume(TokenType.RPAREN, "Expected ) after security filtering value");
        }
        return modifiers;
    }

    // ==================== CODE section ====================

    protected CodeSection parseCodeSection() {
        Token start = consume(TokenType.CODE, "Expected CODE");
        if (!match(TokenType.LBRACE)) {
            recordError("Expected { to open CODE section", peek(), ParseErrorCode.UNCLOSED_BLOCK);
        }

        List<VariableDeclaration> variables = new ArrayList<>();
        List<ProcedureDeclaration> procedures = new ArrayList<>();
        List<TriggerDeclaration> triggers = new ArrayList<>();
        List<EventDeclaration> events = new ArrayList<>();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations(variables);
        }

        while (!isAtEnd()) {
            List<ProcedureAttribute> attributes = new ArrayList<>();
            Token firstBracket = null;
            int attributeAttempts = 0;
            try {
                skipAlOnlyTokens();
                while (check(TokenType.LBRACKET)) {
                    if (firstBracket == null) {
                        firstBracket = peek();
                    }
                    attributeAttempts++;
                    ProcedureAttribute attribute = parseAttribute();
                    if (attribute != null) {
                        attributes.add(attribute);
                    }
                }

                boolean local = match(TokenType.LOCAL);
                if (local) {
                    skipAlOnlyTokens();
                }

                if (checkAny(TokenType.PROCEDURE, TokenType.FUNCTION)) {
                    procedures.add(parseProcedure(local, attributes));
                } else if (checkAny(TokenType.TRIGGER, TokenType.EVENT)) {
                    if (firstBracket != null) {
                        recordError(pluralAttributes(attributeAttempts) + " ignored - attributes are only "
                                + "supported on PROCEDURE declarations in C/AL", firstBracket);
                    }
                    if (check(TokenType.TRIGGER)) {
                        triggers.add(parseTrigger());
                    } else {
                        events.add(parseEvent());
                    }
                } else {
                    break;
                }
            } catch (ParseError e) {
                addError(e);
                if (firstBracket != null) {
                    Token anchor = attributes.isEmpty() ? firstBracket : attributes.get(0).startToken();
                    recordError(pluralAttributes(attributeAttempts) + " discarded due to invalid declaration",
                            anchor);
                }
                while (!isAtEnd() && !isProcedureBoundary() && !check(TokenType.EVENT)
                        && !"}".equals(peek().value())) {
                    advance();
                }
            }
        }

        skipDocumentationTrigger();

        Token end;
        if (isClosingBrace()) {
            end = advance();
        } else {
            while (!isAtEnd() && !isClosingBrace()) {
                advance();
            }
            if (isClosingBrace()) {
                end = advance();
            } else {
                recordError("Expected } to close CODE section", peek(), ParseErrorCode.UNCLOSED_BLOCK);
                end = previous();
            }
        }
        return new CodeSection(variables, procedures, triggers, events, start, end);
    }

    private static String pluralAttributes(int count) {
        return count + (count == 1 ? " attribute" : " attributes");
    }

    /** A stray '}' can lex as UNKNOWN after malformed code, so compare by value too. */
    private boolean isClosingBrace() {
        return !isAtEnd() && (check(TokenType.RBRACE) || "}".equals(peek().value()));
    }

    /** BEGIN ... END. at the end of a CODE section holds the object documentation. */
    private void skipDocumentationTrigger() {
        if (!match(TokenType.BEGIN)) {
            return;
        }
        while (!check(TokenType.END) && !isAtEnd()) {
            advance();
        }
        match(TokenType.END);
        match(TokenType.DOT);
    }

    // ==================== Attributes ====================

    private ProcedureAttribute parseAttribute() {
        Token start = advance();
        if (check(TokenType.RBRACKET)) {
            recordError("Empty attribute");
            advance();
            return null;
        }
        if (!canBeUsedAsIdentifier()) {
            recordError("Expected attribute name after [");
            return recoverFromMalformedAttribute();
        }

        Token nameToken = advance();
        List<Token> rawTokens = new ArrayList<>();
        boolean hasArguments = check(TokenType.LPAREN);
        if (hasArguments) {
            int depth = 0;
            while (!isAtEnd()) {
                Token token = peek();
                if (token.type() == TokenType.LPAREN) {
                    depth++;
                    rawTokens.add(advance());
                } else if (token.type() == TokenType.RPAREN) {
                    rawTokens.add(advance());
                    depth--;
                    if (depth == 0) {
                        break;
                    }
                } else if (token.type() == TokenType.RBRACKET && depth == 0) {
                    break;
                } else {
                    rawTokens.add(advance());
                }
            }
            if (depth > 0) {
                recordError("Unclosed parenthesis in attribute", peek(), ParseErrorCode.UNCLOSED_BLOCK);
                return recoverFromMalformedAttribute();
            }
        }

        if (!check(TokenType.RBRACKET)) {
            recordError("Expected ] to close attribute", peek(), ParseErrorCode.UNCLOSED_BLOCK);
            return recoverFromMalformedAttribute();
        }
        Token end = advance();
        return new ProcedureAttribute(nameToken.value(), nameToken, rawTokens, hasArguments, start, end);
    }

    private ProcedureAttribute recoverFromMalformedAttribute() {
        while (!isAtEnd()) {
            if (match(TokenType.RBRACKET)) {
                break;
            }
            if (checkAny(TokenType.PROCEDURE, TokenType.FUNCTION, TokenType.LOCAL, TokenType.BEGIN)) {
                break;
            }
            advance();
        }
        return null;
    }

    // ==================== Procedures ====================

    private ProcedureDeclaration parseProcedure(boolean local, List<ProcedureAttribute> attributes) {
        Token start = advance();
        boolean function = start.type() == TokenType.FUNCTION;
        if (!canBeUsedAsIdentifier()) {
            throw error("Expected procedure name, found '" + peek().value() + "'", peek(), ParseErrorCode.GENERIC);
        }
        Token nameToken = advance();
        skipAutoNumberSuffix();

        List<ParameterDeclaration> parameters = parseParameters();
        DataType returnType = null;
        if (match(TokenType.COLON)) {
            returnType = parseDataType();
        }
        match(TokenType.SEMICOLON);

        List<VariableDeclaration> variables = new ArrayList<>();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations(variables);
        }

        BlockStatement body = null;
        if (check(TokenType.BEGIN)) {
            try {
                body = parseBlock();
            } catch (ParseError e) {
                if (!isProcedureBoundary()) {
                    throw e;
                }
                addError(e);
                return new ProcedureDeclaration(nameToken.value(), nameToken, parameters, returnType, local,
                        function, variables, null, attributes, start, previous());
            }
        }
        match(TokenType.SEMICOLON);
        return new ProcedureDeclaration(nameToken.value(), nameToken, parameters, returnType, local, function,
                variables, body, attributes, start, previous());
    }

    private List<ParameterDeclaration> parseParameters() {
        List<ParameterDeclaration> parameters = new ArrayList<>();
        if (!match(TokenType.LPAREN)) {
            return parameters;
        }
        while (!check(TokenType.RPAREN) && !isAtEnd()) {
            boolean isVar = match(TokenType.VAR);
            if (canBeUsedAsIdentifier()) {
                parameters.add(parseParameter(isVar));
            }
            if (match(TokenType.SEMICOLON)) {
                continue;
            }
            if (!check(TokenType.RPAREN)) {
                if (checkAny(TokenType.BEGIN, TokenType.VAR, TokenType.PROCEDURE)) {
                    recordError("Expected ) in parameter list (missing closing parenthesis)");
                } else {
                    recordError("Unexpected token '" + peek().value() + "' in parameter list (expected ';' or ')')");
                }
                advance();
            }
        }
        consumeExpected(TokenType.RPAREN, "Expected ) after parameter list");
        match(TokenType.SEMICOLON);
        return parameters;
    }

    private ParameterDeclaration parseParameter(boolean isVar) {
        Token nameToken = advance();
        skipAutoNumberSuffix();
        boolean temporary = false;
        DataType dataType = null;
        if (match(TokenType.COLON)) {
            temporary = match(TokenType.TEMPORARY);
            dataType = parseDataType();
            temporary = temporary || dataType.temporary();
        }
        parseModifiers(false);
        if (dataType == null) {
            dataType = DataType.named("Variant", nameToken, nameToken);
        }
        return new ParameterDeclaration(nameToken.value(), nameToken, dataType, isVar, temporary, nameToken,
                previous());
    }

    // ==================== Triggers and events ====================

    /**
     * Parses the {@code [VAR ...] BEGIN ... END;} of a property trigger such as OnValidate.
     */
    protected TriggerDeclaration parseFieldTrigger(String name, Token start) {
        List<VariableDeclaration> variables = new ArrayList<>();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations(variables);
        }
        BlockStatement body = check(TokenType.BEGIN) ? parseBlock() : null;
        match(TokenType.SEMICOLON);
        return new TriggerDeclaration(name, variables, body, start, previous());
    }

    private TriggerDeclaration parseTrigger() {
        Token start = consume(TokenType.TRIGGER, "Expected TRIGGER");
        String name = advance().value();
        if (match(TokenType.LPAREN)) {
            match(TokenType.RPAREN);
        }
        match(TokenType.SEMICOLON);
        List<VariableDeclaration> variables = new ArrayList<>();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations(variables);
        }
        BlockStatement body = check(TokenType.BEGIN) ? parseBlock() : null;
        match(TokenType.SEMICOLON);
        return new TriggerDeclaration(name, variables, body, start, previous());
    }

    private EventDeclaration parseEvent() {
        Token start = consume(TokenType.EVENT, "Expected EVENT");
        String subscriber = parseEventQualifiedName();
        consume(TokenType.DOUBLE_COLON, "Expected :: between subscriber and event name");
        String eventName = parseEventQualifiedName();
        List<ParameterDeclaration> parameters = parseParameters();
        match(TokenType.SEMICOLON);
        List<VariableDeclaration> variables = new ArrayList<>();
        if (check(TokenType.VAR)) {
            parseVariableDeclarations(variables);
        }
        BlockStatement body = check(TokenType.BEGIN) ? parseBlock() : null;
        match(TokenType.SEMICOLON);
        return new EventDeclaration(subscriber, eventName, parameters, variables, body, start, previous());
    }

    /**
     * Event names keep their {@code @n} suffix, which identifies the control they belong to.
     */
    private String parseEventQualifiedName() {
        if (!canBeUsedAsIdentifier()) {
            recordError("Expected identifier for event name, found '" + peek().value() + "'");
            return "";
        }
        StringBuilder name = new StringBuilder(advance().value());
        if (check(TokenType.UNKNOWN) && "@".equals(peek().value())) {
            advance();
            name.append('@');
            if (match(TokenType.MINUS)) {
                name.append('-');
            }
            if (check(TokenType.INTEGER)) {
                name.append(advance().value());
            } else {
                recordError("Expected number after @ in event name");
            }
        }
        return name.toString();
    }
}
