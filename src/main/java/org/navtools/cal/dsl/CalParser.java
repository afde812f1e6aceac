package org.navtools.cal.dsl;

import org.navtools.cal.dsl.Token.TokenType;
import org.navtools.cal.dsl.antlr.AntlrPropertyValueAdapter;
import org.navtools.cal.dsl.ast.ActionDeclaration;
import org.navtools.cal.dsl.ast.ActionSection;
import org.navtools.cal.dsl.ast.ActionType;
import org.navtools.cal.dsl.ast.BlockStatement;
import org.navtools.cal.dsl.ast.CodeSection;
import org.navtools.cal.dsl.ast.ControlDeclaration;
import org.navtools.cal.dsl.ast.ControlSection;
import org.navtools.cal.dsl.ast.ControlType;
import org.navtools.cal.dsl.ast.DataType;
import org.navtools.cal.dsl.ast.Document;
import org.navtools.cal.dsl.ast.ElementsSection;
import org.navtools.cal.dsl.ast.FieldDeclaration;
import org.navtools.cal.dsl.ast.FieldGroup;
import org.navtools.cal.dsl.ast.FieldGroupSection;
import org.navtools.cal.dsl.ast.FieldSection;
import org.navtools.cal.dsl.ast.KeyDeclaration;
import org.navtools.cal.dsl.ast.KeySection;
import org.navtools.cal.dsl.ast.ObjectDeclaration;
import org.navtools.cal.dsl.ast.ObjectKind;
import org.navtools.cal.dsl.ast.Property;
import org.navtools.cal.dsl.ast.PropertySection;
import org.navtools.cal.dsl.ast.TriggerDeclaration;
import org.navtools.cal.dsl.ast.VariableDeclaration;
import org.navtools.cal.dsl.ast.XmlPortElement;
import org.navtools.cal.dsl.ast.XmlPortElement.NodeType;
import org.navtools.cal.dsl.ast.XmlPortElement.SourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Error-tolerant recursive descent parser for C/AL object exports.
 *
 * {@link #parse()} never throws: every failure becomes a {@link ParseError} in {@link #getErrors()}
 * and the returned {@link Document} holds whatever could be recovered.
 *
 * Usage:
 * <pre>
 * CalParser parser = new CalParser(CalLexer.tokenize(source));
 * Document document = parser.parse();
 * List&lt;ParseError&gt; errors = parser.getErrors();
 * </pre>
 */
public final class CalParser extends DeclarationParser {

    private static final Logger logger = LoggerFactory.getLogger(CalParser.class);

    private static final int MAX_PROPERTY_NAME_TOKENS = 5;

    private static final Set<TokenType> UNSUPPORTED_SECTIONS = EnumSet.of(
            TokenType.MENUNODES, TokenType.DATASET, TokenType.REQUESTPAGE, TokenType.LABELS,
            TokenType.REQUESTFORM, TokenType.DATAITEMS, TokenType.SECTIONS);

    /** Keywords that open a nested block inside a property value. */
    private static final Set<TokenType> NESTED_BLOCK_KEYWORDS = EnumSet.of(
            TokenType.ACTIONS, TokenType.CONTROLS, TokenType.ELEMENTS);

    private final boolean parsePropertyValues;

    public CalParser(List<Token> tokens) {
        this(tokens, true);
    }

    /**
     * @param parsePropertyValues whether CalcFormula and TableRelation values are parsed into structures
     */
    public CalParser(List<Token> tokens, boolean parsePropertyValues) {
        super(tokens);
        this.parsePropertyValues = parsePropertyValues;
    }

    /**
     * Convenience method: tokenize and parse a source string.
     */
    public static Document parseSource(String source) {
        return new CalParser(CalLexer.tokenize(source)).parse();
    }

    public Document parse() {
        Token start = peek();
        ObjectDeclaration object = null;
        skipAlOnlyTokens();
        try {
            if (!isAtEnd()) {
                object = parseObject();
            }
        } catch (ParseError e) {
            addError(e);
        }
        Document document = new Document(object, start, previous());
        logger.debug("Parsed {} tokens: object={}, {} diagnostic(s), {} skipped region(s)", tokens.size(),
                object != null ? object.objectKind() + " " + object.objectId() : "none", getErrors().size(),
                getSkippedRegions().size());
        return document;
    }

    // ==================== Object ====================

    private ObjectDeclaration parseObject() {
        Token start = consume(TokenType.OBJECT, "Expected OBJECT keyword");
        Token kindToken = advance();
        ObjectKind kind = ObjectKind.fromTokenType(kindToken.type());
        if (kind == null) {
            throw error("Invalid object type: " + kindToken.type(), peek(), ParseErrorCode.GENERIC);
        }
        int objectId = parseInteger(consume(TokenType.INTEGER, "Expected object ID"), "object ID");
        String objectName = parseObjectName();

        if (match(TokenType.LBRACE)) {
            skipObjectProperties();
        }

        PropertySection properties = null;
        FieldSection fields = null;
        KeySection keys = null;
        FieldGroupSection fieldGroups = null;
        ActionSection actions = null;
        ControlSection controls = null;
        ElementsSection elements = null;
        CodeSection code = null;
        List<VariableDeclaration> objectVariables = new ArrayList<>();

        while (!isAtEnd()) {
            skipAlOnlyTokens();
            TokenType type = peek().type();
            try {
                if (type == TokenType.PROPERTIES) {
                    properties = parsePropertySection();
                } else if (type == TokenType.FIELDS) {
                    fields = parseFieldSection();
                } else if (type == TokenType.KEYS) {
                    keys = parseKeySection();
                } else if (type == TokenType.FIELDGROUPS) {
                    fieldGroups = parseFieldGroupSection();
                } else if (type == TokenType.ACTIONS) {
                    try {
                        actions = parseActionSection(ActionSection.Source.TOP_LEVEL);
                    } catch (ParseError e) {
                        addError(e);
                        skipUnsupportedSection();
                    }
                } else if (type == TokenType.VAR) {
                    parseVariableDeclarations(objectVariables);
                } else if (type == TokenType.CODE) {
                    code = parseCodeSection();
                    if (!objectVariables.isEmpty()) {
                        code = withLeadingVariables(code, objectVariables);
                    }
                } else if (type == TokenType.CONTROLS) {
                    try {
                        controls = parseControlSection();
                    } catch (ParseError e) {
                        addError(e);
                        skipUnsupportedSection();
                    }
                } else if (type == TokenType.ELEMENTS) {
                    if (kind == ObjectKind.XMLPORT) {
                        elements = parseElementsSection();
                    } else {
                        skipUnsupportedSection();
                    }
                } else if (UNSUPPORTED_SECTIONS.contains(type)) {
                    skipUnsupportedSection();
                } else {
                    break;
                }
            } catch (ParseError e) {
                addError(e);
                synchronize();
            }
        }

        return new ObjectDeclaration(kind, objectId, objectName, properties, fields, keys, fieldGroups, actions,
                controls, elements, code, start, previous());
    }

    private String parseObjectName() {
        if (check(TokenType.STRING)) {
            return advance().value();
        }
        StringBuilder name = new StringBuilder();
        Token last = null;
        while (!check(TokenType.LBRACE) && !isAtEnd()) {
            Token token = advance();
            appendWithGap(name, last, token);
            last = token;
        }
        return name.toString().trim();
    }

    private void skipObjectProperties() {
        if (!match(TokenType.OBJECT_PROPERTIES) || !match(TokenType.LBRACE)) {
            return;
        }
        int depth = 1;
        while (depth > 0 && !isAtEnd()) {
            if (check(TokenType.LBRACE)) {
                depth++;
            } else if (check(TokenType.RBRACE)) {
                depth--;
            }
            advance();
        }
    }

    private static CodeSection withLeadingVariables(CodeSection code, List<VariableDeclaration> leading) {
        List<VariableDeclaration> merged = new ArrayList<>(leading);
        merged.addAll(code.variables());
        return new CodeSection(merged, code.procedures(), code.triggers(), code.events(), code.startToken(),
                code.endToken());
    }

    // ==================== Section scaffolding ====================

    /**
     * Consumes the brace opening an item section, unless the token after it shows that the brace
     * actually opens the first item.
     */
    private void consumeSectionBrace(String sectionName, Predicate<TokenType> isItemContent) {
        if (!check(TokenType.LBRACE) || isItemContent.test(peekAhead(1).type())) {
            recordError("Expected { to open " + sectionName + " section", peek(), ParseErrorCode.UNCLOSED_BLOCK);
            return;
        }
        advance();
    }

    private Token closeSection(String sectionName) {
        if (check(TokenType.RBRACE)) {
            return advance();
        }
        recordError("Expected } to close " + sectionName + " section", peek(), ParseErrorCode.UNCLOSED_BLOCK);
        return previous();
    }

    private Token closeItem(String itemName) {
        if (check(TokenType.RBRACE)) {
            return advance();
        }
        recordError("Expected } to close " + itemName + " definition", peek(), ParseErrorCode.UNCLOSED_BLOCK);
        return previous();
    }

    /**
     * Parses {@code { item } { item } ...} until the section ends, skipping to the next item after a failure.
     */
    private <T> List<T> parseItems(Supplier<T> itemParser, boolean stopAtCode) {
        List<T> items = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd() && !isSectionKeyword(peek().type())
                && !(stopAtCode && check(TokenType.CODE))) {
            try {
                items.add(itemParser.get());
            } catch (ParseError e) {
                addError(e);
                recoverToTokens(TokenType.LBRACE, TokenType.RBRACE);
                if (check(TokenType.RBRACE) && peekAhead(1).type() == TokenType.LBRACE) {
                    advance();
                }
            }
        }
        return items;
    }

    private int parseIndentLevel() {
        int indent = 0;
        if (!check(TokenType.SEMICOLON) && !isAtEnd()) {
            boolean negative = match(TokenType.MINUS);
            indent = parseInteger(consume(TokenType.INTEGER, "Expected indent level"), "indent level");
            if (negative) {
                indent = -indent;
            }
        }
        return indent;
    }

    private int clampIndent(int indent, Token itemStart) {
        if (indent < 0) {
            recordError("Invalid negative indent level " + indent + ", treating as 0", itemStart);
            return 0;
        }
        return indent;
    }

    // ==================== PROPERTIES ====================

    private PropertySection parsePropertySection() {
        Token start = consume(TokenType.PROPERTIES, "Expected PROPERTIES");
        consume(TokenType.LBRACE, "Expected { to open PROPERTIES section");
        List<Property> properties = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd() && !isSectionKeyword(peek().type())) {
            try {
                properties.add(parseProperty());
            } catch (ParseError e) {
                addError(e);
                recoverToTokens(TokenType.SEMICOLON, TokenType.RBRACE);
            }
        }
        return new PropertySection(properties, start, closeSection("PROPERTIES"));
    }

    private Property parseProperty() {
        Token start = peek();
        String name = accumulatePropertyName();
        Token equals = consume(TokenType.EQUAL, "Expected = after property name");

        if (checkAny(TokenType.VAR, TokenType.BEGIN)) {
            List<VariableDeclaration> triggerVariables = new ArrayList<>();
            if (check(TokenType.VAR)) {
                parseVariableDeclarations(triggerVariables);
            }
            BlockStatement body = parseBlock();
            Token end = consumeExpected(TokenType.SEMICOLON, "Expected ; after trigger body");
            return new Property(name, "BEGIN...END", List.of(), triggerVariables, body, null, null, null, start,
                    end);
        }

        if (isActionList(name)) {
            ActionSection actions = parseActionSection(ActionSection.Source.PROPERTY);
            Token end = check(TokenType.SEMICOLON) ? advance() : actions.endToken();
            return new Property(name, "ACTIONS {...}", List.of(), List.of(), null, actions, null, null, start, end);
        }

        PropertyValue value = accumulateValue(name, equals, false);
        Token end;
        if (check(TokenType.SEMICOLON)) {
            end = advance();
        } else {
            end = value.tokens.isEmpty() ? start : value.tokens.get(value.tokens.size() - 1);
        }
        return decorate(Property.simple(name, value.text, value.tokens, start, end));
    }

    private boolean isActionList(String name) {
        return name.equalsIgnoreCase("ActionList") && check(TokenType.ACTIONS) && isFollowedByLeftBrace();
    }

    /**
     * Property names may span several words ({@code SQL Data Type}) or carry a scope ({@code Import::OnBeforeInsertRecord}).
     */
    private String accumulatePropertyName() {
        StringBuilder name = new StringBuilder(advance().value());
        int count = 1;
        while (count < MAX_PROPERTY_NAME_TOKENS && !isAtEnd()) {
            if (check(TokenType.DOUBLE_COLON)) {
                name.append(advance().value());
            } else if (check(TokenType.IDENTIFIER)) {
                if (!name.toString().endsWith("::")) {
                    name.append(' ');
                }
                name.append(advance().value());
            } else {
                break;
            }
            count++;
        }
        return name.toString();
    }

    private static final class PropertyValue {
        final String text;
        final List<Token> tokens;

        PropertyValue(String text, List<Token> tokens) {
            this.text = text;
            this.tokens = tokens;
        }
    }

    /**
     * Collects the raw tokens of a property value up to its terminating semicolon, tracking braces and
     * brackets so {@code OptionOrdinalValues=[1;2]} and nested blocks stay in one value.
     *
     * @param itemProperty whether the property belongs to a section item, where a bare '{' starts the next item
     */
    private PropertyValue accumulateValue(String name, Token equals, boolean itemProperty) {
        StringBuilder text = new StringBuilder();
        List<Token> valueTokens = new ArrayList<>();
        Token last = null;
        int braces = 0;
        int brackets = 0;

        while (!isAtEnd()) {
            boolean topLevel = braces == 0 && brackets == 0;
            if (check(TokenType.SEMICOLON) && topLevel) {
                break;
            }
            if (check(TokenType.RBRACE) && braces == 0 && (!itemProperty || brackets == 0) && text.length() > 0) {
                break;
            }
            if (topLevel && text.length() > 0 && isValueSectionBoundary(itemProperty) && isFollowedByLeftBrace()) {
                break;
            }

            Token current = advance();
            if (current.type() == TokenType.LBRACE) {
                if (itemProperty && topLevel && (last == null || !NESTED_BLOCK_KEYWORDS.contains(last.type()))) {
                    retreat();
                    break;
                }
                braces++;
            } else if (current.type() == TokenType.RBRACE) {
                braces--;
                if (braces < 0) {
                    if (current.startOffset() <= equals.endOffset()) {
                        recordError("Empty or malformed value for property '" + name + "'", current);
                    }
                    retreat();
                    break;
                }
            } else if (current.type() == TokenType.LBRACKET) {
                brackets++;
            } else if (current.type() == TokenType.RBRACKET) {
                brackets = Math.max(0, brackets - 1);
            }

            valueTokens.add(current);
            appendWithGap(text, last, current);
            last = current;
        }
        return new PropertyValue(text.toString().trim(), valueTokens);
    }

    private boolean isValueSectionBoundary(boolean itemProperty) {
        return checkAny(TokenType.ACTIONS, TokenType.CONTROLS, TokenType.ELEMENTS, TokenType.REQUESTFORM)
                || (!itemProperty && check(TokenType.DATAITEMS));
    }

    /**
     * Attaches the structured form of CalcFormula and TableRelation values.
     */
    private Property decorate(Property property) {
        if (!parsePropertyValues || property.valueTokens().isEmpty()) {
            return property;
        }
        try {
            if (property.name().equalsIgnoreCase("CalcFormula")) {
                return property.withCalcFormula(AntlrPropertyValueAdapter.parseCalcFormula(property.valueTokens()));
            }
            if (property.name().equalsIgnoreCase("TableRelation")) {
                return property.withTableRelation(
                        AntlrPropertyValueAdapter.parseTableRelation(property.valueTokens()));
            }
        } catch (ParseError e) {
            addError(e);
        }
        return property;
    }

    // ==================== Item properties ====================

    private static final class ItemBody {
        final List<Property> properties = new ArrayList<>();
        final List<TriggerDeclaration> triggers = new ArrayList<>();
    }

    /**
     * Properties and triggers inside a field, action, control or element definition.
     */
    private ItemBody parseItemProperties() {
        ItemBody body = new ItemBody();
        if (check(TokenType.RBRACE) || isAtEnd()) {
            return body;
        }
        while (!check(TokenType.RBRACE) && !isAtEnd() && !check(TokenType.LBRACE)) {
            try {
                Token start = peek();
                String name = accumulatePropertyName();
                Token equals = consume(TokenType.EQUAL, "Expected = after field property name");
                if (checkAny(TokenType.BEGIN, TokenType.VAR)) {
                    body.triggers.add(parseFieldTrigger(name, start));
                } else if (isActionList(name)) {
                    ActionSection actions = parseActionSection(ActionSection.Source.CONTROL_PROPERTY);
                    match(TokenType.SEMICOLON);
                    body.properties.add(new Property(name, "ACTIONS {...}", List.of(), List.of(), null, actions,
                            null, null, start, previous()));
                } else {
                    PropertyValue value = accumulateValue(name, equals, true);
                    match(TokenType.SEMICOLON);
                    body.properties.add(decorate(Property.simple(name, value.text, value.tokens, start, previous())));
                }
            } catch (ParseError e) {
                addError(e);
                recoverToTokens(TokenType.SEMICOLON, TokenType.RBRACE);
            }
        }
        return body;
    }

    // ==================== FIELDS ====================

    private FieldSection parseFieldSection() {
        Token start = consume(TokenType.FIELDS, "Expected FIELDS");
        consumeSectionBrace("FIELDS", type -> type == TokenType.INTEGER);
        List<FieldDeclaration> fields = parseItems(this::parseField, false);
        return new FieldSection(fields, start, closeSection("FIELDS"));
    }

    private FieldDeclaration parseField() {
        Token start = consume(TokenType.LBRACE, "Expected { to open field definition");
        int fieldNo = parseInteger(consume(TokenType.INTEGER, "Expected field number"),
                "field number in FIELDS section");
        consume(TokenType.SEMICOLON, "Expected ; after field number");

        String fieldClass = "";
        if (!check(TokenType.SEMICOLON)) {
            fieldClass = advance().value();
        }
        consume(TokenType.SEMICOLON, "Expected ; after field class");

        String fieldName;
        Token nameToken = null;
        if (check(TokenType.QUOTED_IDENTIFIER)) {
            nameToken = advance();
            fieldName = nameToken.value();
        } else {
            Token first = peek();
            StringBuilder name = new StringBuilder();
            Token last = null;
            while (!check(TokenType.SEMICOLON) && !isAtEnd()) {
                Token token = advance();
                appendWithGap(name, last, token);
                last = token;
            }
            fieldName = name.toString().trim();
            if (fieldName.isEmpty()) {
                recordError("Field name cannot be empty (in FIELDS section)", first);
                fieldName = "<missing>";
            } else {
                nameToken = first;
            }
        }
        consume(TokenType.SEMICOLON, "Expected ; after field name");

        DataType dataType = parseDataType();
        match(TokenType.SEMICOLON);
        ItemBody body = parseItemProperties();
        return new FieldDeclaration(fieldNo, fieldClass, fieldName, nameToken, dataType, body.properties,
                body.triggers, start, closeItem("field"));
    }

    // ==================== KEYS ====================

    private KeySection parseKeySection() {
        Token start = consume(TokenType.KEYS, "Expected KEYS");
        consumeSectionBrace("KEYS", type -> type == TokenType.SEMICOLON);
        List<KeyDeclaration> keys = parseItems(this::parseKey, false);
        return new KeySection(keys, start, closeSection("KEYS"));
    }

    private KeyDeclaration parseKey() {
        Token start = consume(TokenType.LBRACE, "Expected { to open key definition");
        while (!check(TokenType.SEMICOLON) && !check(TokenType.RBRACE) && !isAtEnd()) {
            advance();
        }
        List<String> fields = new ArrayList<>();
        if (match(TokenType.SEMICOLON) && !check(TokenType.SEMICOLON)) {
            fields = parseFieldList(true);
        }
        while (!check(TokenType.RBRACE) && !isAtEnd() && !isSectionKeyword(peek().type())
                && !check(TokenType.LBRACE)) {
            advance();
        }
        return new KeyDeclaration(fields, List.of(), start, closeItem("key"));
    }

    /**
     * Reads a comma-separated list of field names, preserving the spacing inside each name.
     */
    private List<String> parseFieldList(boolean stopAtSemicolon) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        Token last = null;
        while (!check(TokenType.RBRACE) && !isAtEnd() && !isSectionKeyword(peek().type())
                && !check(TokenType.LBRACE) && !(stopAtSemicolon && check(TokenType.SEMICOLON))) {
            if (match(TokenType.COMMA)) {
                addFieldName(fields, current);
                current = new StringBuilder();
                last = null;
                continue;
            }
            Token token = advance();
            appendWithGap(current, last, token);
            last = token;
        }
        addFieldName(fields, current);
        return fields;
    }

    private static void addFieldName(List<String> fields, StringBuilder name) {
        String trimmed = name.toString().trim();
        if (!trimmed.isEmpty()) {
            fields.add(trimmed);
        }
    }

    // ==================== FIELDGROUPS ====================

    private FieldGroupSection parseFieldGroupSection() {
        Token start = consume(TokenType.FIELDGROUPS, "Expected FIELDGROUPS");
        consumeSectionBrace("FIELDGROUPS", type -> type == TokenType.INTEGER);
        List<FieldGroup> groups = parseItems(this::parseFieldGroup, false);
        return new FieldGroupSection(groups, start, closeSection("FIELDGROUPS"));
    }

    private FieldGroup parseFieldGroup() {
        Token start = consume(TokenType.LBRACE, "Expected { to open field group definition");
        int id = parseInteger(consume(TokenType.INTEGER, "Expected field group ID"), "field group ID");
        consume(TokenType.SEMICOLON, "Expected ; after field group ID");
        String name = check(TokenType.QUOTED_IDENTIFIER)
                ? advance().value()
                : consume(TokenType.IDENTIFIER, "Expected field group name").value();
        consume(TokenType.SEMICOLON, "Expected ; after field group name");
        List<String> fields = parseFieldList(false);
        return new FieldGroup(id, name, fields, start, closeItem("field group"));
    }

    // ==================== ACTIONS ====================

    private ActionSection parseActionSection(ActionSection.Source source) {
        Token start = consume(TokenType.ACTIONS, "Expected ACTIONS");
        consumeSectionBrace("ACTIONS", type -> type == TokenType.INTEGER);
        List<ActionDeclaration> flat = parseItems(this::parseActionItem, false);
        Token end = closeSection("ACTIONS");
        return new ActionSection(HierarchyBuilder.build(flat), source, start, end);
    }

    private ActionDeclaration parseActionItem() {
        Token start = consume(TokenType.LBRACE, "Expected { to open action definition");
        int id = parseInteger(consume(TokenType.INTEGER, "Expected action ID"), "action ID");
        consume(TokenType.SEMICOLON, "Expected ; after action ID");
        int indent = parseIndentLevel();
        consume(TokenType.SEMICOLON, "Expected ; after indent level");

        ActionType actionType = ActionType.ACTION;
        String rawType = null;
        if (checkAny(TokenType.SEMICOLON, TokenType.RBRACE)) {
            recordError("Missing action type, defaulting to Action");
        } else {
            Token typeToken = advance();
            actionType = ActionType.fromRaw(typeToken.value());
            if (actionType == null) {
                recordError("Unknown action type '" + typeToken.value() + "', treating as Action", typeToken);
                actionType = ActionType.ACTION;
                rawType = typeToken.value();
            }
        }
        match(TokenType.SEMICOLON);

        ItemBody body = parseItemProperties();
        Token end = closeItem("action");
        return new ActionDeclaration(id, clampIndent(indent, start), actionType, rawType, body.properties,
                body.triggers, new ArrayList<>(), start, end);
    }

    // ==================== CONTROLS ====================

    private ControlSection parseControlSection() {
        Token start = consume(TokenType.CONTROLS, "Expected CONTROLS");
        consumeSectionBrace("CONTROLS", type -> type == TokenType.INTEGER);
        List<ControlDeclaration> flat = parseItems(this::parseControlItem, true);
        Token end = closeSection("CONTROLS");
        return new ControlSection(HierarchyBuilder.build(flat), start, end);
    }

    private ControlDeclaration parseControlItem() {
        Token start = consume(TokenType.LBRACE, "Expected { to open control definition");
        int id = parseInteger(consume(TokenType.INTEGER, "Expected control ID"), "control ID");
        consume(TokenType.SEMICOLON, "Expected ; after control ID");
        int indent = parseIndentLevel();
        consume(TokenType.SEMICOLON, "Expected ; after indent level");

        ControlType controlType = ControlType.FIELD;
        String rawType = null;
        if (checkAny(TokenType.SEMICOLON, TokenType.RBRACE)) {
            recordError("Missing control type, defaulting to Field");
        } else {
            Token typeToken = advance();
            controlType = ControlType.fromRaw(typeToken.value());
            if (controlType == null) {
                recordError("Unknown control type '" + typeToken.value() + "', treating as Field", typeToken);
                controlType = ControlType.FIELD;
                rawType = typeToken.value();
            }
        }
        match(TokenType.SEMICOLON);

        ItemBody body = parseItemProperties();
        Token end = closeItem("control");
        return new ControlDeclaration(id, clampIndent(indent, start), controlType, rawType, body.properties,
                body.triggers, new ArrayList<>(), start, end);
    }

    // ==================== ELEMENTS ====================

    private ElementsSection parseElementsSection() {
        Token start = consume(TokenType.ELEMENTS, "Expected ELEMENTS");
        consume(TokenType.LBRACE, "Expected { to open ELEMENTS section");
        List<XmlPortElement> flat = new ArrayList<>();
        while (!check(TokenType.RBRACE) && !isAtEnd() && !isSectionKeyword(peek().type())
                && !checkAny(TokenType.CODE, TokenType.CONTROLS)) {
            try {
                flat.add(parseXmlPortElement());
            } catch (ParseError e) {
                addError(e);
                recoverToElementEnd();
            }
        }
        Token end = closeSection("ELEMENTS");
        return new ElementsSection(HierarchyBuilder.build(flat), start, end);
    }

    /**
     * Skips the rest of a broken element using a depth count local to the element, since GUID braces
     * in malformed input make the global brace depth unreliable.
     */
    private void recoverToElementEnd() {
        int depth = 1;
        while (!isAtEnd()) {
            TokenType type = peek().type();
            if (depth == 1 && (isSectionKeyword(type) || type == TokenType.CODE)) {
                return;
            }
            if (type == TokenType.LBRACE) {
                depth++;
            } else if (type == TokenType.RBRACE) {
                depth--;
                if (depth == 0) {
                    if (!closesElementsSection()) {
                        advance();
                    }
                    return;
                }
            }
            advance();
        }
    }

    private boolean closesElementsSection() {
        Token next = peekAhead(1);
        if (next.type() == TokenType.EOF) {
            return true;
        }
        if (next.type() == TokenType.CODE || next.type() == TokenType.CONTROLS) {
            return peekAhead(2).type() == TokenType.LBRACE;
        }
        return Keywords.SECTION_KEYWORDS.contains(next.type());
    }

    private XmlPortElement parseXmlPortElement() {
        Token start = consume(TokenType.LBRACE, "Expected { to open element definition");

        String guid = "";
        if (match(TokenType.LBRACKET)) {
            consume(TokenType.LBRACE, "Expected { in GUID");
            StringBuilder text = new StringBuilder();
            while (!check(TokenType.RBRACE) && !isAtEnd()) {
                text.append(advance().value());
            }
            guid = text.toString();
            if (guid.indexOf('{') >= 0) {
                long open = guid.chars().filter(c -> c == '{').count();
                recordError("Malformed GUID: unbalanced braces (" + open + " '{' vs 0 '}')");
            }
            consume(TokenType.RBRACE, "Expected } in GUID");
            consume(TokenType.RBRACKET, "Expected ] after GUID");
        }
        consume(TokenType.SEMICOLON, "Expected ; after GUID");

        int indent = 0;
        if (check(TokenType.MINUS) || check(TokenType.INTEGER)) {
            indent = parseIndentLevel();
        }
        consume(TokenType.SEMICOLON, "Expected ; after indent level");

        String name = joinUntilSeparator();
        consume(TokenType.SEMICOLON, "Expected ; after element name");
        NodeType nodeType = NodeType.fromRaw(joinUntilSeparator());
        consume(TokenType.SEMICOLON, "Expected ; after node type");

        SourceType sourceType = SourceType.TEXT;
        if (!checkAny(TokenType.SEMICOLON, TokenType.RBRACE) && !isAtEnd()) {
            Token token = advance();
            if (check(TokenType.EQUAL)) {
                retreat();
            } else {
                sourceType = SourceType.fromRaw(token.value());
                if (sourceType == null) {
                    throw error("Invalid source type '" + token.value() + "' (must be Text, Table, or Field)", token,
                            ParseErrorCode.GENERIC);
                }
            }
        }
        match(TokenType.SEMICOLON);

        ItemBody body = parseItemProperties();
        Token end = closeItem("element");
        return new XmlPortElement(guid, clampIndent(indent, start), name, nodeType, sourceType, body.properties,
                body.triggers, new ArrayList<>(), start, end);
    }

    private String joinUntilSeparator() {
        StringBuilder text = new StringBuilder();
        Token last = null;
        while (!checkAny(TokenType.SEMICOLON, TokenType.RBRACE) && !isAtEnd()) {
            Token token = advance();
            appendWithGap(text, last, token);
            last = token;
        }
        return text.toString().trim();
    }
}
