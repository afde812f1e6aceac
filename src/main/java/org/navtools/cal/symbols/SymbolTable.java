package org.navtools.cal.symbols;

import org.navtools.cal.dsl.Token;
import org.navtools.cal.dsl.ast.ActionDeclaration;
import org.navtools.cal.dsl.ast.ActionSection;
import org.navtools.cal.dsl.ast.CodeSection;
import org.navtools.cal.dsl.ast.ControlDeclaration;
import org.navtools.cal.dsl.ast.DataType;
import org.navtools.cal.dsl.ast.Document;
import org.navtools.cal.dsl.ast.EventDeclaration;
import org.navtools.cal.dsl.ast.FieldDeclaration;
import org.navtools.cal.dsl.ast.Node;
import org.navtools.cal.dsl.ast.ObjectDeclaration;
import org.navtools.cal.dsl.ast.ParameterDeclaration;
import org.navtools.cal.dsl.ast.ProcedureDeclaration;
import org.navtools.cal.dsl.ast.Property;
import org.navtools.cal.dsl.ast.TriggerDeclaration;
import org.navtools.cal.dsl.ast.VariableDeclaration;
import org.navtools.cal.dsl.ast.XmlPortElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Scoped symbols of one parsed document.
 *
 * The root scope holds fields, global variables and procedure names. Each procedure, and each
 * trigger or event that declares parameters or local variables, gets a child scope spanning its
 * declaration. Blocks do not open scopes. Lookup is case-insensitive and innermost-first.
 */
public final class SymbolTable {

    private static final Logger logger = LoggerFactory.getLogger(SymbolTable.class);

    private final List<Scope> scopes = new ArrayList<>();
    private int duplicates;

    private SymbolTable(int documentStart, int documentEnd) {
        scopes.add(new Scope(0, Scope.NO_PARENT, documentStart, documentEnd));
    }

    /**
     * Builds the table in one walk over the document.
     */
    public static SymbolTable buildFromAst(Document document) {
        Objects.requireNonNull(document, "document");
        SymbolTable table = new SymbolTable(document.startOffset(), Math.max(document.startOffset(),
                document.endOffset()));
        ObjectDeclaration object = document.object();
        if (object != null) {
            table.registerObject(object);
        }
        logger.debug("Built symbol table: {} scope(s), {} symbol(s), {} duplicate declaration(s) ignored",
                table.scopes.size(), table.getAllSymbols().size(), table.duplicates);
        return table;
    }

    // ==================== Registration ====================

    private void registerObject(ObjectDeclaration object) {
        Scope root = getRootScope();

        if (object.fields() != null) {
            for (FieldDeclaration field : object.fields().fields()) {
                declare(root, new Symbol(field.fieldName(), SymbolKind.FIELD,
                        firstNonNull(field.nameToken(), field.startToken()), typeName(field.dataType())));
                for (TriggerDeclaration trigger : field.triggers()) {
                    registerTrigger(trigger);
                }
                registerPropertyTriggers(field.properties());
            }
        }
        if (object.properties() != null) {
            registerPropertyTriggers(object.properties().properties());
        }
        if (object.actions() != null) {
            registerActions(object.actions().actions());
        }
        if (object.controls() != null) {
            registerControls(object.controls().controls());
        }
        if (object.elements() != null) {
            registerElements(object.elements().elements());
        }
        if (object.code() != null) {
            registerCode(object.code());
        }
    }

    private void registerCode(CodeSection code) {
        Scope root = getRootScope();
        for (VariableDeclaration variable : code.variables()) {
            declare(root, variableSymbol(variable));
        }
        for (ProcedureDeclaration procedure : code.procedures()) {
            SymbolKind kind = procedure.function() ? SymbolKind.FUNCTION : SymbolKind.PROCEDURE;
            declare(root, new Symbol(procedure.name(), kind,
                    firstNonNull(procedure.nameToken(), procedure.startToken()), typeName(procedure.returnType())));

            Scope scope = openScope(procedure);
            for (ParameterDeclaration parameter : procedure.parameters()) {
                declare(scope, parameterSymbol(parameter));
            }
            for (VariableDeclaration variable : procedure.variables()) {
                declare(scope, variableSymbol(variable));
            }
        }
        for (TriggerDeclaration trigger : code.triggers()) {
            registerTrigger(trigger);
        }
        for (EventDeclaration event : code.events()) {
            if (event.parameters().isEmpty() && event.variables().isEmpty()) {
                continue;
            }
            Scope scope = openScope(event);
            for (ParameterDeclaration parameter : event.parameters()) {
                declare(scope, parameterSymbol(parameter));
            }
            for (VariableDeclaration variable : event.variables()) {
                declare(scope, variableSymbol(variable));
            }
        }
    }

    private void registerTrigger(TriggerDeclaration trigger) {
        if (trigger.variables().isEmpty()) {
            return;
        }
        Scope scope = openScope(trigger);
        for (VariableDeclaration variable : trigger.variables()) {
            declare(scope, variableSymbol(variable));
        }
    }

    private void registerPropertyTriggers(List<Property> properties) {
        for (Property property : properties) {
            if (property.triggerBody() != null && !property.triggerVariables().isEmpty()) {
                Scope scope = openScope(property);
                for (VariableDeclaration variable : property.triggerVariables()) {
                    declare(scope, variableSymbol(variable));
                }
            }
            ActionSection inline = property.actionSection();
            if (inline != null) {
                registerActions(inline.actions());
            }
        }
    }

    private void registerActions(List<ActionDeclaration> actions) {
        for (ActionDeclaration action : actions) {
            action.triggers().forEach(this::registerTrigger);
            registerPropertyTriggers(action.properties());
            registerActions(action.nested());
        }
    }

    private void registerControls(List<ControlDeclaration> controls) {
        for (ControlDeclaration control : controls) {
            control.triggers().forEach(this::registerTrigger);
            registerPropertyTriggers(control.properties());
            registerControls(control.nested());
        }
    }

    private void registerElements(List<XmlPortElement> elements) {
        for (XmlPortElement element : elements) {
            element.triggers().forEach(this::registerTrigger);
            registerPropertyTriggers(element.properties());
            registerElements(element.nested());
        }
    }

    private Scope openScope(Node owner) {
        Scope scope = new Scope(scopes.size(), getRootScope().id(), owner.startOffset(),
                Math.max(owner.startOffset(), owner.endOffset()));
        scopes.add(scope);
        return scope;
    }

    private void declare(Scope scope, Symbol symbol) {
        if (symbol.name() == null || symbol.name().isEmpty()) {
            return;
        }
        if (!scope.declare(symbol)) {
            duplicates++;
            logger.trace("Duplicate declaration of '{}' in {} ignored", symbol.name(), scope);
        }
    }

    private static Symbol variableSymbol(VariableDeclaration variable) {
        return new Symbol(variable.name(), SymbolKind.VARIABLE,
                firstNonNull(variable.nameToken(), variable.startToken()), typeName(variable.dataType()));
    }

    private static Symbol parameterSymbol(ParameterDeclaration parameter) {
        return new Symbol(parameter.name(), SymbolKind.PARAMETER,
                firstNonNull(parameter.nameToken(), parameter.startToken()), typeName(parameter.dataType()));
    }

    private static String typeName(DataType dataType) {
        return dataType != null ? dataType.typeName() : null;
    }

    private static Token firstNonNull(Token preferred, Token fallback) {
        return preferred != null ? preferred : fallback;
    }

    // ==================== Lookup ====================

    public Scope getRootScope() {
        return scopes.get(0);
    }

    public List<Scope> getScopes() {
        return Collections.unmodifiableList(scopes);
    }

    public Scope getParent(Scope scope) {
        return scope.isRoot() ? null : scopes.get(scope.parentId());
    }

    /**
     * First declaration of the name: the root scope is searched before the child scopes.
     */
    public Symbol getSymbol(String name) {
        for (Scope scope : scopes) {
            Symbol symbol = scope.lookupLocal(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    public Optional<Symbol> findSymbol(String name) {
        return Optional.ofNullable(getSymbol(name));
    }

    public boolean hasSymbol(String name) {
        return getSymbol(name) != null;
    }

    /**
     * The innermost scope whose span contains the offset, or the root scope.
     */
    public Scope getScopeAtOffset(int offset) {
        Scope best = getRootScope();
        for (int i = 1; i < scopes.size(); i++) {
            Scope scope = scopes.get(i);
            if (scope.contains(offset) && isNarrower(scope, best)) {
                best = scope;
            }
        }
        return best;
    }

    private static boolean isNarrower(Scope candidate, Scope current) {
        return current.isRoot()
                || candidate.endOffset() - candidate.startOffset() < current.endOffset() - current.startOffset();
    }

    /**
     * Resolves a name from the scope enclosing the offset, walking outward.
     */
    public Symbol getSymbolAtOffset(String name, int offset) {
        for (Scope scope = getScopeAtOffset(offset); scope != null; scope = getParent(scope)) {
            Symbol symbol = scope.lookupLocal(name);
            if (symbol != null) {
                return symbol;
            }
        }
        return null;
    }

    /**
     * Every name reachable from the scope, once each, with the nearest declaration winning.
     */
    public List<Symbol> getVisibleSymbols(Scope scope) {
        Map<String, Symbol> visible = new LinkedHashMap<>();
        for (Scope current = scope; current != null; current = getParent(current)) {
            for (Symbol symbol : current.symbols()) {
                visible.putIfAbsent(Scope.key(symbol.name()), symbol);
            }
        }
        return new ArrayList<>(visible.values());
    }

    public List<Symbol> getAllSymbols() {
        List<Symbol> all = new ArrayList<>();
        for (Scope scope : scopes) {
            all.addAll(scope.symbols());
        }
        return all;
    }
}
