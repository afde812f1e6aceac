package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * The CODE section: globals, procedures, triggers and event subscribers.
 */
public record CodeSection(
        List<VariableDeclaration> variables,
        List<ProcedureDeclaration> procedures,
        List<TriggerDeclaration> triggers,
        List<EventDeclaration> events,
        Token startToken,
        Token endToken) implements Node {

    @Override
    public List<Node> children() {
        return Node.collect(variables, procedures, triggers, events);
    }
}
