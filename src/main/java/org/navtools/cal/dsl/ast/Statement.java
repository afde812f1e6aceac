package org.navtools.cal.dsl.ast;

/**
 * Sealed interface for C/AL statements.
 *
 * Type hierarchy:
 * Statement
 * ├── BlockStatement (BEGIN ... END)
 * ├── IfStatement, WhileStatement, RepeatStatement, ForStatement, CaseStatement, WithStatement
 * ├── AssignmentStatement, CallStatement
 * └── ExitStatement, BreakStatement, EmptyStatement
 */
public sealed interface Statement extends Node
        permits BlockStatement, IfStatement, WhileStatement, RepeatStatement, ForStatement,
        CaseStatement, AssignmentStatement, CallStatement, ExitStatement, BreakStatement,
        EmptyStatement, WithStatement {
}
