package org.navtools.cal.dsl.ast;

/**
 * Sealed interface for C/AL expressions.
 */
public sealed interface Expression extends Node
        permits Identifier, Literal, BinaryExpression, UnaryExpression, MemberExpression,
        CallExpression, ArrayAccessExpression, SetLiteral, RangeExpression {
}
