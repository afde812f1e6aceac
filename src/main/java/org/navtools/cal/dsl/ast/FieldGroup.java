package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * {@code { id ; name ; field, field, ... }}
 */
public record FieldGroup(int id, String name, List<String> fields, Token startToken, Token endToken)
        implements Node {
}
