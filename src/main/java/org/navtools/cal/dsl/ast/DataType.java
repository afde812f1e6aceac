package org.navtools.cal.dsl.ast;

import org.navtools.cal.dsl.Token;

import java.util.List;

/**
 * A data type as written in a field, variable, parameter or return declaration.
 *
 * @param typeName          The type as it reads in source, e.g. {@code Code20}, {@code Record 18},
 *                          {@code Text[30]}, {@code ARRAY[9,2] OF Decimal}
 * @param length            Size of sized types, or the first array dimension
 * @param dimensions        Array dimensions, empty for non-arrays
 * @param tableId           Table number of {@code Record n}
 * @param optionString      Inline option values, e.g. {@code Open,Released}
 * @param temporary         {@code ARRAY ... OF TEMPORARY}
 * @param assemblyReference DotNet assembly part
 * @param dotNetTypeName    DotNet type part
 * @param automation        Automation COM reference
 */
public record DataType(
        String typeName,
        Integer length,
        List<Integer> dimensions,
        Integer tableId,
        String optionString,
        boolean temporary,
        String assemblyReference,
        String dotNetTypeName,
        AutomationReference automation,
        Token startToken,
        Token endToken) implements Node {

    /**
     * {@code Automation "{typeLibGuid} version:{classGuid}:'typeLibName'.className"}.
     */
    public record AutomationReference(String typeLibGuid, String version, String classGuid, String typeLibName,
            String className) {
    }

    public static DataType named(String typeName, Token startToken, Token endToken) {
        return new DataType(typeName, null, List.of(), null, null, false, null, null, null, startToken, endToken);
    }

    public boolean isArray() {
        return !dimensions.isEmpty();
    }
}
