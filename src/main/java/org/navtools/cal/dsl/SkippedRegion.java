package org.navtools.cal.dsl;

/**
 * A run of tokens the parser skipped while recovering from an error.
 */
public record SkippedRegion(Token startToken, Token endToken, int tokenCount, String reason) {
}
