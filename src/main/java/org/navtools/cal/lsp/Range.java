package org.navtools.cal.lsp;

/**
 * Zero-based editor range. The end position is exclusive.
 */
public record Range(int startLine, int startCharacter, int endLine, int endCharacter) {
}
