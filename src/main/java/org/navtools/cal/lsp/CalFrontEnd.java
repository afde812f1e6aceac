package org.navtools.cal.lsp;

import org.navtools.cal.dsl.CalLexer;
import org.navtools.cal.dsl.CalParser;
import org.navtools.cal.dsl.Token;
import org.navtools.cal.dsl.ast.Document;
import org.navtools.cal.symbols.SymbolTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Runs the lexer, parser and symbol table builder over one document text.
 *
 * Instances hold only settings and may be shared between threads. Each call works on fresh
 * lexer and parser instances.
 */
public final class CalFrontEnd {

    private static final Logger logger = LoggerFactory.getLogger(CalFrontEnd.class);

    private final CalSettings settings;
    private final DiagnosticConverter diagnostics;

    public CalFrontEnd() {
        this(CalSettings.load());
    }

    public CalFrontEnd(CalSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.diagnostics = new DiagnosticConverter(settings);
    }

    public CalSettings settings() {
        return settings;
    }

    public ParsedDocument parse(String text) {
        Objects.requireNonNull(text, "text");
        long started = System.nanoTime();

        List<Token> tokens = new CalLexer(text).tokenize();
        CalParser parser = new CalParser(tokens, settings.parsePropertyValues());
        Document document = parser.parse();
        SymbolTable symbols = SymbolTable.buildFromAst(document);

        ParsedDocument parsed = new ParsedDocument(tokens, document, symbols, parser.getErrors(),
                parser.getSkippedRegions());
        logger.debug("Parsed document of {} chars in {} us: {} tokens, {} error(s)", text.length(),
                (System.nanoTime() - started) / 1000, tokens.size(), parsed.errors().size());
        return parsed;
    }

    public List<Diagnostic> diagnostics(ParsedDocument parsed) {
        return diagnostics.convert(parsed.errors());
    }
}
