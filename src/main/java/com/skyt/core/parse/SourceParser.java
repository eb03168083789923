package com.skyt.core.parse;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.Statement;

import org.springframework.stereotype.Component;

/**
 * SourceParser: turns Java source text into a {@link ParsedSource}.
 *
 * Two shapes are accepted:
 *   1. A full compilation unit with at least one type declaration.
 *   2. A bare sequence of members (usually one or more methods). These are
 *      wrapped in a synthetic holder class named {@value #HOLDER_CLASS}.
 *
 * Returns null when neither shape parses. Callers treat null as ParseFailure;
 * this class never throws on bad input.
 *
 * Comments are not attributed to nodes, so printed trees carry no comments.
 */
@Component
public class SourceParser {

    public static final String HOLDER_CLASS = "SkytFragment";

    private final ParserConfiguration configuration;

    public SourceParser() {
        this.configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setAttributeComments(false);
    }

    // =========================================================================
    // Fragments
    // =========================================================================

    public ParsedSource parse(String source) {
        if (source == null || source.isBlank()) {
            return null;
        }

        CompilationUnit unit = parseUnit(source);
        if (unit != null && !unit.getTypes().isEmpty()) {
            return ParsedSource.unit(source, unit);
        }

        CompilationUnit wrapped = parseUnit("class " + HOLDER_CLASS + " {\n" + source + "\n}");
        if (wrapped != null) {
            return ParsedSource.wrapped(source, wrapped);
        }
        return null;
    }

    public boolean isParseable(String source) {
        return parse(source) != null;
    }

    // =========================================================================
    // Snippets used by strategies when building replacement nodes
    // =========================================================================

    public Expression parseExpression(String text) {
        ParseResult<Expression> result = newParser().parseExpression(text);
        return result.isSuccessful() ? result.getResult().orElse(null) : null;
    }

    public Statement parseStatement(String text) {
        ParseResult<Statement> result = newParser().parseStatement(text);
        return result.isSuccessful() ? result.getResult().orElse(null) : null;
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private CompilationUnit parseUnit(String text) {
        ParseResult<CompilationUnit> result = newParser().parse(text);
        if (!result.isSuccessful()) {
            return null;
        }
        return result.getResult().orElse(null);
    }

    private JavaParser newParser() {
        return new JavaParser(configuration);
    }
}
