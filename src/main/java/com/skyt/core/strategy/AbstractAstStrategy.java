package com.skyt.core.strategy;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.property.PropertyKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Parse, edit the tree in place, print. Subclasses implement {@link #rewrite}
 * and report whether they changed anything.
 */
public abstract class AbstractAstStrategy implements TransformationStrategy {

    private final String              name;
    private final PropertyKind        kind;
    private final Set<DifferenceType> handled;
    protected final SourceParser      parser;

    protected AbstractAstStrategy(String name, SourceParser parser, DifferenceType first, DifferenceType... rest) {
        this.name    = name;
        this.parser  = parser;
        this.handled = EnumSet.of(first, rest);
        this.kind    = first.getKind();
        for (DifferenceType type : handled) {
            if (type.getKind() != kind) {
                throw new IllegalArgumentException(name + " mixes property kinds: " + handled);
            }
        }
    }

    @Override public String       getName()         { return name; }
    @Override public PropertyKind getPropertyKind() { return kind; }

    @Override
    public boolean canHandle(DifferenceType type) {
        return handled.contains(type);
    }

    @Override
    public final String generate(PropertyDifference difference, String source) {
        if (difference == null || !canHandle(difference.getType())) return null;
        ParsedSource parsed = parser.parse(source);
        if (parsed == null) return null;
        if (!rewrite(parsed, difference.getHints(), difference)) return null;
        return parsed.print();
    }

    /** Edits {@code parsed} in place; false when nothing applied. */
    protected abstract boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference);

    // =========================================================================
    // Helpers for subclasses
    // =========================================================================

    protected static MethodDeclaration hintedMethod(ParsedSource parsed, TransformationHints hints, String key) {
        String method = hints.getString(key);
        return method == null ? parsed.primaryMethod() : parsed.findMethod(method);
    }

    /**
     * Adds {@code import qualifiedName;} to a full compilation unit that lacks
     * it. Wrapped fragments compile with the java.util packages on demand.
     */
    protected static void ensureImport(ParsedSource parsed, String qualifiedName) {
        if (parsed.isWrapped()) return;
        CompilationUnit unit = parsed.getCompilationUnit();
        String pkg = qualifiedName.substring(0, qualifiedName.lastIndexOf('.'));
        for (ImportDeclaration existing : unit.getImports()) {
            if (existing.isStatic()) continue;
            String imported = existing.getNameAsString();
            if (existing.isAsterisk() ? imported.equals(pkg) : imported.equals(qualifiedName)) return;
        }
        unit.addImport(qualifiedName);
    }
}
