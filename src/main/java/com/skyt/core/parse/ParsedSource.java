package com.skyt.core.parse;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parsed Java fragment plus the shape it was parsed as.
 *
 * Wrapped fragments live inside a synthetic holder class; {@link #print()}
 * renders only the holder's members so callers get back the shape they
 * passed in. The tree is mutable: strategies edit it in place and print it.
 */
public final class ParsedSource {

    private static final String WRAPPED_IMPORTS =
            "import java.util.*;\nimport java.util.function.*;\nimport java.util.stream.*;\n\n";

    private final String          originalText;
    private final CompilationUnit unit;
    private final boolean         wrapped;

    private ParsedSource(String originalText, CompilationUnit unit, boolean wrapped) {
        this.originalText = originalText;
        this.unit         = unit;
        this.wrapped      = wrapped;
    }

    static ParsedSource unit(String originalText, CompilationUnit unit) {
        return new ParsedSource(originalText, unit, false);
    }

    static ParsedSource wrapped(String originalText, CompilationUnit unit) {
        return new ParsedSource(originalText, unit, true);
    }

    // =========================================================================
    // Accessors
    // =========================================================================

    public String          getOriginalText()    { return originalText; }
    public CompilationUnit getCompilationUnit() { return unit; }
    public boolean         isWrapped()          { return wrapped; }

    /** All method declarations in pre-order, nested types included. */
    public List<MethodDeclaration> getMethods() {
        return unit.findAll(MethodDeclaration.class);
    }

    public MethodDeclaration findMethod(String name) {
        if (name == null) return null;
        for (MethodDeclaration method : getMethods()) {
            if (method.getNameAsString().equals(name)) return method;
        }
        return null;
    }

    /** The first declared method, or null for a fragment with none. */
    public MethodDeclaration primaryMethod() {
        List<MethodDeclaration> methods = getMethods();
        return methods.isEmpty() ? null : methods.get(0);
    }

    /** The type that owns fragment-level members: the holder when wrapped, else the first type. */
    public TypeDeclaration<?> primaryType() {
        return unit.getTypes().isEmpty() ? null : unit.getType(0);
    }

    /**
     * Number of fragment-level definitions: members of the holder when wrapped,
     * top-level types otherwise.
     */
    public int topLevelDefinitionCount() {
        if (!wrapped) {
            return unit.getTypes().size();
        }
        TypeDeclaration<?> holder = primaryType();
        if (holder == null) return 0;
        int count = 0;
        for (BodyDeclaration<?> member : holder.getMembers()) {
            if (member.isMethodDeclaration() || member.isTypeDeclaration()) count++;
        }
        return count;
    }

    // =========================================================================
    // Rendering
    // =========================================================================

    /** Source text in the fragment's own shape. */
    public String print() {
        if (!wrapped) {
            return unit.toString();
        }
        TypeDeclaration<?> holder = primaryType();
        return holder.getMembers().stream()
                .map(Node::toString)
                .collect(Collectors.joining("\n\n"));
    }

    /** A standalone compilation unit that javac accepts. */
    public String compilableSource() {
        if (!wrapped) {
            return unit.toString();
        }
        return WRAPPED_IMPORTS + "public class " + SourceParser.HOLDER_CLASS + " {\n\n" + print() + "\n}\n";
    }

    /** Binary name of the type that holds the fragment's methods once compiled. */
    public String binaryTypeName() {
        if (wrapped) {
            return SourceParser.HOLDER_CLASS;
        }
        TypeDeclaration<?> type = primaryType();
        String simple = type == null ? SourceParser.HOLDER_CLASS : type.getNameAsString();
        return unit.getPackageDeclaration()
                .map(p -> p.getNameAsString() + "." + simple)
                .orElse(simple);
    }

    /** File name javac expects for {@link #compilableSource()}. */
    public String compilationFileName() {
        if (wrapped) {
            return SourceParser.HOLDER_CLASS;
        }
        for (TypeDeclaration<?> type : unit.getTypes()) {
            if (type.isPublic()) return type.getNameAsString();
        }
        TypeDeclaration<?> type = primaryType();
        return type == null ? SourceParser.HOLDER_CLASS : type.getNameAsString();
    }

    @Override
    public String toString() {
        return "ParsedSource{wrapped=" + wrapped + ", methods=" + getMethods().size() + "}";
    }
}
