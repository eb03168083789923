package com.skyt.core.validate;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.EnumConstantDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.type.TypeParameter;
import com.skyt.core.parse.ParsedSource;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Finds names a rewrite introduces without binding them.
 *
 * A name is free when it is read as a plain expression (or called as an
 * unqualified method) and no declaration whose scope encloses the read binds
 * it: a local declared in a sibling method does not count. The check is
 * a difference: names already free before the rewrite (inherited fields,
 * helpers supplied by the caller) are tolerated, as are the well-known JDK
 * types strategies emit.
 */
@Component
public class UnboundIdentifierChecker {

    static final Set<String> BUILTINS = Set.of(
            "Math", "String", "Integer", "Long", "Double", "Float", "Short", "Byte",
            "Boolean", "Character", "Object", "System", "Arrays", "Collections", "Collectors",
            "List", "Map", "Set", "ArrayList", "HashMap", "HashSet", "LinkedList", "LinkedHashMap",
            "Objects", "Stream", "IntStream", "LongStream", "DoubleStream", "StringBuilder",
            "Comparator", "Pattern", "Optional", "Deque", "ArrayDeque", "Stack", "TreeMap",
            "PriorityQueue");

    /** Names free in {@code after} that were not free in {@code before}, builtins excluded. */
    public Set<String> introducedNames(ParsedSource before, ParsedSource after) {
        Set<String> introduced = freeNames(after);
        introduced.removeAll(freeNames(before));
        introduced.removeAll(BUILTINS);
        return introduced;
    }

    /** Free names of the fragment; unqualified method calls appear as {@code name()}. */
    public Set<String> freeNames(ParsedSource source) {
        CompilationUnit unit = source.getCompilationUnit();
        Set<String> global = globalNames(unit);
        Map<String, Set<Node>> scopes = scopedDeclarations(unit);
        Set<String> methods = new TreeSet<>();
        for (MethodDeclaration method : unit.findAll(MethodDeclaration.class)) {
            methods.add(method.getNameAsString());
        }

        Set<String> free = new TreeSet<>();
        for (NameExpr name : unit.findAll(NameExpr.class)) {
            String identifier = name.getNameAsString();
            if (!global.contains(identifier) && !isInScope(name, scopes.get(identifier))) free.add(identifier);
        }
        for (MethodCallExpr call : unit.findAll(MethodCallExpr.class)) {
            if (call.getScope().isEmpty() && !methods.contains(call.getNameAsString())) {
                free.add(call.getNameAsString() + "()");
            }
        }
        return free;
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    /** Type names, type parameters and single-type imports: visible everywhere in the fragment. */
    private static Set<String> globalNames(CompilationUnit unit) {
        Set<String> declared = new TreeSet<>();
        unit.findAll(TypeParameter.class).forEach(t -> declared.add(t.getNameAsString()));
        for (TypeDeclaration<?> type : unit.findAll(TypeDeclaration.class)) {
            declared.add(type.getNameAsString());
        }
        for (ImportDeclaration imported : unit.getImports()) {
            if (imported.isAsterisk()) continue;
            String name = imported.getNameAsString();
            declared.add(name.substring(name.lastIndexOf('.') + 1));
        }
        return declared;
    }

    /** For each declared variable name, the nodes whose subtrees the declarations reach. */
    private static Map<String, Set<Node>> scopedDeclarations(CompilationUnit unit) {
        Map<String, Set<Node>> scopes = new HashMap<>();
        for (VariableDeclarator variable : unit.findAll(VariableDeclarator.class)) {
            bind(scopes, variable.getNameAsString(), scopeOf(variable), unit);
        }
        for (Parameter parameter : unit.findAll(Parameter.class)) {
            bind(scopes, parameter.getNameAsString(), parameter.getParentNode().orElse(null), unit);
        }
        for (EnumConstantDeclaration constant : unit.findAll(EnumConstantDeclaration.class)) {
            bind(scopes, constant.getNameAsString(), constant.getParentNode().orElse(null), unit);
        }
        return scopes;
    }

    private static void bind(Map<String, Set<Node>> scopes, String name, Node scope, CompilationUnit unit) {
        scopes.computeIfAbsent(name, k -> Collections.newSetFromMap(new IdentityHashMap<>()))
                .add(scope != null ? scope : unit);
    }

    /**
     * Fields reach their whole type; locals reach the enclosing block (or
     * switch); for, for-each and try-resource variables reach their statement.
     */
    private static Node scopeOf(VariableDeclarator variable) {
        Node parent = variable.getParentNode().orElse(null);
        if (parent instanceof FieldDeclaration) {
            return parent.getParentNode().orElse(null);
        }
        if (!(parent instanceof VariableDeclarationExpr)) return parent;
        Node holder = parent.getParentNode().orElse(null);
        if (!(holder instanceof ExpressionStmt)) return holder;
        Node block = holder.getParentNode().orElse(null);
        if (block instanceof SwitchEntry) {
            return block.getParentNode().orElse(block);
        }
        return block;
    }

    private static boolean isInScope(Node use, Set<Node> scopes) {
        if (scopes == null) return false;
        for (Node node = use; node != null; node = node.getParentNode().orElse(null)) {
            if (scopes.contains(node)) return true;
        }
        return false;
    }
}
