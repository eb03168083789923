package com.skyt.core.strategy;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;

import java.util.Map;

/**
 * Renames parameters and locals of one method together with every plain name
 * reference to them. References inside a nested class body that declares the
 * same name are left alone.
 */
final class IdentifierRenamer {

    private IdentifierRenamer() {}

    /** Applies {@code renames} simultaneously; returns the number of nodes changed. */
    static int rename(MethodDeclaration method, Map<String, String> renames) {
        int changed = 0;
        for (Parameter parameter : method.findAll(Parameter.class)) {
            String target = renames.get(parameter.getNameAsString());
            if (target != null && !shadowed(parameter, method, parameter.getNameAsString())) {
                parameter.setName(target);
                changed++;
            }
        }
        for (VariableDeclarator variable : method.findAll(VariableDeclarator.class)) {
            String target = renames.get(variable.getNameAsString());
            if (target != null && !shadowed(variable, method, variable.getNameAsString())) {
                variable.setName(target);
                changed++;
            }
        }
        for (NameExpr reference : method.findAll(NameExpr.class)) {
            String target = renames.get(reference.getNameAsString());
            if (target != null && !shadowed(reference, method, reference.getNameAsString())) {
                reference.setName(target);
                changed++;
            }
        }
        return changed;
    }

    private static boolean shadowed(Node node, MethodDeclaration method, String name) {
        Node current = node.getParentNode().orElse(null);
        while (current != null && current != method) {
            if (current instanceof TypeDeclaration && declares(current, name)) return true;
            if (current instanceof ObjectCreationExpr
                    && ((ObjectCreationExpr) current).getAnonymousClassBody().isPresent()
                    && declares(current, name)) {
                return true;
            }
            current = current.getParentNode().orElse(null);
        }
        return false;
    }

    private static boolean declares(Node scope, String name) {
        for (VariableDeclarator variable : scope.findAll(VariableDeclarator.class)) {
            if (variable.getNameAsString().equals(name)) return true;
        }
        for (Parameter parameter : scope.findAll(Parameter.class)) {
            if (parameter.getNameAsString().equals(name)) return true;
        }
        return false;
    }
}
