package com.skyt.core.extract;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.NameExpr;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.StructureHashPair;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hashes the printed tree twice: as written, and after alpha-normalization.
 *
 * Alpha-normalization renames every parameter and local of each method to
 * {@code v0, v1, ...} in order of first declaration. Method names, fields and
 * types keep their names.
 */
final class StructureHasher {

    StructureHashPair hash(ParsedSource source) {
        CompilationUnit unit = source.getCompilationUnit();
        String literal  = sha256(unit.toString());
        String invariant = sha256(alphaNormalize(unit).toString());
        return new StructureHashPair(literal, invariant);
    }

    /** A normalized copy; the input tree is not modified. */
    static CompilationUnit alphaNormalize(CompilationUnit unit) {
        CompilationUnit copy = unit.clone();
        for (MethodDeclaration method : copy.findAll(MethodDeclaration.class)) {
            Map<String, String> renames = new LinkedHashMap<>();
            for (Parameter p : method.getParameters()) {
                renames.putIfAbsent(p.getNameAsString(), "v" + renames.size());
            }
            method.getBody().ifPresent(body -> body.walk(node -> {
                if (node instanceof VariableDeclarator) {
                    renames.putIfAbsent(((VariableDeclarator) node).getNameAsString(), "v" + renames.size());
                } else if (node instanceof Parameter) {
                    renames.putIfAbsent(((Parameter) node).getNameAsString(), "v" + renames.size());
                }
            }));
            if (renames.isEmpty()) continue;

            Map<String, String> lookup = new HashMap<>(renames);
            method.walk(node -> {
                if (node instanceof Parameter) {
                    Parameter p = (Parameter) node;
                    p.setName(lookup.getOrDefault(p.getNameAsString(), p.getNameAsString()));
                } else if (node instanceof VariableDeclarator) {
                    VariableDeclarator v = (VariableDeclarator) node;
                    v.setName(lookup.getOrDefault(v.getNameAsString(), v.getNameAsString()));
                } else if (node instanceof NameExpr) {
                    NameExpr n = (NameExpr) node;
                    n.setName(lookup.getOrDefault(n.getNameAsString(), n.getNameAsString()));
                }
            });
        }
        return copy;
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] bytes = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(bytes.length * 2);
            for (byte b : bytes) {
                hex.append(String.format("%02x", b));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
