package com.skyt.core.explain;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.skyt.core.naming.NamingPolicy;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.ParsedSource;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Filters positional name correspondences through the naming policy and collision checks. */
final class RenameProposals {

    private RenameProposals() {}

    /**
     * Keeps the pairs the policy allows and that would not collide with a name
     * already declared in the method or as a field.
     */
    static Map<String, String> filter(List<String> from, List<String> to, MethodDeclaration method,
                                      ParsedSource source, NamingPolicy policy) {
        Set<String> taken = declaredNames(method);
        taken.addAll(AstQueries.fieldNames(source.getCompilationUnit()));

        Map<String, String> renames = new LinkedHashMap<>();
        Set<String> targets = new LinkedHashSet<>();
        for (int i = 0; i < Math.min(from.size(), to.size()); i++) {
            String name   = from.get(i);
            String target = to.get(i);
            if (name.equals(target) || renames.containsKey(name)) continue;
            if (!policy.allowsRename(name, target)) continue;
            if (taken.contains(target) || !targets.add(target)) continue;
            renames.put(name, target);
        }
        return renames;
    }

    static Set<String> declaredNames(MethodDeclaration method) {
        Set<String> names = new LinkedHashSet<>();
        for (Parameter p : method.findAll(Parameter.class)) names.add(p.getNameAsString());
        for (VariableDeclarator v : method.findAll(VariableDeclarator.class)) names.add(v.getNameAsString());
        return names;
    }

    static String describe(Map<String, String> renames) {
        StringBuilder text = new StringBuilder();
        renames.forEach((from, to) -> {
            if (text.length() > 0) text.append(", ");
            text.append(from).append(" -> ").append(to);
        });
        return text.toString();
    }
}
