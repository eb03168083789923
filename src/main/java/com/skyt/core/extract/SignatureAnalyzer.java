package com.skyt.core.extract;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.RecordValue;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/** Function contracts: names, arity, parameter and return types, modifiers, throws clauses. */
final class SignatureAnalyzer {

    RecordValue functionContracts(ParsedSource source) {
        List<String> names      = new ArrayList<>();
        List<String> arities    = new ArrayList<>();
        List<String> returns    = new ArrayList<>();
        List<String> paramTypes = new ArrayList<>();
        List<String> paramNames = new ArrayList<>();
        List<String> modifiers  = new ArrayList<>();
        List<String> throwsList = new ArrayList<>();

        for (MethodDeclaration method : source.getMethods()) {
            names.add(method.getNameAsString());
            arities.add(String.valueOf(method.getParameters().size()));
            returns.add(method.getType().asString());
            paramTypes.add(method.getParameters().stream()
                    .map(p -> p.getType().asString() + (p.isVarArgs() ? "..." : ""))
                    .collect(Collectors.joining(",")));
            paramNames.add(method.getParameters().stream()
                    .map(Parameter::getNameAsString)
                    .collect(Collectors.joining(",")));
            modifiers.add(method.getModifiers().stream()
                    .map(Modifier::getKeyword)
                    .map(k -> k.asString())
                    .sorted()
                    .collect(Collectors.joining(",")));
            throwsList.add(method.getThrownExceptions().stream()
                    .map(t -> t.asString())
                    .collect(Collectors.joining(",")));
        }

        return RecordValue.builder()
                .put("methods",    names.size())
                .put("names",      String.join(";", names))
                .put("arities",    String.join(";", arities))
                .put("returns",    String.join(";", returns))
                .put("paramTypes", String.join(";", paramTypes))
                .put("paramNames", String.join(";", paramNames))
                .put("modifiers",  String.join(";", modifiers))
                .put("throws",     String.join(";", throwsList))
                .build();
    }
}
