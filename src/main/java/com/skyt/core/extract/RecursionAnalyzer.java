package com.skyt.core.extract;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.RecursionSchema;

/**
 * Recursion schema of the fragment's primary recursive method: the method
 * with the most self-call sites, earliest on ties.
 */
final class RecursionAnalyzer {

    RecursionSchema schema(ParsedSource source) {
        MethodDeclaration primary = null;
        int               mostCalls = 0;
        for (MethodDeclaration method : source.getMethods()) {
            int calls = AstQueries.selfCalls(method).size();
            if (calls > mostCalls) {
                primary   = method;
                mostCalls = calls;
            }
        }
        if (primary == null || primary.getBody().isEmpty()) {
            return RecursionSchema.nonRecursive();
        }

        int callsOnPath = AstQueries.selfCallsOnPath(primary.getBody().get(), primary);
        RecursionSchema.Branching branching = RecursionSchema.Branching.fromCallsPerPath(callsOnPath);

        int baseCases = 0;
        for (ReturnStmt ret : primary.findAll(ReturnStmt.class)) {
            if (AstQueries.isInNestedScope(ret, primary)) continue;
            if (!AstQueries.containsSelfCall(ret, primary)) baseCases++;
        }

        boolean divideAndConquer = branching.ordinal() >= RecursionSchema.Branching.BINARY.ordinal()
                && AstQueries.containsHalving(primary);

        return new RecursionSchema(true, branching, baseCases, mostCalls, divideAndConquer);
    }
}
