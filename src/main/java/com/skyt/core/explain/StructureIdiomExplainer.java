package com.skyt.core.explain;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.LoopIdioms;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;

import org.springframework.stereotype.Component;

/**
 * Structural idioms behind a differing structure hash: building a list in a
 * for-each loop where the canon streams, and concatenating a string in a loop
 * where the canon joins.
 */
@Component
public class StructureIdiomExplainer implements PropertyExplainer {

    public static final String HINT_METHOD          = "method";
    public static final String HINT_RESULT_VARIABLE = "resultVariable";
    public static final String HINT_USE_TO_LIST     = "useToList";
    public static final String HINT_ACCUMULATOR     = "accumulator";
    public static final String HINT_PREFER_JOIN     = "preferStringJoin";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.NORMALIZED_STRUCTURE;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        for (MethodPair pair : AstQueries.pairMethods(context.getCandidate(), context.getCanon())) {
            MethodDeclaration candidate = pair.getCandidate();
            MethodDeclaration canon     = pair.getCanon();
            if (loopCount(canon) >= loopCount(candidate)) continue;

            LoopIdioms.CollectLoop collect = LoopIdioms.findCollectLoop(candidate);
            if (collect != null && calls(canon, "stream")) {
                boolean useToList = callsToList(canon);
                return PropertyDifference.builder(DifferenceType.LOOP_VS_STREAM)
                        .explanation(String.format("%s builds '%s' in a for-each loop; canon uses a stream pipeline",
                                candidate.getNameAsString(), collect.getResultVariable()))
                        .hints(TransformationHints.builder()
                                .put(HINT_METHOD, candidate.getNameAsString())
                                .put(HINT_RESULT_VARIABLE, collect.getResultVariable())
                                .put(HINT_USE_TO_LIST, useToList)
                                .build())
                        .candidateDetail("for-each accumulation")
                        .canonDetail(useToList ? "stream().toList()" : "stream().collect(Collectors.toList())")
                        .build();
            }

            LoopIdioms.JoinLoop join = LoopIdioms.findJoinLoop(candidate);
            if (join != null && (calls(canon, "join") || calls(canon, "joining"))) {
                boolean preferJoin = callsStringJoin(canon);
                return PropertyDifference.builder(DifferenceType.STRING_BUILDING_IDIOM)
                        .explanation(String.format("%s concatenates into '%s' inside a loop; canon joins",
                                candidate.getNameAsString(), join.getAccumulator()))
                        .hints(TransformationHints.builder()
                                .put(HINT_METHOD, candidate.getNameAsString())
                                .put(HINT_ACCUMULATOR, join.getAccumulator())
                                .put(HINT_PREFER_JOIN, preferJoin)
                                .build())
                        .candidateDetail("incremental concatenation")
                        .canonDetail(preferJoin ? "String.join" : "Collectors.joining")
                        .build();
            }
        }
        return null;
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private static int loopCount(MethodDeclaration method) {
        return method.findAll(ForEachStmt.class).size() + method.findAll(ForStmt.class).size()
                + method.findAll(WhileStmt.class).size() + method.findAll(DoStmt.class).size();
    }

    private static boolean calls(MethodDeclaration method, String name) {
        return method.findAll(MethodCallExpr.class).stream().anyMatch(c -> c.getNameAsString().equals(name));
    }

    /** A JDK 16 {@code Stream.toList()}, not {@code Collectors.toList()}. */
    private static boolean callsToList(MethodDeclaration method) {
        return method.findAll(MethodCallExpr.class).stream()
                .anyMatch(c -> c.getNameAsString().equals("toList") && c.getArguments().isEmpty()
                        && c.getScope().isPresent()
                        && !AstQueries.isName(c.getScope().get(), "Collectors"));
    }

    private static boolean callsStringJoin(MethodDeclaration method) {
        return method.findAll(MethodCallExpr.class).stream()
                .anyMatch(c -> c.getNameAsString().equals("join")
                        && AstQueries.isName(c.getScope().orElse(null), "String"));
    }
}
