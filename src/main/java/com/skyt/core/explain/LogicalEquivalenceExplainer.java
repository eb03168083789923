package com.skyt.core.explain;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.skyt.core.parse.LogicalForms;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;
import com.skyt.core.property.RecordValue;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Emptiness written as a size comparison where the canon calls
 * {@code isEmpty()} (or the reverse), and comparisons against boolean
 * literals the canon does not make.
 */
@Component
public class LogicalEquivalenceExplainer implements PropertyExplainer {

    public static final String HINT_TARGET_FORM = "targetForm";
    public static final String HINT_SIZE_METHOD = "sizeMethod";
    public static final String HINT_SCOPES      = "scopes";
    public static final String HINT_COUNT       = "count";

    public static final String FORM_IS_EMPTY     = "is-empty";
    public static final String FORM_SIZE_COMPARE = "size-compare";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.LOGICAL_EQUIVALENCE;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        if (!(candidateValue instanceof RecordValue) || !(canonValue instanceof RecordValue)) {
            return null;
        }
        RecordValue candidate = (RecordValue) candidateValue;
        RecordValue canon     = (RecordValue) canonValue;

        PropertyDifference emptiness = explainEmptiness(candidate, canon, context);
        if (emptiness != null) {
            return emptiness;
        }

        long extra = candidate.getLong("booleanLiteralComparisons") - canon.getLong("booleanLiteralComparisons");
        if (extra > 0) {
            return PropertyDifference.builder(DifferenceType.BOOLEAN_REDUNDANCY)
                    .explanation(extra + " redundant comparison(s) against a boolean literal")
                    .hints(TransformationHints.builder().put(HINT_COUNT, (int) extra).build())
                    .candidateDetail(candidate.toString())
                    .canonDetail(canon.toString())
                    .build();
        }
        return null;
    }

    private PropertyDifference explainEmptiness(RecordValue candidate, RecordValue canon,
                                                ExplanationContext context) {
        String candidateForm = candidate.getString("emptinessForm");
        String canonForm     = canon.getString("emptinessForm");
        if (candidateForm == null || candidateForm.equals(canonForm)) {
            return null;
        }

        if (FORM_IS_EMPTY.equals(canonForm) && usesSizeCompare(candidateForm)) {
            List<String> scopes = new ArrayList<>(sizeComparisonScopes(context.getCandidate()));
            return emptinessDifference(FORM_IS_EMPTY, null, scopes, candidateForm, canonForm);
        }

        if (FORM_SIZE_COMPARE.equals(canonForm) && usesIsEmpty(candidateForm)) {
            String sizeMethod = firstSizeMethod(context.getCanon());
            if (sizeMethod == null) return null;
            List<String> scopes = new ArrayList<>(isEmptyScopes(context.getCandidate()));
            return emptinessDifference(FORM_SIZE_COMPARE, sizeMethod, scopes, candidateForm, canonForm);
        }
        return null;
    }

    private PropertyDifference emptinessDifference(String targetForm, String sizeMethod, List<String> scopes,
                                                   String candidateForm, String canonForm) {
        if (scopes.isEmpty()) return null;
        TransformationHints.Builder hints = TransformationHints.builder()
                .put(HINT_TARGET_FORM, targetForm)
                .putList(HINT_SCOPES, scopes);
        if (sizeMethod != null) hints.put(HINT_SIZE_METHOD, sizeMethod);

        return PropertyDifference.builder(DifferenceType.EMPTY_CHECK_FORM)
                .explanation("Emptiness of " + scopes + " is checked as " + candidateForm
                        + "; canon uses " + canonForm)
                .hints(hints.build())
                .candidateDetail(candidateForm)
                .canonDetail(canonForm)
                .build();
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private static boolean usesSizeCompare(String form) {
        return FORM_SIZE_COMPARE.equals(form) || "mixed".equals(form);
    }

    private static boolean usesIsEmpty(String form) {
        return FORM_IS_EMPTY.equals(form) || "mixed".equals(form);
    }

    private static Set<String> sizeComparisonScopes(ParsedSource source) {
        Set<String> scopes = new LinkedHashSet<>();
        for (BinaryExpr bin : source.getCompilationUnit().findAll(BinaryExpr.class)) {
            LogicalForms.SizeComparison comparison = LogicalForms.sizeComparison(bin);
            if (comparison != null) scopes.add(comparison.getScope().toString());
        }
        return scopes;
    }

    private static Set<String> isEmptyScopes(ParsedSource source) {
        Set<String> scopes = new LinkedHashSet<>();
        for (MethodCallExpr call : source.getCompilationUnit().findAll(MethodCallExpr.class)) {
            if (LogicalForms.isEmptinessCall(call)) scopes.add(call.getScope().get().toString());
        }
        return scopes;
    }

    private static String firstSizeMethod(ParsedSource source) {
        for (BinaryExpr bin : source.getCompilationUnit().findAll(BinaryExpr.class)) {
            LogicalForms.SizeComparison comparison = LogicalForms.sizeComparison(bin);
            if (comparison != null) return comparison.getSizeMethod();
        }
        return null;
    }
}
