package com.skyt.core.explain;

import com.skyt.core.parse.AstQueries;
import com.skyt.core.parse.MethodPair;
import com.skyt.core.parse.TernaryForms;
import com.skyt.core.property.PropertyKind;
import com.skyt.core.property.PropertyValue;
import com.skyt.core.property.RecordValue;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The candidate branches with if/else where the canon selects a value with a
 * conditional expression. Only fires when the candidate has more ifs and
 * fewer conditionals than the canon.
 */
@Component
public class ControlFlowExplainer implements PropertyExplainer {

    public static final String HINT_METHOD    = "method";
    public static final String HINT_FORM      = "form";
    public static final String HINT_CONDITION = "condition";

    @Override
    public PropertyKind getPropertyKind() {
        return PropertyKind.CONTROL_FLOW_SIGNATURE;
    }

    @Override
    public PropertyDifference explain(PropertyValue candidateValue, PropertyValue canonValue,
                                      ExplanationContext context) {
        if (!(candidateValue instanceof RecordValue) || !(canonValue instanceof RecordValue)) {
            return null;
        }
        RecordValue candidate = (RecordValue) candidateValue;
        RecordValue canon     = (RecordValue) canonValue;
        if (candidate.getLong("if") <= canon.getLong("if")
                || canon.getLong("ternary") <= candidate.getLong("ternary")) {
            return null;
        }

        for (MethodPair pair : AstQueries.pairMethods(context.getCandidate(), context.getCanon())) {
            List<TernaryForms.Site> sites = TernaryForms.find(pair.getCandidate());
            if (sites.isEmpty()) continue;

            TernaryForms.Site site = sites.get(0);
            String method = pair.getCandidate().getNameAsString();
            return PropertyDifference.builder(DifferenceType.IF_ELSE_VS_TERNARY)
                    .explanation(String.format("%s selects a value with if (%s); canon uses a conditional expression",
                            method, site.getCondition()))
                    .hints(TransformationHints.builder()
                            .put(HINT_METHOD, method)
                            .put(HINT_FORM, site.getForm().name())
                            .put(HINT_CONDITION, site.getCondition())
                            .build())
                    .candidateDetail("if=" + candidate.getLong("if") + ", ternary=" + candidate.getLong("ternary"))
                    .canonDetail("if=" + canon.getLong("if") + ", ternary=" + canon.getLong("ternary"))
                    .build();
        }
        return null;
    }
}
