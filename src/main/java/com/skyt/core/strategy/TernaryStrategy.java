package com.skyt.core.strategy;

import com.github.javaparser.ast.body.MethodDeclaration;
import com.skyt.core.explain.ControlFlowExplainer;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.SourceParser;
import com.skyt.core.parse.TernaryForms;

import org.springframework.stereotype.Component;

import java.util.List;

/** Collapses an if/else that returns or assigns in both branches into a conditional expression. */
@Component
public class TernaryStrategy extends AbstractAstStrategy {

    public TernaryStrategy(SourceParser parser) {
        super("ternary", parser, DifferenceType.IF_ELSE_VS_TERNARY);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        MethodDeclaration method = hintedMethod(parsed, hints, ControlFlowExplainer.HINT_METHOD);
        if (method == null) return false;

        List<TernaryForms.Site> sites = TernaryForms.find(method);
        TernaryForms.Site site = pick(sites,
                hints.getString(ControlFlowExplainer.HINT_CONDITION),
                hints.getString(ControlFlowExplainer.HINT_FORM));
        if (site == null) return false;

        site.rewrite();
        return true;
    }

    private static TernaryForms.Site pick(List<TernaryForms.Site> sites, String condition, String form) {
        if (sites.isEmpty()) return null;
        if (condition != null) {
            for (TernaryForms.Site site : sites) {
                if (site.getCondition().equals(condition)) return site;
            }
        }
        if (form != null) {
            for (TernaryForms.Site site : sites) {
                if (site.getForm().name().equals(form)) return site;
            }
        }
        return sites.get(0);
    }
}
