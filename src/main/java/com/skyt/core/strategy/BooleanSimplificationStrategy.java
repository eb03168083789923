package com.skyt.core.strategy;

import com.github.javaparser.ast.expr.BinaryExpr;
import com.skyt.core.explain.DifferenceType;
import com.skyt.core.explain.PropertyDifference;
import com.skyt.core.explain.TransformationHints;
import com.skyt.core.parse.LogicalForms;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.parse.Precedence;
import com.skyt.core.parse.SourceParser;

import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.List;

/** Drops comparisons against boolean literals: {@code b == true} → {@code b}, {@code b == false} → {@code !b}. */
@Component
public class BooleanSimplificationStrategy extends AbstractAstStrategy {

    public BooleanSimplificationStrategy(SourceParser parser) {
        super("boolean-simplification", parser, DifferenceType.BOOLEAN_REDUNDANCY);
    }

    @Override
    protected boolean rewrite(ParsedSource parsed, TransformationHints hints, PropertyDifference difference) {
        List<BinaryExpr> comparisons = parsed.getCompilationUnit().findAll(BinaryExpr.class);
        // innermost first, so an outer comparison sees its already simplified operand
        Collections.reverse(comparisons);

        boolean changed = false;
        for (BinaryExpr bin : comparisons) {
            if (!LogicalForms.isBooleanLiteralComparison(bin)) continue;
            Precedence.splice(bin, LogicalForms.simplifyBooleanComparison(bin));
            changed = true;
        }
        return changed;
    }
}
