package com.skyt.core.extract;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.DoubleLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.IntegerLiteralExpr;
import com.github.javaparser.ast.expr.LongLiteralExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.type.Type;
import com.skyt.core.parse.LogicalForms;
import com.skyt.core.parse.ParsedSource;
import com.skyt.core.property.RecordValue;
import com.skyt.core.property.SequenceValue;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Expression-level facets: arithmetic operators, numeric behavior, boolean
 * logic, explicit precedence shapes and string literals.
 */
final class ExpressionAnalyzer {

    private static final Set<BinaryExpr.Operator> ARITHMETIC = EnumSet.of(
            BinaryExpr.Operator.PLUS, BinaryExpr.Operator.MINUS, BinaryExpr.Operator.MULTIPLY,
            BinaryExpr.Operator.DIVIDE, BinaryExpr.Operator.REMAINDER,
            BinaryExpr.Operator.BINARY_AND, BinaryExpr.Operator.BINARY_OR, BinaryExpr.Operator.XOR,
            BinaryExpr.Operator.LEFT_SHIFT, BinaryExpr.Operator.SIGNED_RIGHT_SHIFT,
            BinaryExpr.Operator.UNSIGNED_RIGHT_SHIFT);

    private static final Set<BinaryExpr.Operator> COMPARISONS = EnumSet.of(
            BinaryExpr.Operator.EQUALS, BinaryExpr.Operator.NOT_EQUALS,
            BinaryExpr.Operator.LESS, BinaryExpr.Operator.LESS_EQUALS,
            BinaryExpr.Operator.GREATER, BinaryExpr.Operator.GREATER_EQUALS);

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "byte", "short", "int", "long", "float", "double", "char",
            "Byte", "Short", "Integer", "Long", "Float", "Double", "Character");

    // =========================================================================
    // Algebraic structure
    // =========================================================================

    SequenceValue algebraicStructure(ParsedSource source) {
        List<String> ops = new ArrayList<>();
        source.getCompilationUnit().walk(node -> {
            if (node instanceof BinaryExpr) {
                BinaryExpr.Operator op = ((BinaryExpr) node).getOperator();
                if (ARITHMETIC.contains(op)) ops.add(op.asString());
            } else if (node instanceof AssignExpr) {
                ((AssignExpr) node).getOperator().toBinaryOperator()
                        .ifPresent(op -> ops.add(op.asString()));
            } else if (node instanceof UnaryExpr) {
                UnaryExpr.Operator op = ((UnaryExpr) node).getOperator();
                if (op != UnaryExpr.Operator.LOGICAL_COMPLEMENT) ops.add(op.asString());
            }
        });
        return SequenceValue.of(ops);
    }

    // =========================================================================
    // Numerical behavior
    // =========================================================================

    RecordValue numericalBehavior(ParsedSource source) {
        Node root = source.getCompilationUnit();

        int divisions = 0;
        int modulos   = 0;
        for (BinaryExpr bin : root.findAll(BinaryExpr.class)) {
            if (bin.getOperator() == BinaryExpr.Operator.DIVIDE)    divisions++;
            if (bin.getOperator() == BinaryExpr.Operator.REMAINDER) modulos++;
        }
        for (AssignExpr assign : root.findAll(AssignExpr.class)) {
            if (assign.getOperator() == AssignExpr.Operator.DIVIDE)    divisions++;
            if (assign.getOperator() == AssignExpr.Operator.REMAINDER) modulos++;
        }

        List<String> mathCalls = new ArrayList<>();
        for (MethodCallExpr call : root.findAll(MethodCallExpr.class)) {
            if (call.getScope().isPresent() && call.getScope().get().isNameExpr()
                    && call.getScope().get().asNameExpr().getNameAsString().equals("Math")) {
                mathCalls.add(call.getNameAsString());
            }
        }

        Set<String> numericTypes = new TreeSet<>();
        for (MethodDeclaration method : source.getMethods()) {
            collectNumeric(method.getType(), numericTypes);
            for (Parameter p : method.getParameters()) collectNumeric(p.getType(), numericTypes);
        }
        for (VariableDeclarator v : root.findAll(VariableDeclarator.class)) {
            collectNumeric(v.getType(), numericTypes);
        }

        return RecordValue.builder()
                .put("integerLiterals",  root.findAll(IntegerLiteralExpr.class).size())
                .put("longLiterals",     root.findAll(LongLiteralExpr.class).size())
                .put("floatingLiterals", root.findAll(DoubleLiteralExpr.class).size())
                .put("divisions",        divisions)
                .put("modulos",          modulos)
                .put("casts",            root.findAll(CastExpr.class).size())
                .put("mathCalls",        String.join(",", mathCalls))
                .put("numericTypes",     String.join(",", numericTypes))
                .build();
    }

    private static void collectNumeric(Type type, Set<String> into) {
        Type element = type.getElementType();
        String name = element.isClassOrInterfaceType()
                ? element.asClassOrInterfaceType().getNameAsString()
                : element.asString();
        if (NUMERIC_TYPES.contains(name)) into.add(name);
    }

    // =========================================================================
    // Logical equivalence
    // =========================================================================

    RecordValue logicalForm(ParsedSource source) {
        Node root = source.getCompilationUnit();

        int conjunctions = 0;
        int disjunctions = 0;
        int comparisons  = 0;
        int literalComparisons = 0;
        int sizeCompares = 0;
        for (BinaryExpr bin : root.findAll(BinaryExpr.class)) {
            BinaryExpr.Operator op = bin.getOperator();
            if (op == BinaryExpr.Operator.AND) conjunctions++;
            if (op == BinaryExpr.Operator.OR)  disjunctions++;
            if (COMPARISONS.contains(op))      comparisons++;
            if (LogicalForms.isBooleanLiteralComparison(bin)) literalComparisons++;
            if (LogicalForms.sizeComparisonScope(bin) != null) sizeCompares++;
        }

        int negations = 0;
        for (UnaryExpr unary : root.findAll(UnaryExpr.class)) {
            if (unary.getOperator() == UnaryExpr.Operator.LOGICAL_COMPLEMENT) negations++;
        }

        int isEmptyCalls = 0;
        for (MethodCallExpr call : root.findAll(MethodCallExpr.class)) {
            if (LogicalForms.isEmptinessCall(call)) isEmptyCalls++;
        }

        return RecordValue.builder()
                .put("conjunctions",              conjunctions)
                .put("disjunctions",              disjunctions)
                .put("negations",                 negations)
                .put("comparisons",               comparisons)
                .put("booleanLiteralComparisons", literalComparisons)
                .put("emptinessForm",             emptinessForm(isEmptyCalls, sizeCompares))
                .build();
    }

    private static String emptinessForm(int isEmptyCalls, int sizeCompares) {
        if (isEmptyCalls > 0 && sizeCompares > 0) return "mixed";
        if (isEmptyCalls > 0)                     return "is-empty";
        if (sizeCompares > 0)                     return "size-compare";
        return "none";
    }

    // =========================================================================
    // Operator precedence
    // =========================================================================

    /**
     * Shape of every maximal binary-operator tree with explicit parentheses kept,
     * operands erased: {@code (a + b) * c} becomes {@code (_+_)*_}.
     */
    SequenceValue operatorPrecedence(ParsedSource source) {
        List<String> shapes = new ArrayList<>();
        for (BinaryExpr bin : source.getCompilationUnit().findAll(BinaryExpr.class)) {
            if (isNestedOperand(bin)) continue;
            shapes.add(shape(bin));
        }
        return SequenceValue.of(shapes);
    }

    private static boolean isNestedOperand(BinaryExpr bin) {
        Node parent = bin.getParentNode().orElse(null);
        if (parent instanceof BinaryExpr) return true;
        if (parent instanceof EnclosedExpr) {
            return parent.getParentNode().orElse(null) instanceof BinaryExpr;
        }
        return false;
    }

    private static String shape(Expression expr) {
        if (expr.isBinaryExpr()) {
            BinaryExpr bin = expr.asBinaryExpr();
            return shape(bin.getLeft()) + bin.getOperator().asString() + shape(bin.getRight());
        }
        if (expr.isEnclosedExpr() && expr.asEnclosedExpr().getInner().isBinaryExpr()) {
            return "(" + shape(expr.asEnclosedExpr().getInner()) + ")";
        }
        return "_";
    }

    // =========================================================================
    // String literals
    // =========================================================================

    SequenceValue stringLiterals(ParsedSource source) {
        List<String> literals = new ArrayList<>();
        for (StringLiteralExpr literal : source.getCompilationUnit().findAll(StringLiteralExpr.class)) {
            literals.add(literal.getValue());
        }
        return SequenceValue.of(literals);
    }
}
