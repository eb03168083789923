package com.skyt.core.parse;

import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.StringLiteralExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.type.UnknownType;

import java.util.List;
import java.util.Set;

/**
 * Accumulator loops that have a direct stream or join equivalent.
 *
 * <pre>
 *   List&lt;T&gt; out = new ArrayList&lt;&gt;();         String s = "";
 *   for (T x : src) {                       for (T x : src) {
 *       if (keep(x)) out.add(f(x));             s += f(x);
 *   }                                       }
 *   return out;                             return s;
 * </pre>
 *
 * Both shapes must be the last three statements of the method, and the
 * accumulator must not be used anywhere else.
 */
public final class LoopIdioms {

    private static final Set<String> LIST_FACTORIES = Set.of("ArrayList", "LinkedList");
    private static final Set<String> LIST_RETURNS   = Set.of("List", "Collection", "Iterable");
    private static final Set<String> STREAMABLE     = Set.of("List", "Collection", "Set", "ArrayList",
                                                             "LinkedList", "HashSet", "TreeSet", "LinkedHashSet");
    private static final Set<String> PRIMITIVE_STREAMS = Set.of("int", "long", "double");

    private LoopIdioms() {}

    // =========================================================================
    // Collect loops
    // =========================================================================

    /** {@code out.add(...)} inside a for-each, optionally behind an if without else. */
    public static final class CollectLoop {
        private final Statement   declaration;
        private final ForEachStmt loop;
        private final ReturnStmt  returnStmt;
        private final String      resultVariable;
        private final String      loopVariable;
        private final Expression  source;
        private final Expression  filter;
        private final Expression  element;

        CollectLoop(Statement declaration, ForEachStmt loop, ReturnStmt returnStmt, String resultVariable,
                    String loopVariable, Expression source, Expression filter, Expression element) {
            this.declaration    = declaration;
            this.loop           = loop;
            this.returnStmt     = returnStmt;
            this.resultVariable = resultVariable;
            this.loopVariable   = loopVariable;
            this.source         = source;
            this.filter         = filter;
            this.element        = element;
        }

        public String     getResultVariable() { return resultVariable; }
        public String     getLoopVariable()   { return loopVariable; }
        public Expression getElement()        { return element; }

        /** {@code src.stream().filter(..).map(..).collect(Collectors.toList())} or {@code .toList()}. */
        public Expression streamExpression(boolean useToList) {
            Expression chain = new MethodCallExpr(source.clone(), "stream");
            if (filter != null) {
                chain = new MethodCallExpr(chain, "filter", NodeList.nodeList(lambda(loopVariable, filter)));
            }
            if (!AstQueries.isName(element, loopVariable)) {
                chain = new MethodCallExpr(chain, "map", NodeList.nodeList(lambda(loopVariable, element)));
            }
            if (useToList) {
                return new MethodCallExpr(chain, "toList");
            }
            Expression collector = new MethodCallExpr(new NameExpr("Collectors"), "toList");
            return new MethodCallExpr(chain, "collect", NodeList.nodeList(collector));
        }

        /** Replaces the three statements with a single return of the stream pipeline. */
        public void replaceWithStream(boolean useToList) {
            returnStmt.setExpression(streamExpression(useToList));
            declaration.remove();
            loop.remove();
        }
    }

    public static CollectLoop findCollectLoop(MethodDeclaration method) {
        if (!isNamedType(method.getType(), LIST_RETURNS)) return null;
        List<Statement> body = AstQueries.bodyStatements(method);
        if (body.size() < 3) return null;

        Statement   declaration = body.get(body.size() - 3);
        Statement   loopStmt    = body.get(body.size() - 2);
        Statement   last        = body.get(body.size() - 1);

        VariableDeclarator result = singleDeclarator(declaration);
        if (result == null || result.getInitializer().isEmpty()) return null;
        Expression init = result.getInitializer().get();
        if (!init.isObjectCreationExpr()
                || !LIST_FACTORIES.contains(init.asObjectCreationExpr().getType().getNameAsString())
                || !init.asObjectCreationExpr().getArguments().isEmpty()
                || init.asObjectCreationExpr().getAnonymousClassBody().isPresent()) {
            return null;
        }
        String resultVariable = result.getNameAsString();

        if (!loopStmt.isForEachStmt() || !returnsName(last, resultVariable)) return null;
        ForEachStmt loop = loopStmt.asForEachStmt();
        if (!isStreamableSource(method, loop.getIterable())) return null;
        String loopVariable = loop.getVariableDeclarator().getNameAsString();

        Statement inner = AstQueries.unwrapSingle(loop.getBody());
        if (inner == null) return null;
        Expression filter = null;
        if (inner.isIfStmt()) {
            IfStmt guard = inner.asIfStmt();
            if (guard.getElseStmt().isPresent()) return null;
            filter = guard.getCondition();
            inner  = AstQueries.unwrapSingle(guard.getThenStmt());
            if (inner == null) return null;
        }
        Expression element = addedElement(inner, resultVariable);
        if (element == null) return null;

        if (AstQueries.countNameReads(method, resultVariable) != 2) return null;
        if (!capturesOnlyFinals(method, loopVariable, filter, element)) return null;

        return new CollectLoop(declaration, loop, last.asReturnStmt(), resultVariable, loopVariable,
                loop.getIterable(), filter, element);
    }

    // =========================================================================
    // Join loops
    // =========================================================================

    /** String accumulation through {@code +=} or a {@code StringBuilder}. */
    public static final class JoinLoop {
        private final Statement   declaration;
        private final ForEachStmt loop;
        private final ReturnStmt  returnStmt;
        private final String      accumulator;
        private final String      loopVariable;
        private final Expression  source;
        private final Type        sourceType;
        private final Expression  piece;

        JoinLoop(Statement declaration, ForEachStmt loop, ReturnStmt returnStmt, String accumulator,
                 String loopVariable, Expression source, Type sourceType, Expression piece) {
            this.declaration  = declaration;
            this.loop         = loop;
            this.returnStmt   = returnStmt;
            this.accumulator  = accumulator;
            this.loopVariable = loopVariable;
            this.source       = source;
            this.sourceType   = sourceType;
            this.piece        = piece;
        }

        public String     getAccumulator()  { return accumulator; }
        public String     getLoopVariable() { return loopVariable; }

        /** True when the loop appends each String element as is, so {@code String.join} applies. */
        public boolean joinsElementsDirectly() {
            return AstQueries.isName(piece, loopVariable) && "String".equals(elementTypeName());
        }

        /**
         * The equivalent expression, or null when the source cannot be streamed
         * (arrays of primitives other than int, long and double).
         */
        public Expression joinExpression(boolean preferStringJoin) {
            if (preferStringJoin && joinsElementsDirectly()) {
                return new MethodCallExpr(new NameExpr("String"), "join",
                        NodeList.nodeList(new StringLiteralExpr(""), source.clone()));
            }
            Expression asString = new MethodCallExpr(new NameExpr("String"), "valueOf",
                    NodeList.nodeList(piece.clone()));
            Expression stream;
            String mapper = "map";
            if (sourceType.isArrayType()) {
                String element = elementTypeName();
                if (sourceType.asArrayType().getComponentType().isPrimitiveType()) {
                    if (!PRIMITIVE_STREAMS.contains(element)) return null;
                    mapper = "mapToObj";
                }
                stream = new MethodCallExpr(new NameExpr("Arrays"), "stream", NodeList.nodeList(source.clone()));
            } else {
                stream = new MethodCallExpr(source.clone(), "stream");
            }
            Expression mapped = new MethodCallExpr(stream, mapper, NodeList.nodeList(lambda(loopVariable, asString)));
            Expression collector = new MethodCallExpr(new NameExpr("Collectors"), "joining");
            return new MethodCallExpr(mapped, "collect", NodeList.nodeList(collector));
        }

        public boolean usesArrays() {
            return sourceType.isArrayType();
        }

        public boolean replaceWithJoin(boolean preferStringJoin) {
            Expression joined = joinExpression(preferStringJoin);
            if (joined == null) return false;
            returnStmt.setExpression(joined);
            declaration.remove();
            loop.remove();
            return true;
        }

        private String elementTypeName() {
            if (sourceType.isArrayType()) {
                Type component = sourceType.asArrayType().getComponentType();
                return component.isArrayType() ? null : simpleName(component);
            }
            if (sourceType.isClassOrInterfaceType()) {
                ClassOrInterfaceType type = sourceType.asClassOrInterfaceType();
                if (type.getTypeArguments().isPresent() && type.getTypeArguments().get().size() == 1) {
                    return simpleName(type.getTypeArguments().get().get(0));
                }
            }
            return null;
        }
    }

    public static JoinLoop findJoinLoop(MethodDeclaration method) {
        if (!"String".equals(simpleName(method.getType()))) return null;
        List<Statement> body = AstQueries.bodyStatements(method);
        if (body.size() < 3) return null;

        Statement declaration = body.get(body.size() - 3);
        Statement loopStmt    = body.get(body.size() - 2);
        Statement last        = body.get(body.size() - 1);

        VariableDeclarator acc = singleDeclarator(declaration);
        if (acc == null || acc.getInitializer().isEmpty() || !loopStmt.isForEachStmt()) return null;
        String accumulator = acc.getNameAsString();
        Expression init = acc.getInitializer().get();
        ForEachStmt loop = loopStmt.asForEachStmt();
        Statement inner = AstQueries.unwrapSingle(loop.getBody());
        if (inner == null || !inner.isExpressionStmt()) return null;
        Expression step = inner.asExpressionStmt().getExpression();

        Expression piece;
        boolean emptyString = init.isStringLiteralExpr() && init.asStringLiteralExpr().getValue().isEmpty();
        if (emptyString && "String".equals(simpleName(acc.getType()))) {
            if (!returnsName(last, accumulator)) return null;
            piece = concatenatedPiece(step, accumulator);
        } else if (isEmptyBuilder(init)) {
            if (!returnsBuilderString(last, accumulator)) return null;
            piece = appendedPiece(step, accumulator);
        } else {
            return null;
        }
        if (piece == null) return null;

        Type sourceType = sourceType(method, loop.getIterable());
        if (sourceType == null) return null;
        if (!sourceType.isArrayType() && !isNamedType(sourceType, STREAMABLE)) return null;

        String loopVariable = loop.getVariableDeclarator().getNameAsString();
        // the step and the return; s = s + e names the accumulator twice in the step
        boolean selfConcat = step.isAssignExpr() && step.asAssignExpr().getOperator() == AssignExpr.Operator.ASSIGN;
        if (AstQueries.countNameReads(method, accumulator) != (selfConcat ? 3 : 2)) return null;
        if (!capturesOnlyFinals(method, loopVariable, null, piece)) return null;

        return new JoinLoop(declaration, loop, last.asReturnStmt(), accumulator, loopVariable,
                loop.getIterable(), sourceType, piece);
    }

    // =========================================================================
    // Private helpers
    // =========================================================================

    private static LambdaExpr lambda(String parameter, Expression body) {
        return new LambdaExpr(new Parameter(new UnknownType(), parameter), body.clone());
    }

    private static VariableDeclarator singleDeclarator(Statement stmt) {
        if (!stmt.isExpressionStmt() || !stmt.asExpressionStmt().getExpression().isVariableDeclarationExpr()) {
            return null;
        }
        NodeList<VariableDeclarator> vars = stmt.asExpressionStmt().getExpression()
                .asVariableDeclarationExpr().getVariables();
        return vars.size() == 1 ? vars.get(0) : null;
    }

    private static boolean returnsName(Statement stmt, String name) {
        return stmt.isReturnStmt()
                && AstQueries.isName(stmt.asReturnStmt().getExpression().orElse(null), name);
    }

    private static boolean returnsBuilderString(Statement stmt, String name) {
        if (!stmt.isReturnStmt()) return false;
        Expression returned = stmt.asReturnStmt().getExpression().orElse(null);
        if (returned == null || !returned.isMethodCallExpr()) return false;
        MethodCallExpr call = returned.asMethodCallExpr();
        return call.getNameAsString().equals("toString") && call.getArguments().isEmpty()
                && AstQueries.isName(call.getScope().orElse(null), name);
    }

    private static boolean isEmptyBuilder(Expression init) {
        return init.isObjectCreationExpr()
                && init.asObjectCreationExpr().getType().getNameAsString().equals("StringBuilder")
                && init.asObjectCreationExpr().getArguments().isEmpty();
    }

    private static Expression addedElement(Statement stmt, String resultVariable) {
        if (!stmt.isExpressionStmt() || !stmt.asExpressionStmt().getExpression().isMethodCallExpr()) return null;
        MethodCallExpr call = stmt.asExpressionStmt().getExpression().asMethodCallExpr();
        if (!call.getNameAsString().equals("add") || call.getArguments().size() != 1) return null;
        return AstQueries.isName(call.getScope().orElse(null), resultVariable) ? call.getArgument(0) : null;
    }

    /** {@code s += e} or {@code s = s + e}. */
    private static Expression concatenatedPiece(Expression step, String accumulator) {
        if (!step.isAssignExpr()) return null;
        AssignExpr assign = step.asAssignExpr();
        if (!AstQueries.isName(assign.getTarget(), accumulator)) return null;
        if (assign.getOperator() == AssignExpr.Operator.PLUS) {
            return AstQueries.countNameReads(assign.getValue(), accumulator) == 0 ? assign.getValue() : null;
        }
        if (assign.getOperator() == AssignExpr.Operator.ASSIGN && assign.getValue().isBinaryExpr()) {
            BinaryExpr sum = assign.getValue().asBinaryExpr();
            if (sum.getOperator() != BinaryExpr.Operator.PLUS) return null;
            if (!AstQueries.isName(sum.getLeft(), accumulator)) return null;
            return AstQueries.countNameReads(sum.getRight(), accumulator) == 0 ? sum.getRight() : null;
        }
        return null;
    }

    /** {@code sb.append(e)}. */
    private static Expression appendedPiece(Expression step, String accumulator) {
        if (!step.isMethodCallExpr()) return null;
        MethodCallExpr call = step.asMethodCallExpr();
        if (!call.getNameAsString().equals("append") || call.getArguments().size() != 1) return null;
        if (!AstQueries.isName(call.getScope().orElse(null), accumulator)) return null;
        Expression piece = call.getArgument(0);
        return AstQueries.countNameReads(piece, accumulator) == 0 ? piece : null;
    }

    private static boolean isStreamableSource(MethodDeclaration method, Expression iterable) {
        Type type = sourceType(method, iterable);
        return type != null && !type.isArrayType() && isNamedType(type, STREAMABLE);
    }

    private static Type sourceType(MethodDeclaration method, Expression iterable) {
        if (!iterable.isNameExpr()) return null;
        return AssignmentChain.declaredType(method, iterable.asNameExpr().getNameAsString());
    }

    private static boolean isNamedType(Type type, Set<String> names) {
        return type.isClassOrInterfaceType() && names.contains(type.asClassOrInterfaceType().getNameAsString());
    }

    private static String simpleName(Type type) {
        if (type.isClassOrInterfaceType()) return type.asClassOrInterfaceType().getNameAsString();
        return type.asString();
    }

    /** Lambda bodies may only capture effectively final names. */
    private static boolean capturesOnlyFinals(MethodDeclaration method, String loopVariable,
                                              Expression filter, Expression element) {
        for (Expression expr : new Expression[] {filter, element}) {
            if (expr == null) continue;
            if (!expr.findAll(AssignExpr.class).isEmpty()) return false;
            for (NameExpr name : expr.findAll(NameExpr.class)) {
                String n = name.getNameAsString();
                if (n.equals(loopVariable)) continue;
                if (isReassigned(method, n)) return false;
            }
        }
        return true;
    }

    private static boolean isReassigned(MethodDeclaration method, String name) {
        for (AssignExpr assign : method.findAll(AssignExpr.class)) {
            if (AstQueries.isName(assign.getTarget(), name)) return true;
        }
        for (UnaryExpr unary : method.findAll(UnaryExpr.class)) {
            UnaryExpr.Operator op = unary.getOperator();
            boolean step = op == UnaryExpr.Operator.PREFIX_INCREMENT || op == UnaryExpr.Operator.PREFIX_DECREMENT
                    || op == UnaryExpr.Operator.POSTFIX_INCREMENT || op == UnaryExpr.Operator.POSTFIX_DECREMENT;
            if (step && AstQueries.isName(unary.getExpression(), name)) return true;
        }
        return false;
    }
}
