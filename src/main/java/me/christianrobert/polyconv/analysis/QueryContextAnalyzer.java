package me.christianrobert.polyconv.analysis;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.context.EmitterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Set;

/**
 * First pass: decides for every subexpression whether it belongs to the query API.
 *
 * <p>Walks the tree top-down pushing scopes (lambda parameters, "passed into a query call")
 * and computes tags bottom-up. Results go into a {@link QueryTags} identity map; nodes are
 * never mutated.</p>
 *
 * <p><b>Rules</b></p>
 * <ul>
 *   <li>Identifier: tagged when its name is a query root in scope</li>
 *   <li>Attribute, UnaryOp: inherit the tag of their base/operand</li>
 *   <li>Call: tagged like its callee; a tagged call analyzes its arguments with the
 *       inherited flag set, an untagged call passes its own ambient scope through</li>
 *   <li>Lambda: tagged only when inherited; then its parameters become query roots in its body</li>
 *   <li>Subscript: tagged like its base; the index inherits the base's tag</li>
 *   <li>Slice: tagged when inherited; its bounds start a fresh, non-inherited scope</li>
 *   <li>BinOp: tagged when either operand is, except for exponentiation</li>
 *   <li>Compare: tagged when any operand is</li>
 *   <li>List, Tuple, Dict, literals, list comprehensions: never tagged</li>
 *   <li>Assign: tagged like its value</li>
 * </ul>
 *
 * <p>The pass never fails and holds no state between calls.</p>
 */
@ApplicationScoped
public class QueryContextAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(QueryContextAnalyzer.class);

    /**
     * Analyzes with the default root name and no inherited context.
     */
    public QueryTags analyze(ExpressionNode root) {
        return analyze(root, Set.of(EmitterConfig.DEFAULT_ROOT_NAME), false);
    }

    /**
     * Analyzes a tree under an explicit ambient scope.
     *
     * @param root Tree to analyze
     * @param queryRootNames Identifiers bound to the query-API root
     * @param inheritedContext Whether the tree is itself an argument of a query-API call
     * @return Tag for every node of the tree
     */
    public QueryTags analyze(ExpressionNode root, Set<String> queryRootNames, boolean inheritedContext) {
        if (root == null) {
            throw new IllegalArgumentException("Cannot analyze a null tree");
        }
        IdentityHashMap<ExpressionNode, Boolean> tags = new IdentityHashMap<>();
        new ScopedTagVisitor(new AnalysisScope(queryRootNames, inheritedContext), tags).tag(root);

        QueryTags result = new QueryTags(tags);
        log.debug("Query context analysis complete: {} of {} nodes are query expressions",
                result.countQueryExprs(), result.size());
        return result;
    }

    /**
     * Visitor bound to one scope. Entering a different scope creates a new visitor that
     * shares the tag map.
     */
    private static final class ScopedTagVisitor implements ExpressionVisitor<Boolean> {

        private final AnalysisScope scope;
        private final IdentityHashMap<ExpressionNode, Boolean> tags;

        ScopedTagVisitor(AnalysisScope scope, IdentityHashMap<ExpressionNode, Boolean> tags) {
            this.scope = scope;
            this.tags = tags;
        }

        boolean tag(ExpressionNode node) {
            return node.accept(this);
        }

        private ScopedTagVisitor in(AnalysisScope other) {
            return other == scope ? this : new ScopedTagVisitor(other, tags);
        }

        private boolean record(ExpressionNode node, boolean isQuery) {
            tags.put(node, isQuery);
            log.trace("Tagged {} as {}", node.getKind(), isQuery ? "query" : "native");
            return isQuery;
        }

        // ========== Leaves ==========

        @Override
        public Boolean visitString(StringLiteral node) {
            return record(node, false);
        }

        @Override
        public Boolean visitBytes(BytesLiteral node) {
            return record(node, false);
        }

        @Override
        public Boolean visitNumber(NumberLiteral node) {
            return record(node, false);
        }

        @Override
        public Boolean visitBoolean(BooleanLiteral node) {
            return record(node, false);
        }

        @Override
        public Boolean visitNull(NullLiteral node) {
            return record(node, false);
        }

        @Override
        public Boolean visitIdentifier(Identifier node) {
            return record(node, scope.isQueryRoot(node.getName()));
        }

        // ========== Propagating nodes ==========

        @Override
        public Boolean visitAttribute(Attribute node) {
            return record(node, tag(node.getBase()));
        }

        @Override
        public Boolean visitCall(Call node) {
            boolean isQuery = tag(node.getCallee());
            record(node, isQuery);

            // Untagged calls keep the ambient flag; they do not reset it
            ScopedTagVisitor argumentVisitor = isQuery ? in(scope.withInheritedContext(true)) : this;
            for (ExpressionNode argument : node.getArguments()) {
                argumentVisitor.tag(argument);
            }
            for (Keyword keyword : node.getKeywords()) {
                argumentVisitor.tag(keyword.getValue());
            }
            return isQuery;
        }

        @Override
        public Boolean visitLambda(Lambda node) {
            boolean isQuery = scope.isInheritedContext();
            record(node, isQuery);
            AnalysisScope bodyScope = isQuery
                    ? scope.extendedWith(node.getParameters())
                    : scope.withInheritedContext(false);
            in(bodyScope).tag(node.getBody());
            return isQuery;
        }

        @Override
        public Boolean visitSubscript(Subscript node) {
            boolean isQuery = tag(node.getBase());
            record(node, isQuery);
            in(scope.withInheritedContext(isQuery)).tag(node.getIndex());
            return isQuery;
        }

        @Override
        public Boolean visitSlice(Slice node) {
            boolean isQuery = scope.isInheritedContext();
            record(node, isQuery);
            ScopedTagVisitor boundVisitor = in(scope.withInheritedContext(false));
            for (ExpressionNode bound : new ExpressionNode[]{node.getLower(), node.getUpper(), node.getStep()}) {
                if (bound != null) {
                    boundVisitor.tag(bound);
                }
            }
            return isQuery;
        }

        @Override
        public Boolean visitUnaryOp(UnaryOp node) {
            return record(node, tag(node.getOperand()));
        }

        @Override
        public Boolean visitBinOp(BinOp node) {
            boolean left = tag(node.getLeft());
            boolean right = tag(node.getRight());
            return record(node, node.getOperator() != BinaryOperator.POW && (left || right));
        }

        @Override
        public Boolean visitCompare(Compare node) {
            boolean isQuery = tag(node.getLeft());
            for (ExpressionNode comparator : node.getComparators()) {
                // every comparator must be visited, so no short-circuit here
                isQuery = tag(comparator) | isQuery;
            }
            return record(node, isQuery);
        }

        // ========== Containers (never query expressions) ==========

        @Override
        public Boolean visitList(ListExpr node) {
            node.getElements().forEach(this::tag);
            return record(node, false);
        }

        @Override
        public Boolean visitTuple(TupleExpr node) {
            node.getElements().forEach(this::tag);
            return record(node, false);
        }

        @Override
        public Boolean visitDict(DictExpr node) {
            for (int i = 0; i < node.size(); i++) {
                tag(node.getKeys().get(i));
                tag(node.getValues().get(i));
            }
            return record(node, false);
        }

        @Override
        public Boolean visitListComprehension(ListComprehension node) {
            tag(node.getElement());
            tag(node.getTarget());
            tag(node.getIterable());
            return record(node, false);
        }

        @Override
        public Boolean visitAssign(Assign node) {
            node.getTargets().forEach(this::tag);
            return record(node, tag(node.getValue()));
        }
    }
}
