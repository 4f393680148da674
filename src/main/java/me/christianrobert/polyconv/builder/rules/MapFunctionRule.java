package me.christianrobert.polyconv.builder.rules;

import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;

import java.util.List;

/**
 * Skips query {@code map} calls whose mapping argument (the last one) cannot be a function.
 *
 * <p>Accepted as functions: lambdas, {@code r.js(...)} calls, objects (field mappings) and plain
 * variables, which are assumed to hold a function.</p>
 */
public class MapFunctionRule implements CallRule {

    @Override
    public String apply(Call call, SnippetCodeBuilder builder) {
        if (!"map".equals(call.getMethodName()) || !builder.isQueryExpr(call) || !call.hasArguments()) {
            return null;
        }
        List<ExpressionNode> arguments = call.getArguments();
        if (!canBeFunction(arguments.get(arguments.size() - 1), builder)) {
            throw new IntentionallyUnsupportedException(
                "The Java driver statically checks that map has a function argument", call);
        }
        return null;
    }

    private static boolean canBeFunction(ExpressionNode node, SnippetCodeBuilder builder) {
        if (node instanceof Lambda || node instanceof DictExpr || node instanceof Identifier) {
            return true;
        }
        if (node instanceof Call && ((Call) node).getCallee() instanceof Attribute) {
            Attribute callee = (Attribute) ((Call) node).getCallee();
            return "js".equals(callee.getName())
                    && callee.getBase() instanceof Identifier
                    && builder.getConfig().isQueryRoot(((Identifier) callee.getBase()).getName());
        }
        return false;
    }
}
