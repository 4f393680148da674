package me.christianrobert.polyconv.builder.rules;

import me.christianrobert.polyconv.ast.Call;
import me.christianrobert.polyconv.ast.Lambda;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;

/**
 * Skips query {@code for_each} calls whose argument is not a function literal;
 * the Java driver only accepts a function there.
 */
public class ForEachFunctionRule implements CallRule {

    @Override
    public String apply(Call call, SnippetCodeBuilder builder) {
        if (!"for_each".equals(call.getMethodName()) || !builder.isQueryExpr(call) || !call.hasArguments()) {
            return null;
        }
        if (!(call.getArguments().get(0) instanceof Lambda)) {
            throw new IntentionallyUnsupportedException(
                "The Java driver doesn't allow non-function arguments to forEach", call);
        }
        return null;
    }
}
