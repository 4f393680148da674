package me.christianrobert.polyconv.builder.rules;

import me.christianrobert.polyconv.ast.Call;
import me.christianrobert.polyconv.ast.ExpressionNode;
import me.christianrobert.polyconv.ast.Identifier;
import me.christianrobert.polyconv.ast.StringLiteral;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;

import java.util.regex.Pattern;

/**
 * Skips expected-error fixtures that test argument counts, e.g.
 * {@code err("ReqlCompileError", "Expected 2 arguments but found 1.")}.
 *
 * <p>A statically typed driver rejects wrong arities at compile time, so such a fixture
 * cannot be expressed.</p>
 */
public class ArityCheckRule implements CallRule {

    private static final Pattern ARITY_MESSAGE = Pattern.compile(".*([Ee]xpect(ed|s)|Got) .* argument");

    @Override
    public String apply(Call call, SnippetCodeBuilder builder) {
        if (!(call.getCallee() instanceof Identifier) || !((Identifier) call.getCallee()).hasName("err")) {
            return null;
        }
        if (call.getArguments().size() < 2) {
            return null;
        }
        ExpressionNode message = call.getArguments().get(1);
        if (message instanceof StringLiteral
                && ARITY_MESSAGE.matcher(((StringLiteral) message).getValue()).lookingAt()) {
            throw new IntentionallyUnsupportedException("Arity checks are done by the Java type system", call);
        }
        return null;
    }
}
