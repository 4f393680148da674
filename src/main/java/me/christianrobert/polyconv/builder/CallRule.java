package me.christianrobert.polyconv.builder;

import me.christianrobert.polyconv.ast.Call;

/**
 * A skip/transform rule consulted before a call is rendered generically.
 *
 * <p>A rule either does not match (returns null), rewrites the call into target code
 * (returns the replacement), or rejects the call by throwing
 * {@link me.christianrobert.polyconv.context.IntentionallyUnsupportedException}.</p>
 *
 * <p>Rules are stateless and shared across conversions.</p>
 */
public interface CallRule {

    /**
     * @param call Call about to be rendered
     * @param builder Builder rendering the current snippet (for sub-expressions and tags)
     * @return replacement code, or null when the rule does not apply
     */
    String apply(Call call, SnippetCodeBuilder builder);
}
