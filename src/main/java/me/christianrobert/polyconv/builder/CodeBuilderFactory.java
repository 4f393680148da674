package me.christianrobert.polyconv.builder;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.ExpressionNode;
import me.christianrobert.polyconv.builder.java.JavaCodeBuilder;
import me.christianrobert.polyconv.builder.javascript.JavaScriptCodeBuilder;
import me.christianrobert.polyconv.builder.ruby.RubyCodeBuilder;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.TargetLanguage;

/**
 * Creates the code builder for a target language and runs it.
 *
 * <p>Stateless; every call gets a fresh builder, so concurrent conversions never share one.</p>
 */
@ApplicationScoped
public class CodeBuilderFactory {

    public SnippetCodeBuilder create(TargetLanguage language, QueryTags tags, EmitterConfig config) {
        if (language == null) {
            throw new IllegalArgumentException("Target language cannot be null");
        }
        switch (language) {
            case JAVA:
                return new JavaCodeBuilder(tags, config);
            case JAVASCRIPT:
                return new JavaScriptCodeBuilder(tags, config);
            case RUBY:
                return new RubyCodeBuilder(tags, config);
            default:
                throw new IllegalArgumentException("No code builder for " + language);
        }
    }

    /**
     * Renders an analyzed tree in the given language.
     *
     * @throws me.christianrobert.polyconv.context.ConversionException when the tree cannot be expressed
     */
    public String emit(TargetLanguage language, ExpressionNode root, QueryTags tags, EmitterConfig config) {
        return create(language, tags, config).build(root);
    }
}
