package me.christianrobert.polyconv.builder.rules;

import me.christianrobert.polyconv.ast.Attribute;
import me.christianrobert.polyconv.ast.Call;
import me.christianrobert.polyconv.ast.StringLiteral;
import me.christianrobert.polyconv.builder.CallRule;
import me.christianrobert.polyconv.builder.SnippetCodeBuilder;
import me.christianrobert.polyconv.context.IntentionallyUnsupportedException;
import me.christianrobert.polyconv.context.UnmodeledConstructException;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rewrites {@code 'foo'.encode('utf-8')} into the target's way of producing bytes from a string literal.
 *
 * <p>Each target supplies its charset table and a template. The template receives the rendered
 * string literal and the target's charset name:</p>
 * <ul>
 *   <li>Java: {@code "foo".getBytes(StandardCharsets.UTF_8)}</li>
 *   <li>JavaScript: {@code Buffer('foo', 'utf8')}</li>
 *   <li>Ruby: {@code 'foo'.encode('UTF-8').force_encoding('BINARY')}</li>
 * </ul>
 */
public class StringEncodeRule implements CallRule {

    /**
     * Produces the target code from the rendered literal and the target charset name.
     */
    @FunctionalInterface
    public interface EncodeTemplate {
        String render(String literal, String charset);
    }

    private final Map<String, String> charsets;
    private final Set<String> unsupportedCharsets;
    private final EncodeTemplate template;

    public StringEncodeRule(Map<String, String> charsets, Set<String> unsupportedCharsets, EncodeTemplate template) {
        if (charsets == null || template == null) {
            throw new IllegalArgumentException("Charset table and template are required");
        }
        this.charsets = Map.copyOf(charsets);
        this.unsupportedCharsets = unsupportedCharsets == null ? Set.of() : Set.copyOf(unsupportedCharsets);
        this.template = template;
    }

    public static StringEncodeRule forJava() {
        return new StringEncodeRule(
            Map.of("ascii", "US_ASCII", "utf-8", "UTF_8", "utf-16", "UTF_16"),
            Set.of(),
            (literal, charset) -> literal + ".getBytes(StandardCharsets." + charset + ")");
    }

    /**
     * Buffer would prepend no byte-order mark for UTF-16, so those fixtures cannot be matched.
     */
    public static StringEncodeRule forJavaScript() {
        return new StringEncodeRule(
            Map.of("ascii", "ascii", "utf-8", "utf8"),
            Set.of("utf-16"),
            (literal, charset) -> "Buffer(" + literal + ", '" + charset + "')");
    }

    public static StringEncodeRule forRuby() {
        return new StringEncodeRule(
            Map.of("ascii", "ASCII", "utf-8", "UTF-8", "utf-16", "UTF-16"),
            Set.of(),
            (literal, charset) -> literal + ".encode('" + charset + "').force_encoding('BINARY')");
    }

    @Override
    public String apply(Call call, SnippetCodeBuilder builder) {
        if (!(call.getCallee() instanceof Attribute)) {
            return null;
        }
        Attribute callee = (Attribute) call.getCallee();
        if (!"encode".equals(callee.getName()) || !(callee.getBase() instanceof StringLiteral)) {
            return null;
        }
        if (call.getArguments().isEmpty() || !(call.getArguments().get(0) instanceof StringLiteral)) {
            return null;
        }

        String encoding = ((StringLiteral) call.getArguments().get(0)).getValue().toLowerCase(Locale.ROOT);
        if (unsupportedCharsets.contains(encoding)) {
            throw new IntentionallyUnsupportedException("Charset " + encoding + " cannot be reproduced", call);
        }
        String charset = charsets.get(encoding);
        if (charset == null) {
            throw new UnmodeledConstructException("Unknown charset: " + encoding, call);
        }
        return template.render(builder.visit(callee.getBase()), charset);
    }
}
