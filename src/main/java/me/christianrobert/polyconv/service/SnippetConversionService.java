package me.christianrobert.polyconv.service;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import me.christianrobert.polyconv.analysis.QueryContextAnalyzer;
import me.christianrobert.polyconv.analysis.QueryTags;
import me.christianrobert.polyconv.ast.ExpressionNode;
import me.christianrobert.polyconv.ast.json.ExpressionTreeReader;
import me.christianrobert.polyconv.ast.json.TreeFormatException;
import me.christianrobert.polyconv.builder.CodeBuilderFactory;
import me.christianrobert.polyconv.config.service.ConverterConfigService;
import me.christianrobert.polyconv.context.ConversionException;
import me.christianrobert.polyconv.context.ConversionResult;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.TargetLanguage;
import me.christianrobert.polyconv.util.TaggedTreeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Converts test snippets of the polyglot corpus into the target languages.
 *
 * <p>Pipeline:
 * <pre>
 * Expression tree → QueryContextAnalyzer → QueryTags → code builder (per language) → target code
 * </pre>
 *
 * <p>The analysis is language independent, so {@link #convertAll} runs it once and feeds every
 * builder from the same tags. Conversion errors never escape: each one becomes a
 * {@link ConversionResult}, so one bad snippet cannot abort a batch.</p>
 */
@ApplicationScoped
public class SnippetConversionService {

    private static final Logger log = LoggerFactory.getLogger(SnippetConversionService.class);

    @Inject
    QueryContextAnalyzer analyzer;

    @Inject
    CodeBuilderFactory builderFactory;

    @Inject
    ConverterConfigService configService;

    @Inject
    ExpressionTreeReader treeReader;

    // ==================== SINGLE SNIPPET ====================

    /**
     * Converts a snippet with the emitter settings of the configuration service.
     */
    public ConversionResult convert(ExpressionNode snippet, TargetLanguage language) {
        return convert(snippet, language, configService.toEmitterConfig(), false);
    }

    public ConversionResult convert(ExpressionNode snippet, TargetLanguage language, EmitterConfig config) {
        return convert(snippet, language, config, false);
    }

    /**
     * Converts one snippet to one language.
     *
     * @param snippet Expression tree delivered by the parser
     * @param language Target language
     * @param config Emitter settings (declared type, root names, Java flags)
     * @param includeTree Whether to attach the tagged tree listing to a successful result (for debugging)
     * @return Result with the target code, or the reason the snippet was skipped or failed
     */
    public ConversionResult convert(ExpressionNode snippet, TargetLanguage language, EmitterConfig config,
                                    boolean includeTree) {
        if (snippet == null) {
            return ConversionResult.failure(language, "Snippet cannot be null");
        }
        if (language == null) {
            return ConversionResult.failure(null, "Target language cannot be null");
        }
        if (config == null) {
            return ConversionResult.failure(language, "Emitter config cannot be null");
        }

        log.debug("Converting {} snippet to {}", snippet.getKind(), language);
        try {
            QueryTags tags = analyze(snippet, config);
            return emit(snippet, tags, language, config, includeTree);
        } catch (Exception e) {
            log.error("Unexpected error during query context analysis", e);
            return ConversionResult.failure(language, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Converts a snippet given in the JSON tree format.
     */
    public ConversionResult convertJson(String json, TargetLanguage language) {
        ExpressionNode snippet;
        try {
            snippet = treeReader.read(json);
        } catch (TreeFormatException e) {
            log.warn("Cannot read snippet tree: {}", e.getMessage());
            return ConversionResult.failure(language, "Invalid snippet tree: " + e.getMessage());
        }
        return convert(snippet, language);
    }

    // ==================== ALL LANGUAGES / BATCHES ====================

    /**
     * Converts one snippet to every target language, sharing one analysis pass.
     *
     * @return Result per language, in {@link TargetLanguage} order
     */
    public Map<TargetLanguage, ConversionResult> convertAll(ExpressionNode snippet, EmitterConfig config) {
        Map<TargetLanguage, ConversionResult> results = new EnumMap<>(TargetLanguage.class);
        if (snippet == null || config == null) {
            for (TargetLanguage language : TargetLanguage.values()) {
                results.put(language, ConversionResult.failure(language, "Snippet and emitter config are required"));
            }
            return results;
        }

        QueryTags tags;
        try {
            tags = analyze(snippet, config);
        } catch (Exception e) {
            log.error("Unexpected error during query context analysis", e);
            for (TargetLanguage language : TargetLanguage.values()) {
                results.put(language, ConversionResult.failure(language, "Unexpected error: " + e.getMessage()));
            }
            return results;
        }

        for (TargetLanguage language : TargetLanguage.values()) {
            results.put(language, emit(snippet, tags, language, config, false));
        }
        return results;
    }

    /**
     * Converts a list of snippets to one language. Failures are reported per snippet and
     * never stop the batch.
     *
     * @return Results in input order
     */
    public List<ConversionResult> convertBatch(List<ExpressionNode> snippets, TargetLanguage language,
                                               EmitterConfig config) {
        log.info("Converting batch of {} snippets to {}", snippets.size(), language);

        List<ConversionResult> results = new ArrayList<>(snippets.size());
        int converted = 0;
        int skipped = 0;
        for (ExpressionNode snippet : snippets) {
            ConversionResult result = convert(snippet, language, config, false);
            if (result.isSuccess()) {
                converted++;
            } else if (result.isSkipped()) {
                skipped++;
            }
            results.add(result);
        }

        log.info("Batch to {} finished: {} converted, {} skipped, {} failed",
                language, converted, skipped, results.size() - converted - skipped);
        return results;
    }

    // ==================== PIPELINE STEPS ====================

    private QueryTags analyze(ExpressionNode snippet, EmitterConfig config) {
        log.debug("Step 1: Running query context analysis");
        return analyzer.analyze(snippet, config.getQueryRootNames(), false);
    }

    private ConversionResult emit(ExpressionNode snippet, QueryTags tags, TargetLanguage language,
                                  EmitterConfig config, boolean includeTree) {
        try {
            log.debug("Step 2: Emitting {} code", language);
            String output = builderFactory.emit(language, snippet, tags, config);
            log.trace("{} output: {}", language, output);

            if (includeTree) {
                return ConversionResult.successWithTree(language, output, TaggedTreeFormatter.format(snippet, tags));
            }
            return ConversionResult.success(language, output);

        } catch (ConversionException e) {
            ConversionResult result = ConversionResult.fromException(language, e);
            if (result.isSkipped()) {
                log.debug("Skipped {} conversion: {}", language, e.getDetailedMessage());
            } else {
                log.warn("{} conversion failed ({}): {}", language, e.getCategory(), e.getDetailedMessage());
            }
            return result;

        } catch (Exception e) {
            log.error("Unexpected error during {} conversion", language, e);
            return ConversionResult.failure(language, "Unexpected error: " + e.getMessage());
        }
    }
}
