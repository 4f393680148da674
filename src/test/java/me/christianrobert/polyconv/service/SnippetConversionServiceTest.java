package me.christianrobert.polyconv.service;

import me.christianrobert.polyconv.analysis.QueryContextAnalyzer;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.ast.json.ExpressionTreeReader;
import me.christianrobert.polyconv.builder.CodeBuilderFactory;
import me.christianrobert.polyconv.config.service.ConverterConfigService;
import me.christianrobert.polyconv.context.ConversionResult;
import me.christianrobert.polyconv.context.EmitterConfig;
import me.christianrobert.polyconv.context.ErrorCategory;
import me.christianrobert.polyconv.context.TargetLanguage;
import me.christianrobert.polyconv.context.ValueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static me.christianrobert.polyconv.ast.TreeFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SnippetConversionServiceTest {

    private SnippetConversionService service;
    private QueryContextAnalyzer analyzer;
    private ConverterConfigService configService;

    @BeforeEach
    void setUp() {
        analyzer = spy(new QueryContextAnalyzer());
        configService = new ConverterConfigService();

        service = new SnippetConversionService();
        service.analyzer = analyzer;
        service.builderFactory = new CodeBuilderFactory();
        service.configService = configService;
        service.treeReader = new ExpressionTreeReader();
    }

    // ========== Single conversions ==========

    @Test
    void convertsScenarioToJava() {
        ConversionResult result = service.convert(usersOlderThan18(), TargetLanguage.JAVA);

        assertTrue(result.isSuccess());
        assertEquals("r.table(\"users\").filter(row -> (row.g(\"age\")).gt(18L))", result.getOutput());
        assertFalse(result.hasTaggedTree());
    }

    @Test
    void attachesTaggedTreeOnRequest() {
        ConversionResult result = service.convert(usersOlderThan18(), TargetLanguage.RUBY, EmitterConfig.defaults(), true);

        assertTrue(result.isSuccess());
        assertTrue(result.hasTaggedTree());
        assertTrue(result.getTaggedTree().startsWith("CALL"));
        assertTrue(result.getTaggedTree().contains("LAMBDA (row) [query]"));
    }

    @Test
    void usesConfiguredRootNames() {
        configService.setConfigValue(ConverterConfigService.QUERY_ROOT_NAMES, "r,data");
        Subscript tree = sub(name("data"), slice(neg(num(2)), null));

        ConversionResult result = service.convert(tree, TargetLanguage.JAVA);

        assertEquals("data.slice(-2, -1).optArg(\"right_bound\", \"closed\")", result.getOutput());
        verify(analyzer).analyze(same(tree), eq(Set.of("r", "data")), eq(false));
    }

    @Test
    void intentionallyUnsupportedIsReportedAsSkipped() {
        ConversionResult result = service.convert(
                new ListComprehension(name("i"), name("i"), call(name("range"), num(3))),
                TargetLanguage.JAVASCRIPT);

        assertTrue(result.isSkipped());
        assertEquals(ErrorCategory.INTENTIONALLY_UNSUPPORTED, result.getErrorCategory());
        assertTrue(result.getErrorMessage().contains("Node: ListComp("));
    }

    @Test
    void typeMappingGapIsReportedAsFailure() {
        EmitterConfig config = EmitterConfig.defaults().withDeclaredType(ValueType.foreign("decimal", "Decimal"));

        ConversionResult result = service.convert(new Assign(name("d"), num(1)), TargetLanguage.JAVA, config);

        assertTrue(result.isFailure());
        assertEquals(ErrorCategory.TYPE_MAPPING_GAP, result.getErrorCategory());
    }

    @Test
    void invalidArgumentsAreReportedAsFailure() {
        assertTrue(service.convert(null, TargetLanguage.JAVA).isFailure());
        assertTrue(service.convert(r(), null, EmitterConfig.defaults()).isFailure());
        assertTrue(service.convert(r(), TargetLanguage.RUBY, null).isFailure());
    }

    @Test
    void unexpectedBuilderErrorsAreCaught() {
        CodeBuilderFactory failingFactory = mock(CodeBuilderFactory.class);
        when(failingFactory.emit(any(), any(), any(), any())).thenThrow(new IllegalStateException("boom"));
        service.builderFactory = failingFactory;

        ConversionResult result = service.convert(r(), TargetLanguage.JAVA);

        assertTrue(result.isFailure());
        assertEquals(ErrorCategory.UNEXPECTED, result.getErrorCategory());
        assertEquals("Unexpected error: boom", result.getErrorMessage());
    }

    // ========== JSON input ==========

    @Test
    void convertsJsonSnippet() {
        String json = "{\"kind\": \"LIST\", \"elements\": [{\"kind\": \"NUMBER\", \"value\": \"1\"}]}";

        assertEquals("Arrays.asList(1L)", service.convertJson(json, TargetLanguage.JAVA).getOutput());
    }

    @Test
    void invalidJsonIsReportedAsFailure() {
        ConversionResult result = service.convertJson("{\"kind\": \"NOPE\"}", TargetLanguage.JAVA);

        assertTrue(result.isFailure());
        assertTrue(result.getErrorMessage().startsWith("Invalid snippet tree"));
    }

    // ========== All languages / batches ==========

    @Test
    @DisplayName("[1, 2, 3] is a native sequence in every language, analyzed once")
    void convertAllSharesOneAnalysis() {
        ListExpr tree = list(num(1), num(2), num(3));

        Map<TargetLanguage, ConversionResult> results = service.convertAll(tree, EmitterConfig.defaults());

        assertEquals("Arrays.asList(1L, 2L, 3L)", results.get(TargetLanguage.JAVA).getOutput());
        assertEquals("[1, 2, 3]", results.get(TargetLanguage.JAVASCRIPT).getOutput());
        assertEquals("[1, 2, 3]", results.get(TargetLanguage.RUBY).getOutput());
        verify(analyzer, times(1)).analyze(any(), anySet(), anyBoolean());
    }

    @Test
    void convertAllReportsPerLanguageOutcome() {
        Compare chained = new Compare(num(1), List.of(CompareOperator.LT, CompareOperator.LT), List.of(name("x"), num(3)));

        Map<TargetLanguage, ConversionResult> results = service.convertAll(chained, EmitterConfig.defaults());

        assertEquals(ErrorCategory.AMBIGUOUS_SOURCE, results.get(TargetLanguage.JAVA).getErrorCategory());
        assertEquals(ErrorCategory.AMBIGUOUS_SOURCE, results.get(TargetLanguage.JAVASCRIPT).getErrorCategory());
        assertEquals("1 < x && x < 3", results.get(TargetLanguage.RUBY).getOutput());
    }

    @Test
    void batchContinuesAfterFailures() {
        List<ExpressionNode> snippets = List.of(
                table("users"),
                sub(name("obj"), str("key")),
                call(name("frozenset"), list()),
                num(7));

        List<ConversionResult> results = service.convertBatch(snippets, TargetLanguage.JAVA, EmitterConfig.defaults());

        assertEquals(4, results.size());
        assertEquals("r.table(\"users\")", results.get(0).getOutput());
        assertEquals(ErrorCategory.UNMODELED_CONSTRUCT, results.get(1).getErrorCategory());
        assertTrue(results.get(2).isSkipped());
        assertEquals("7L", results.get(3).getOutput());
    }
}
