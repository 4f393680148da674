package me.christianrobert.polyconv.ast.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.polyconv.ast.*;
import me.christianrobert.polyconv.context.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads expression trees from the JSON form the corpus loader writes.
 *
 * <p>Every node is an object whose {@code kind} is a {@link NodeKind} name, for example:</p>
 * <pre>
 * {"kind": "CALL",
 *  "callee": {"kind": "ATTRIBUTE", "base": {"kind": "IDENTIFIER", "name": "r"}, "name": "table"},
 *  "args": [{"kind": "STRING", "value": "users"}],
 *  "keywords": [{"name": "read_mode", "value": {"kind": "STRING", "value": "outdated"}}]}
 * </pre>
 *
 * <p>Operators are given by their enum names ({@code "ADD"}, {@code "LT_E"}). Numbers keep their
 * source text when given as strings. Bytes are arrays of integers between 0 and 255.</p>
 */
@ApplicationScoped
public class ExpressionTreeReader {

    private static final Logger log = LoggerFactory.getLogger(ExpressionTreeReader.class);

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a JSON document into an expression tree.
     *
     * @throws TreeFormatException if the document is not valid JSON or not a valid tree
     */
    public ExpressionNode read(String json) {
        if (json == null) {
            throw new TreeFormatException("No JSON document", "$");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new TreeFormatException("Malformed JSON: " + e.getOriginalMessage(), "$", e);
        }
        ExpressionNode tree = read(root);
        log.trace("Read expression tree of kind {}", tree.getKind());
        return tree;
    }

    public ExpressionNode read(JsonNode json) {
        return readNode(json, "$");
    }

    /**
     * Reads a value provenance object: {@code {"kind": "QUERY_TERM", "name": "Table"}}. Built-in
     * kinds need no name; {@code FOREIGN} also takes an {@code origin}.
     */
    public ValueType readValueType(String json) {
        try {
            return readValueType(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new TreeFormatException("Malformed JSON: " + e.getOriginalMessage(), "$", e);
        }
    }

    public ValueType readValueType(JsonNode json) {
        String path = "$";
        ValueType.Kind kind = readEnum(json, "kind", ValueType.Kind.class, path);
        switch (kind) {
            case BOOLEAN: return ValueType.BOOLEAN;
            case BYTES: return ValueType.BYTES;
            case INTEGER: return ValueType.INTEGER;
            case FLOAT: return ValueType.FLOAT;
            case STRING: return ValueType.STRING;
            case MAPPING: return ValueType.MAPPING;
            case SEQUENCE: return ValueType.SEQUENCE;
            case OBJECT: return ValueType.OBJECT;
            case NULL: return ValueType.NULL;
            case FUNCTION: return ValueType.FUNCTION;
            case DATETIME: return ValueType.DATETIME;
            case QUERY_TERM: return ValueType.queryTerm(text(json, "name", path));
            case QUERY_ERROR: return ValueType.queryError(text(json, "name", path));
            case TEST_HELPER: return ValueType.testHelper(text(json, "name", path));
            case QUERY_CONSTANT: return ValueType.queryConstant(text(json, "name", path));
            case FOREIGN: return ValueType.foreign(optionalText(json, "origin"), text(json, "name", path));
            default:
                throw new TreeFormatException("Unsupported value type kind " + kind, path);
        }
    }

    // ========== Nodes ==========

    private ExpressionNode readNode(JsonNode json, String path) {
        if (json == null || !json.isObject()) {
            throw new TreeFormatException("Expected a node object", path);
        }
        NodeKind kind = readEnum(json, "kind", NodeKind.class, path);
        try {
            return buildNode(kind, json, path);
        } catch (IllegalArgumentException e) {
            // node constructors reject inconsistent shapes (operator/comparator counts, empty names)
            throw new TreeFormatException(e.getMessage(), path, e);
        }
    }

    private ExpressionNode buildNode(NodeKind kind, JsonNode json, String path) {
        switch (kind) {
            case STRING:
                return new StringLiteral(text(json, "value", path));
            case BYTES:
                return readBytes(json, path);
            case NUMBER:
                return readNumber(json, path);
            case BOOLEAN:
                return new BooleanLiteral(field(json, "value", path).asBoolean());
            case NULL:
                return new NullLiteral();
            case IDENTIFIER:
                return new Identifier(text(json, "name", path));
            case ATTRIBUTE:
                return new Attribute(child(json, "base", path), text(json, "name", path));
            case CALL:
                return new Call(child(json, "callee", path), children(json, "args", path), readKeywords(json, path));
            case SUBSCRIPT:
                return new Subscript(child(json, "base", path), child(json, "index", path));
            case SLICE:
                return new Slice(optionalChild(json, "lower", path), optionalChild(json, "upper", path),
                        optionalChild(json, "step", path));
            case UNARY_OP:
                return new UnaryOp(readEnum(json, "op", UnaryOperator.class, path), child(json, "operand", path));
            case BIN_OP:
                return new BinOp(readEnum(json, "op", BinaryOperator.class, path),
                        child(json, "left", path), child(json, "right", path));
            case COMPARE:
                return new Compare(child(json, "left", path), readCompareOperators(json, path),
                        children(json, "comparators", path));
            case LIST:
                return new ListExpr(children(json, "elements", path));
            case TUPLE:
                return new TupleExpr(children(json, "elements", path));
            case DICT:
                return new DictExpr(children(json, "keys", path), children(json, "values", path));
            case LAMBDA:
                return new Lambda(readParameters(json, path), child(json, "body", path));
            case ASSIGN:
                return new Assign(children(json, "targets", path), child(json, "value", path));
            case LIST_COMPREHENSION:
                return new ListComprehension(child(json, "element", path), child(json, "target", path),
                        child(json, "iterable", path));
            default:
                throw new TreeFormatException("Unsupported node kind " + kind, path);
        }
    }

    private BytesLiteral readBytes(JsonNode json, String path) {
        JsonNode values = array(json, "value", path);
        int[] bytes = new int[values.size()];
        for (int i = 0; i < values.size(); i++) {
            JsonNode value = values.get(i);
            if (!value.canConvertToInt() || value.asInt() < 0 || value.asInt() > 255) {
                throw new TreeFormatException("Byte value out of range: " + value, path + ".value[" + i + "]");
            }
            bytes[i] = value.asInt();
        }
        return new BytesLiteral(bytes);
    }

    /**
     * A negative value is read as unary minus over its magnitude, the shape the parser produces.
     */
    private ExpressionNode readNumber(JsonNode json, String path) {
        JsonNode value = field(json, "value", path);
        if (!value.isTextual() && !value.isNumber()) {
            throw new TreeFormatException("Number value must be a string or number", path + ".value");
        }
        String text = value.asText().trim();
        if (text.startsWith("-")) {
            return new UnaryOp(UnaryOperator.MINUS, new NumberLiteral(text.substring(1)));
        }
        return new NumberLiteral(text);
    }

    private List<Keyword> readKeywords(JsonNode json, String path) {
        List<Keyword> keywords = new ArrayList<>();
        if (!json.has("keywords")) {
            return keywords;
        }
        JsonNode array = array(json, "keywords", path);
        for (int i = 0; i < array.size(); i++) {
            String keywordPath = path + ".keywords[" + i + "]";
            JsonNode keyword = array.get(i);
            keywords.add(new Keyword(text(keyword, "name", keywordPath), child(keyword, "value", keywordPath)));
        }
        return keywords;
    }

    private List<CompareOperator> readCompareOperators(JsonNode json, String path) {
        List<CompareOperator> operators = new ArrayList<>();
        JsonNode array = array(json, "ops", path);
        for (int i = 0; i < array.size(); i++) {
            operators.add(parseEnum(array.get(i).asText(), CompareOperator.class, path + ".ops[" + i + "]"));
        }
        return operators;
    }

    private List<String> readParameters(JsonNode json, String path) {
        List<String> parameters = new ArrayList<>();
        JsonNode array = array(json, "params", path);
        for (int i = 0; i < array.size(); i++) {
            if (!array.get(i).isTextual()) {
                throw new TreeFormatException("Parameter name must be a string", path + ".params[" + i + "]");
            }
            parameters.add(array.get(i).asText());
        }
        return parameters;
    }

    // ========== Field access ==========

    private ExpressionNode child(JsonNode json, String name, String path) {
        return readNode(field(json, name, path), path + "." + name);
    }

    private ExpressionNode optionalChild(JsonNode json, String name, String path) {
        JsonNode value = json.get(name);
        if (value == null || value.isNull()) {
            return null;
        }
        return readNode(value, path + "." + name);
    }

    private List<ExpressionNode> children(JsonNode json, String name, String path) {
        List<ExpressionNode> nodes = new ArrayList<>();
        if (!json.has(name)) {
            return nodes;
        }
        JsonNode array = array(json, name, path);
        for (int i = 0; i < array.size(); i++) {
            nodes.add(readNode(array.get(i), path + "." + name + "[" + i + "]"));
        }
        return nodes;
    }

    private static JsonNode field(JsonNode json, String name, String path) {
        if (json == null || !json.isObject()) {
            throw new TreeFormatException("Expected an object", path);
        }
        JsonNode value = json.get(name);
        if (value == null || value.isNull()) {
            throw new TreeFormatException("Missing field '" + name + "'", path);
        }
        return value;
    }

    private static JsonNode array(JsonNode json, String name, String path) {
        JsonNode value = field(json, name, path);
        if (!value.isArray()) {
            throw new TreeFormatException("Field '" + name + "' must be an array", path);
        }
        return value;
    }

    private static String text(JsonNode json, String name, String path) {
        JsonNode value = field(json, name, path);
        if (!value.isTextual()) {
            throw new TreeFormatException("Field '" + name + "' must be a string", path);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode json, String name) {
        JsonNode value = json.get(name);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static <E extends Enum<E>> E readEnum(JsonNode json, String name, Class<E> type, String path) {
        return parseEnum(text(json, name, path), type, path + "." + name);
    }

    private static <E extends Enum<E>> E parseEnum(String value, Class<E> type, String path) {
        try {
            return Enum.valueOf(type, value);
        } catch (IllegalArgumentException e) {
            throw new TreeFormatException("Unknown " + type.getSimpleName() + " '" + value + "'", path, e);
        }
    }
}
