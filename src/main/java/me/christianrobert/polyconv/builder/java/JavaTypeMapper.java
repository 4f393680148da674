package me.christianrobert.polyconv.builder.java;

import me.christianrobert.polyconv.ast.ExpressionNode;
import me.christianrobert.polyconv.context.TypeMappingGapException;
import me.christianrobert.polyconv.context.ValueType;
import me.christianrobert.polyconv.naming.CaseConverter;

import java.util.Map;

/**
 * Maps the provenance of a snippet's value to the Java type its assignment target is declared with.
 *
 * <p>Built-in kinds map to boxed JDK types. Query-API classes keep their names, except for the
 * few the Java driver capitalizes differently. Test helpers and constant families are title-cased.</p>
 */
public final class JavaTypeMapper {

    private static final Map<ValueType.Kind, String> BUILTIN_TYPES = Map.ofEntries(
        Map.entry(ValueType.Kind.BOOLEAN, "Boolean"),
        Map.entry(ValueType.Kind.BYTES, "byte[]"),
        Map.entry(ValueType.Kind.INTEGER, "Long"),
        Map.entry(ValueType.Kind.FLOAT, "Double"),
        Map.entry(ValueType.Kind.STRING, "String"),
        Map.entry(ValueType.Kind.MAPPING, "Map"),
        Map.entry(ValueType.Kind.SEQUENCE, "List"),
        Map.entry(ValueType.Kind.OBJECT, "Object"),
        Map.entry(ValueType.Kind.NULL, "Object"),
        Map.entry(ValueType.Kind.FUNCTION, "ReqlFunction1"),
        Map.entry(ValueType.Kind.DATETIME, "OffsetDateTime")
    );

    // Irregular capitalization in the Java driver
    private static final Map<String, String> QUERY_TERM_RENAMES = Map.of(
        "DB", "Db"
    );

    // uuid would clash with the Uuid term
    private static final Map<String, String> TEST_HELPER_RENAMES = Map.of(
        "uuid", "UUIDMatch"
    );

    private JavaTypeMapper() {
    }

    /**
     * @param type Declared value type
     * @param node Node the type is needed for; only used for error reporting
     * @return Java type name
     * @throws TypeMappingGapException when the type is missing or has no Java counterpart
     */
    public static String toJavaType(ValueType type, ExpressionNode node) {
        if (type == null) {
            throw new TypeMappingGapException("No declared type for typed assignment", null, node);
        }
        switch (type.getKind()) {
            case QUERY_TERM:
                return QUERY_TERM_RENAMES.getOrDefault(type.getName(), type.getName());
            case QUERY_ERROR:
                return type.getName();
            case TEST_HELPER:
                return TEST_HELPER_RENAMES.getOrDefault(type.getName(), CaseConverter.titleJoin(type.getName()));
            case QUERY_CONSTANT:
                return CaseConverter.titleJoin(type.getName());
            case FOREIGN:
                throw new TypeMappingGapException(
                    "Don't know how to convert " + type.getOrigin() + "." + type.getName() + " to a Java type",
                    type, node);
            default:
                String builtin = BUILTIN_TYPES.get(type.getKind());
                if (builtin == null) {
                    throw new TypeMappingGapException("No Java type for " + type.getKind(), type, node);
                }
                return builtin;
        }
    }
}
