package me.christianrobert.polyconv.context;

import java.util.Objects;

/**
 * Provenance of the value a snippet evaluates to, supplied by the corpus loader.
 * <p>
 * Typed targets need it to declare the variable an assignment writes to. Instead of inferring
 * the type from runtime metadata, the loader states it explicitly as one of a closed set of kinds.
 * Query-API kinds carry the class or constant-family name they refer to.
 * </p>
 */
public class ValueType {

    public static final ValueType BOOLEAN = new ValueType(Kind.BOOLEAN, null, null);
    public static final ValueType BYTES = new ValueType(Kind.BYTES, null, null);
    public static final ValueType INTEGER = new ValueType(Kind.INTEGER, null, null);
    public static final ValueType FLOAT = new ValueType(Kind.FLOAT, null, null);
    public static final ValueType STRING = new ValueType(Kind.STRING, null, null);
    public static final ValueType MAPPING = new ValueType(Kind.MAPPING, null, null);
    public static final ValueType SEQUENCE = new ValueType(Kind.SEQUENCE, null, null);
    public static final ValueType OBJECT = new ValueType(Kind.OBJECT, null, null);
    public static final ValueType NULL = new ValueType(Kind.NULL, null, null);
    public static final ValueType FUNCTION = new ValueType(Kind.FUNCTION, null, null);
    public static final ValueType DATETIME = new ValueType(Kind.DATETIME, null, null);

    private final Kind kind;
    private final String name;
    private final String origin;

    private ValueType(Kind kind, String name, String origin) {
        this.kind = kind;
        this.name = name;
        this.origin = origin;
    }

    /**
     * A term class of the query API (e.g. {@code Table}, {@code DB}).
     */
    public static ValueType queryTerm(String className) {
        return new ValueType(Kind.QUERY_TERM, requireName(className), null);
    }

    /**
     * An error class of the query API (e.g. {@code ReqlServerCompileError}).
     */
    public static ValueType queryError(String className) {
        return new ValueType(Kind.QUERY_ERROR, requireName(className), null);
    }

    /**
     * A helper defined by the test harness (e.g. {@code uuid}, {@code bag}).
     */
    public static ValueType testHelper(String helperName) {
        return new ValueType(Kind.TEST_HELPER, requireName(helperName), null);
    }

    /**
     * A well-known constant of the query API ({@code minval}, {@code monday}, ...).
     * The name is the constant-family attribute the loader read off the value.
     */
    public static ValueType queryConstant(String constantName) {
        return new ValueType(Kind.QUERY_CONSTANT, requireName(constantName), null);
    }

    /**
     * Any value whose origin has no mapping. Typed targets reject it.
     */
    public static ValueType foreign(String origin, String name) {
        return new ValueType(Kind.FOREIGN, requireName(name), origin);
    }

    private static String requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Value type name cannot be null or empty");
        }
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Class, helper or constant name; null for built-in kinds.
     */
    public String getName() {
        return name;
    }

    /**
     * Originating module of a {@link Kind#FOREIGN} value; null otherwise.
     */
    public String getOrigin() {
        return origin;
    }

    public boolean isBuiltin() {
        return name == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValueType other = (ValueType) o;
        return kind == other.kind &&
                Objects.equals(name, other.name) &&
                Objects.equals(origin, other.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, name, origin);
    }

    @Override
    public String toString() {
        if (isBuiltin()) {
            return "ValueType{" + kind + "}";
        }
        if (origin != null) {
            return "ValueType{" + kind + ", " + origin + "." + name + "}";
        }
        return "ValueType{" + kind + ", " + name + "}";
    }

    public enum Kind {
        BOOLEAN,
        BYTES,
        INTEGER,
        FLOAT,
        STRING,
        MAPPING,
        SEQUENCE,
        OBJECT,
        NULL,
        FUNCTION,
        DATETIME,
        QUERY_TERM,     // Term class of the query API
        QUERY_ERROR,    // Error class of the query API
        TEST_HELPER,    // Helper defined by the test harness
        QUERY_CONSTANT, // Well-known constant, named by its constant family
        FOREIGN         // Anything else; never mapped
    }
}
