package me.christianrobert.polyconv.context;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Settings a code builder reads while rendering one snippet.
 *
 * <p>Immutable; the {@code with*} methods return modified copies.</p>
 *
 * <ul>
 *   <li>declaredType - value type for typed assignment targets (may be null)</li>
 *   <li>castNulls - precede null call arguments with a cast to the query expression type</li>
 *   <li>smartBracket - render string/integer subscripts as dedicated lookup calls</li>
 *   <li>queryRootNames - identifiers bound to the query-API root; the first is the default</li>
 * </ul>
 */
public class EmitterConfig {

    public static final String DEFAULT_ROOT_NAME = "r";

    private static final EmitterConfig DEFAULTS =
        new EmitterConfig(null, true, true, Set.of(DEFAULT_ROOT_NAME));

    private final ValueType declaredType;
    private final boolean castNulls;
    private final boolean smartBracket;
    private final Set<String> queryRootNames;

    private EmitterConfig(ValueType declaredType, boolean castNulls, boolean smartBracket, Set<String> queryRootNames) {
        if (queryRootNames == null || queryRootNames.isEmpty()) {
            throw new IllegalArgumentException("At least one query root name is required");
        }
        this.declaredType = declaredType;
        this.castNulls = castNulls;
        this.smartBracket = smartBracket;
        this.queryRootNames = Collections.unmodifiableSet(new LinkedHashSet<>(queryRootNames));
    }

    public static EmitterConfig defaults() {
        return DEFAULTS;
    }

    public EmitterConfig withDeclaredType(ValueType type) {
        return new EmitterConfig(type, castNulls, smartBracket, queryRootNames);
    }

    public EmitterConfig withCastNulls(boolean enabled) {
        return new EmitterConfig(declaredType, enabled, smartBracket, queryRootNames);
    }

    public EmitterConfig withSmartBracket(boolean enabled) {
        return new EmitterConfig(declaredType, castNulls, enabled, queryRootNames);
    }

    public EmitterConfig withQueryRootNames(Set<String> rootNames) {
        return new EmitterConfig(declaredType, castNulls, smartBracket, rootNames);
    }

    public ValueType getDeclaredType() {
        return declaredType;
    }

    public boolean isCastNulls() {
        return castNulls;
    }

    public boolean isSmartBracket() {
        return smartBracket;
    }

    public Set<String> getQueryRootNames() {
        return queryRootNames;
    }

    /**
     * Root name used when the builder has to introduce a query-API call of its own
     * ({@code r.expr(...)}, {@code r.hashMap(...)}).
     */
    public String getDefaultRootName() {
        return queryRootNames.iterator().next();
    }

    public boolean isQueryRoot(String name) {
        return queryRootNames.contains(name);
    }

    @Override
    public String toString() {
        return "EmitterConfig{declaredType=" + declaredType +
                ", castNulls=" + castNulls +
                ", smartBracket=" + smartBracket +
                ", queryRootNames=" + queryRootNames + "}";
    }
}
