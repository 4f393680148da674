package me.christianrobert.polyconv.analysis;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Ambient scope while analyzing one subtree.
 *
 * <p>Holds the identifiers currently bound to the query-API root and whether the subtree is
 * being passed into a query-API call ({@code inheritedContext}). Immutable: entering a child
 * scope creates a new instance, so sibling subtrees never see each other's bindings.</p>
 */
public final class AnalysisScope {

    private final Set<String> queryRootNames;
    private final boolean inheritedContext;

    public AnalysisScope(Set<String> queryRootNames, boolean inheritedContext) {
        if (queryRootNames == null) {
            throw new IllegalArgumentException("Query root names cannot be null");
        }
        this.queryRootNames = Collections.unmodifiableSet(new LinkedHashSet<>(queryRootNames));
        this.inheritedContext = inheritedContext;
    }

    public Set<String> getQueryRootNames() {
        return queryRootNames;
    }

    public boolean isInheritedContext() {
        return inheritedContext;
    }

    public boolean isQueryRoot(String name) {
        return queryRootNames.contains(name);
    }

    /**
     * Same root names, different inherited flag.
     */
    public AnalysisScope withInheritedContext(boolean inherited) {
        if (inherited == inheritedContext) {
            return this;
        }
        return new AnalysisScope(queryRootNames, inherited);
    }

    /**
     * Child scope for a lambda body: root names extended by the parameters, inherited flag cleared.
     */
    public AnalysisScope extendedWith(Collection<String> names) {
        Set<String> extended = new LinkedHashSet<>(queryRootNames);
        extended.addAll(names);
        return new AnalysisScope(extended, false);
    }

    @Override
    public String toString() {
        return "AnalysisScope{queryRootNames=" + queryRootNames + ", inheritedContext=" + inheritedContext + "}";
    }
}
