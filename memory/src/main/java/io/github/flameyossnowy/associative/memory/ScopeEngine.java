package io.github.flameyossnowy.associative.memory;

import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.DuplicateDefinitionException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownScopeException;
import io.github.flameyossnowy.associative.api.options.SortOrder;
import io.github.flameyossnowy.associative.api.scope.ScopeDefinition;
import io.github.flameyossnowy.associative.api.scope.ScopeFunction;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Named scopes per kind, plus the built-in {@value #WHERE} and {@value #ORDER} scopes
 * available on every kind.
 */
public class ScopeEngine {
    public static final String WHERE = "where";
    public static final String ORDER = "order";

    private static final Set<String> BUILT_IN = Set.of(WHERE, ORDER);

    private final Logger logger = LoggerFactory.getLogger(ScopeEngine.class);

    // kind -> scope name -> definition
    private final Map<String, Map<String, ScopeDefinition>> scopes = new HashMap<>(16);

    public @NotNull ScopeDefinition defineScope(@NotNull String kind, @NotNull String name, @NotNull ScopeFunction function) {
        Objects.requireNonNull(function, "Scope function cannot be null");
        if (BUILT_IN.contains(name)) {
            throw new DuplicateDefinitionException("Scope name '" + name + "' is reserved for the built-in scope");
        }

        Map<String, ScopeDefinition> byName = scopes.computeIfAbsent(kind, ignored -> new LinkedHashMap<>());
        if (byName.containsKey(name)) {
            throw new DuplicateDefinitionException("Scope '" + name + "' is already defined on kind " + kind);
        }

        ScopeDefinition definition = new ScopeDefinition(kind, name, function);
        byName.put(name, definition);
        logger.debug("Defined scope {}.{}", kind, name);
        return definition;
    }

    public boolean hasScope(@NotNull String kind, @NotNull String name) {
        if (BUILT_IN.contains(name)) {
            return true;
        }
        Map<String, ScopeDefinition> byName = scopes.get(kind);
        return byName != null && byName.containsKey(name);
    }

    public @NotNull ScopeDefinition scope(@NotNull String kind, @NotNull String name) {
        Map<String, ScopeDefinition> byName = scopes.get(kind);
        ScopeDefinition definition = byName == null ? null : byName.get(name);
        if (definition == null) {
            throw new UnknownScopeException(kind, name);
        }
        return definition;
    }

    /**
     * Applies a scope of {@code kind} to {@code records}.
     * <p>
     * {@code where} takes {@code (attribute, valueOrRange)}; {@code order} takes
     * {@code (column)} or {@code (column, SortOrder)}.
     */
    public @NotNull List<DataRecord> applyScope(
        @NotNull List<DataRecord> records,
        @NotNull String kind,
        @NotNull String name,
        Object @NotNull ... args
    ) {
        switch (name) {
            case WHERE -> {
                return Scopes.where(records, builtInAttribute(name, args), args[1]);
            }
            case ORDER -> {
                return Scopes.order(records, builtInAttribute(name, args), builtInSortOrder(args));
            }
            default -> {
                ScopeDefinition definition = scope(kind, name);
                logger.trace("Applying scope {}.{} {} to {} records", kind, name, Arrays.toString(args), records.size());
                return List.copyOf(definition.function().apply(List.copyOf(records), args));
            }
        }
    }

    public static boolean isBuiltIn(@NotNull String name) {
        return BUILT_IN.contains(name);
    }

    /**
     * Checks the arguments of a built-in scope and returns the attribute they name.
     *
     * @throws IllegalArgumentException on a wrong argument count or type
     */
    public static @NotNull String builtInAttribute(@NotNull String name, Object @NotNull [] args) {
        if (WHERE.equals(name)) {
            requireArguments(name, args, 2, 2);
        } else {
            requireArguments(name, args, 1, 2);
        }
        if (!(args[0] instanceof String attribute)) {
            throw new IllegalArgumentException("Scope '" + name + "' expects an attribute name first, got " + args[0]);
        }
        return attribute;
    }

    public static @NotNull SortOrder builtInSortOrder(Object @NotNull [] args) {
        if (args.length < 2) {
            return SortOrder.ASCENDING;
        }
        if (!(args[1] instanceof SortOrder order)) {
            throw new IllegalArgumentException("Scope '" + ORDER + "' expects a SortOrder second, got " + args[1]);
        }
        return order;
    }

    private static void requireArguments(String name, Object[] args, int min, int max) {
        if (args.length < min || args.length > max) {
            throw new IllegalArgumentException("Scope '" + name + "' takes " + (min == max ? min : min + " to " + max)
                + " arguments, got " + args.length);
        }
    }
}
