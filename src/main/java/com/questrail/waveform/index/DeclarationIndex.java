package com.questrail.waveform.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * DeclarationIndex
 * -----------------------------------------------------------------------------
 * Immutable three-level mapping built from a token sequence:
 *
 * <pre>
 *   scope -> reference -> slot key -> Declaration
 * </pre>
 *
 * The slot key is the declaration's bit-index, or {@link #NO_BIT_INDEX} for a
 * declaration that carries none. Every level preserves declaration order.
 *
 * <h2>Siblings</h2>
 * All declarations under one (scope, reference) pair are <em>siblings</em>:
 * the bit slices of one logical channel. A scalar signal is a sibling group of
 * one.
 *
 * <h2>Id-codes</h2>
 * The index also answers which declarations a given id-code belongs to. An
 * id-code may legitimately be shared by several declarations (the same net
 * visible in several scopes).
 */
public final class DeclarationIndex
{
    /** Slot key for declarations that carry no bit-index. */
    public static final int NO_BIT_INDEX = -1;

    private final Map<String, Map<String, Map<Integer, Declaration>>> byScope;
    private final Map<String, List<Declaration>> byIdCode;

    DeclarationIndex(Map<String, Map<String, Map<Integer, Declaration>>> byScope) {
        Map<String, Map<String, Map<Integer, Declaration>>> scopes = new LinkedHashMap<>();
        Map<String, List<Declaration>> ids = new LinkedHashMap<>();
        byScope.forEach((scope, refs) -> {
            Map<String, Map<Integer, Declaration>> copy = new LinkedHashMap<>();
            refs.forEach((ref, slots) -> {
                copy.put(ref, Collections.unmodifiableMap(new LinkedHashMap<>(slots)));
                for (Declaration d : slots.values()) {
                    ids.computeIfAbsent(d.idCode(), k -> new ArrayList<>()).add(d);
                }
            });
            scopes.put(scope, Collections.unmodifiableMap(copy));
        });
        this.byScope = Collections.unmodifiableMap(scopes);

        ids.replaceAll((id, decls) -> List.copyOf(decls));
        this.byIdCode = Collections.unmodifiableMap(ids);
    }

    /**
     * Returns the scope names in declaration order.
     */
    public Set<String> scopes() {
        return byScope.keySet();
    }

    /**
     * Returns the reference names declared directly in {@code scope}, in
     * declaration order; empty if the scope is unknown.
     */
    public Set<String> references(String scope) {
        Objects.requireNonNull(scope, "scope");
        return byScope.getOrDefault(scope, Map.of()).keySet();
    }

    /**
     * Returns the sibling declarations of one logical channel keyed by slot,
     * in declaration order; empty if unknown.
     */
    public Map<Integer, Declaration> siblings(String scope, String reference) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(reference, "reference");
        return byScope.getOrDefault(scope, Map.of()).getOrDefault(reference, Map.of());
    }

    /**
     * Returns the full nested mapping.
     */
    public Map<String, Map<String, Map<Integer, Declaration>>> asMap() {
        return byScope;
    }

    public boolean isDeclared(String idCode) {
        return byIdCode.containsKey(idCode);
    }

    /**
     * Returns every declaration using {@code idCode}; empty if undeclared.
     */
    public List<Declaration> declarationsFor(String idCode) {
        Objects.requireNonNull(idCode, "idCode");
        return byIdCode.getOrDefault(idCode, List.of());
    }

    /**
     * Returns the number of (scope, reference) groups, i.e. the number of
     * channels this index will reconstruct into.
     */
    public int groupCount() {
        int n = 0;
        for (Map<String, Map<Integer, Declaration>> refs : byScope.values()) {
            n += refs.size();
        }
        return n;
    }
}
