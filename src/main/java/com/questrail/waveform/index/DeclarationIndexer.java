package com.questrail.waveform.index;

import com.questrail.waveform.api.StructuralFault;
import com.questrail.waveform.api.WaveformStructureException;
import com.questrail.waveform.token.VcdToken;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DeclarationIndexer
 * -----------------------------------------------------------------------------
 * Pure, deterministic fold that turns a token sequence into a
 * {@link DeclarationIndex}.
 *
 * <h2>Role in the architecture</h2>
 * This is the first of the two independent passes over a token sequence. It
 * looks only at scope and variable declarations and ignores everything else.
 * <p>
 * It is intentionally:
 * <ul>
 *   <li>Pure (no I/O, no logging, no shared state)</li>
 *   <li>Deterministic</li>
 *   <li>Strict: structural faults abort the fold</li>
 * </ul>
 *
 * <h2>Scope cursor</h2>
 * Open scopes are tracked on a stack local to the fold. A declaration is
 * filed under the dot-joined path of the open scopes; for a dump whose scopes
 * never nest this is simply the scope identifier. Re-opening a path that was
 * already seen adds to its existing entry.
 */
public final class DeclarationIndexer
{
    /** Separator between scope identifiers in a scope path. */
    public static final String SCOPE_SEPARATOR = ".";

    /**
     * Folds the whole token sequence into an index.
     *
     * @param tokens the token sequence, in source order
     * @return the finished, immutable index
     * @throws WaveformStructureException on a declaration outside any scope or
     *         an unbalanced upscope
     */
    public DeclarationIndex index(List<? extends VcdToken> tokens) {
        Objects.requireNonNull(tokens, "tokens");

        Accumulator acc = new Accumulator();
        for (VcdToken token : tokens) {
            apply(acc, token);
        }
        return new DeclarationIndex(acc.byScope);
    }

    private static void apply(Accumulator acc, VcdToken token) {
        if (token instanceof VcdToken.ScopeDecl s) {
            acc.scopes.push(s.identifier());
            acc.byScope.computeIfAbsent(acc.currentPath(), k -> new LinkedHashMap<>());
        }
        else if (token instanceof VcdToken.UpScope u) {
            if (acc.scopes.isEmpty()) {
                throw new WaveformStructureException(
                        StructuralFault.UNBALANCED_UPSCOPE, u.index(), u.kind(),
                        "no open scope to close");
            }
            acc.scopes.pop();
        }
        else if (token instanceof VcdToken.VarDecl v) {
            if (acc.scopes.isEmpty()) {
                throw new WaveformStructureException(
                        StructuralFault.VAR_OUTSIDE_SCOPE, v.index(), v.kind(),
                        "variable '" + v.reference() + "' declared before any scope");
            }
            String path = acc.currentPath();
            Declaration decl = new Declaration(
                    path, v.reference(), v.bitIndex(), v.idCode(), v.size(), v.varType());

            // A repeated (scope, reference, bit-index) replaces only its own slot.
            acc.byScope.get(path)
                    .computeIfAbsent(v.reference(), k -> new LinkedHashMap<>())
                    .put(decl.slotKey(), decl);
        }
    }

    private static final class Accumulator
    {
        // Innermost scope on top.
        final Deque<String> scopes = new ArrayDeque<>();
        final Map<String, Map<String, Map<Integer, Declaration>>> byScope = new LinkedHashMap<>();

        String currentPath() {
            StringBuilder sb = new StringBuilder();
            Iterator<String> outermostFirst = scopes.descendingIterator();
            while (outermostFirst.hasNext()) {
                if (sb.length() > 0) {
                    sb.append(SCOPE_SEPARATOR);
                }
                sb.append(outermostFirst.next());
            }
            return sb.toString();
        }
    }
}
