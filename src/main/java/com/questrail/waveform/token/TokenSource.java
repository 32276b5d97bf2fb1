package com.questrail.waveform.token;

import java.util.List;
import java.util.Objects;

/**
 * TokenSource
 * -----------------------------------------------------------------------------
 * Boundary through which an external tokenizer hands a typed token sequence to
 * the reconstruction layer.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The sequence is ordered and finite</li>
 *   <li>{@link #tokens()} may be called more than once and must return the
 *       same sequence each time</li>
 *   <li>Token {@link VcdToken#index() indices} reflect source order</li>
 * </ul>
 *
 * The reconstruction pass scans the sequence twice (declarations, then
 * timeline) and takes its own immutable snapshot before doing so, so a source
 * backed by a mutable list is safe as long as it is not mutated concurrently.
 */
@FunctionalInterface
public interface TokenSource
{
    /**
     * Returns the full token sequence in source order.
     */
    List<VcdToken> tokens();

    /**
     * Wraps an already materialized token list.
     */
    static TokenSource of(List<? extends VcdToken> tokens)
    {
        Objects.requireNonNull(tokens, "tokens");
        List<VcdToken> snapshot = List.copyOf(tokens);
        return () -> snapshot;
    }
}
