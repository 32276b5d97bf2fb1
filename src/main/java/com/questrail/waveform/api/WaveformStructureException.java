package com.questrail.waveform.api;

import com.questrail.waveform.token.TokenKind;

import java.util.Objects;

/**
 * Indicates that a token sequence could not be reconstructed into a
 * consistent declaration tree or timeline.
 *
 * This typically reflects:
 * <ul>
 *   <li>A declaration outside any scope, or an unbalanced upscope</li>
 *   <li>A value change before the first timestamp</li>
 *   <li>A timestamp that goes backwards</li>
 *   <li>A value change referencing an undeclared id-code</li>
 * </ul>
 *
 * The exception identifies the offending token by its source index and kind.
 * A pass that raises it produces no partial result.
 */
public final class WaveformStructureException extends RuntimeException
{
    private final StructuralFault fault;
    private final int tokenIndex;
    private final TokenKind tokenKind;

    public WaveformStructureException(StructuralFault fault,
                                      int tokenIndex,
                                      TokenKind tokenKind,
                                      String detail) {
        super(fault + " at token " + tokenIndex + " (" + tokenKind + "): " + detail);
        this.fault = Objects.requireNonNull(fault, "fault");
        this.tokenIndex = tokenIndex;
        this.tokenKind = Objects.requireNonNull(tokenKind, "tokenKind");
    }

    public StructuralFault fault() {
        return fault;
    }

    public int tokenIndex() {
        return tokenIndex;
    }

    public TokenKind tokenKind() {
        return tokenKind;
    }
}
