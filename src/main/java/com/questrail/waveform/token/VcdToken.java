package com.questrail.waveform.token;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Canonical typed representation of a single waveform dump token.
 *
 * <h2>Purpose</h2>
 * <p>
 * {@code VcdToken} is the ONLY form of input the reconstruction layer is
 * permitted to reason about. Lexing of the raw dump (keywords, whitespace,
 * {@code $end} terminators, identifier-code alphabets) happens strictly
 * upstream, in whatever tokenizer feeds a {@link TokenSource}.
 * </p>
 *
 * <h2>Closed variant set</h2>
 * <p>
 * The interface is sealed. Each case is a record carrying only the fields
 * that belong to it, so a consumer can never read, say, an id-code from a
 * timestamp marker. Consumers dispatch with {@code instanceof} patterns.
 * </p>
 *
 * <h2>Position</h2>
 * <p>
 * Every token records its 0-based {@link #index()} within the source
 * sequence. The index is what structural fault reports point at.
 * </p>
 */
public sealed interface VcdToken
        permits VcdToken.ScopeDecl,
                VcdToken.UpScope,
                VcdToken.VarDecl,
                VcdToken.ChangeTime,
                VcdToken.ChangeToken,
                VcdToken.Date,
                VcdToken.Timescale,
                VcdToken.Version,
                VcdToken.Comment
{
    /**
     * Returns the 0-based position of this token in its source sequence.
     */
    int index();

    /**
     * Returns the discriminant of this token.
     */
    TokenKind kind();

    // ---------------------------------------------------------------------
    // Declaration section
    // ---------------------------------------------------------------------

    /**
     * {@code $scope <type> <identifier> $end}
     */
    record ScopeDecl(int index, String scopeType, String identifier) implements VcdToken
    {
        public ScopeDecl {
            Objects.requireNonNull(scopeType, "scopeType");
            Objects.requireNonNull(identifier, "identifier");
        }

        @Override
        public TokenKind kind() {
            return TokenKind.SCOPE;
        }
    }

    /**
     * {@code $upscope $end}; closes the innermost open scope.
     */
    record UpScope(int index) implements VcdToken
    {
        @Override
        public TokenKind kind() {
            return TokenKind.UPSCOPE;
        }
    }

    /**
     * {@code $var <type> <size> <id-code> <reference> [<bit-index>] $end}
     * <p>
     * An absent bit-index marks a scalar (or whole-vector) declaration.
     */
    record VarDecl(int index,
                   String varType,
                   int size,
                   String idCode,
                   String reference,
                   OptionalInt bitIndex) implements VcdToken
    {
        public VarDecl {
            Objects.requireNonNull(varType, "varType");
            Objects.requireNonNull(idCode, "idCode");
            Objects.requireNonNull(reference, "reference");
            Objects.requireNonNull(bitIndex, "bitIndex");
            if (size < 1) {
                throw new IllegalArgumentException("size must be >= 1: " + size);
            }
            if (bitIndex.isPresent() && bitIndex.getAsInt() < 0) {
                throw new IllegalArgumentException("bitIndex must be >= 0: " + bitIndex.getAsInt());
            }
        }

        @Override
        public TokenKind kind() {
            return TokenKind.VAR;
        }
    }

    // ---------------------------------------------------------------------
    // Value change section
    // ---------------------------------------------------------------------

    /**
     * {@code #<time>}
     */
    record ChangeTime(int index, long time) implements VcdToken
    {
        @Override
        public TokenKind kind() {
            return TokenKind.CHANGE_TIME;
        }
    }

    /**
     * Common shape of the four value-change kinds. Any of them qualifies as a
     * change event on its own.
     */
    sealed interface ChangeToken extends VcdToken
            permits ScalarChange, VectorChange, RealChange, StringChange
    {
        String idCode();

        String value();
    }

    /**
     * {@code <value><id-code>}, e.g. {@code 1!}
     */
    record ScalarChange(int index, String idCode, String value) implements ChangeToken
    {
        public ScalarChange {
            Objects.requireNonNull(idCode, "idCode");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public TokenKind kind() {
            return TokenKind.CHANGE_SCALAR;
        }
    }

    /**
     * {@code b<bits> <id-code>}; the value holds the bits without the radix
     * prefix.
     */
    record VectorChange(int index, String idCode, String value) implements ChangeToken
    {
        public VectorChange {
            Objects.requireNonNull(idCode, "idCode");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public TokenKind kind() {
            return TokenKind.CHANGE_VECTOR;
        }
    }

    /**
     * {@code r<number> <id-code>}
     */
    record RealChange(int index, String idCode, String value) implements ChangeToken
    {
        public RealChange {
            Objects.requireNonNull(idCode, "idCode");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public TokenKind kind() {
            return TokenKind.CHANGE_REAL;
        }
    }

    /**
     * {@code s<text> <id-code>}
     */
    record StringChange(int index, String idCode, String value) implements ChangeToken
    {
        public StringChange {
            Objects.requireNonNull(idCode, "idCode");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public TokenKind kind() {
            return TokenKind.CHANGE_STRING;
        }
    }

    // ---------------------------------------------------------------------
    // Header metadata (raw text, never parsed here)
    // ---------------------------------------------------------------------

    record Date(int index, String raw) implements VcdToken
    {
        @Override
        public TokenKind kind() {
            return TokenKind.DATE;
        }
    }

    record Timescale(int index, String raw) implements VcdToken
    {
        @Override
        public TokenKind kind() {
            return TokenKind.TIMESCALE;
        }
    }

    record Version(int index, String raw) implements VcdToken
    {
        @Override
        public TokenKind kind() {
            return TokenKind.VERSION;
        }
    }

    record Comment(int index, String raw) implements VcdToken
    {
        @Override
        public TokenKind kind() {
            return TokenKind.COMMENT;
        }
    }
}
