package com.questrail.waveform.token;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;

/**
 * TokenSequenceBuilder
 * -----------------------------------------------------------------------------
 * Builder for assembling a {@link VcdToken} sequence incrementally, assigning
 * each token the next source index.
 *
 * <h2>Purpose</h2>
 * This class exists to:
 * <ul>
 *   <li>Give tokenizer adapters a single place to emit typed tokens</li>
 *   <li>Keep token indices consistent with emission order</li>
 *   <li>Make hand-written token fixtures readable</li>
 * </ul>
 *
 * The builder is mutable; {@link #build()} returns an immutable copy.
 */
public final class TokenSequenceBuilder
{
    private final List<VcdToken> tokens = new ArrayList<>();

    private int next() {
        return tokens.size();
    }

    public TokenSequenceBuilder date(String raw) {
        tokens.add(new VcdToken.Date(next(), raw));
        return this;
    }

    public TokenSequenceBuilder timescale(String raw) {
        tokens.add(new VcdToken.Timescale(next(), raw));
        return this;
    }

    public TokenSequenceBuilder version(String raw) {
        tokens.add(new VcdToken.Version(next(), raw));
        return this;
    }

    public TokenSequenceBuilder comment(String raw) {
        tokens.add(new VcdToken.Comment(next(), raw));
        return this;
    }

    /**
     * Opens a {@code module} scope.
     */
    public TokenSequenceBuilder scope(String identifier) {
        return scope("module", identifier);
    }

    public TokenSequenceBuilder scope(String scopeType, String identifier) {
        tokens.add(new VcdToken.ScopeDecl(next(), scopeType, identifier));
        return this;
    }

    public TokenSequenceBuilder upscope() {
        tokens.add(new VcdToken.UpScope(next()));
        return this;
    }

    /**
     * Declares a 1-bit {@code wire} without a bit-index.
     */
    public TokenSequenceBuilder wire(String idCode, String reference) {
        return var("wire", 1, idCode, reference, OptionalInt.empty());
    }

    /**
     * Declares a 1-bit {@code wire} slice carrying a bit-index.
     */
    public TokenSequenceBuilder wireBit(String idCode, String reference, int bitIndex) {
        return var("wire", 1, idCode, reference, OptionalInt.of(bitIndex));
    }

    /**
     * Declares a {@code size}-bit {@code wire} vector without a bit-index.
     */
    public TokenSequenceBuilder vector(String idCode, String reference, int size) {
        return var("wire", size, idCode, reference, OptionalInt.empty());
    }

    public TokenSequenceBuilder var(String varType, int size, String idCode,
                                    String reference, OptionalInt bitIndex) {
        tokens.add(new VcdToken.VarDecl(next(), varType, size, idCode, reference, bitIndex));
        return this;
    }

    public TokenSequenceBuilder time(long time) {
        tokens.add(new VcdToken.ChangeTime(next(), time));
        return this;
    }

    public TokenSequenceBuilder scalar(String idCode, String value) {
        tokens.add(new VcdToken.ScalarChange(next(), idCode, value));
        return this;
    }

    public TokenSequenceBuilder vectorChange(String idCode, String value) {
        tokens.add(new VcdToken.VectorChange(next(), idCode, value));
        return this;
    }

    public TokenSequenceBuilder real(String idCode, String value) {
        tokens.add(new VcdToken.RealChange(next(), idCode, value));
        return this;
    }

    public TokenSequenceBuilder string(String idCode, String value) {
        tokens.add(new VcdToken.StringChange(next(), idCode, value));
        return this;
    }

    public List<VcdToken> build() {
        return List.copyOf(tokens);
    }

    public TokenSource toSource() {
        return TokenSource.of(tokens);
    }
}
