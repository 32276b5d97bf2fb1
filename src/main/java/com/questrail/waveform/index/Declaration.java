package com.questrail.waveform.index;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * A single declared variable, placed in its scope.
 *
 * @param scope     dot-joined path of the enclosing scopes
 * @param reference the variable's reference name; sibling slices share it
 * @param bitIndex  the slice's bit-index, or empty for a scalar or whole vector
 * @param idCode    identifier used by value changes to address this variable
 * @param size      declared bit-width
 * @param varType   declared type keyword, e.g. {@code wire}, {@code reg}, {@code real}
 */
public record Declaration(String scope,
                          String reference,
                          OptionalInt bitIndex,
                          String idCode,
                          int size,
                          String varType)
{
    public Declaration {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(bitIndex, "bitIndex");
        Objects.requireNonNull(idCode, "idCode");
        Objects.requireNonNull(varType, "varType");
    }

    /**
     * Returns the slot key under which this declaration is indexed among its
     * siblings: its bit-index, or {@link DeclarationIndex#NO_BIT_INDEX}.
     */
    public int slotKey() {
        return bitIndex.orElse(DeclarationIndex.NO_BIT_INDEX);
    }

    /**
     * Returns {@code true} for declarations whose values are text rather than
     * bit vectors.
     */
    public boolean isTextual() {
        return "real".equals(varType)
                || "realtime".equals(varType)
                || "string".equals(varType);
    }
}
