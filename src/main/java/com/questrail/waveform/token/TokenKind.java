package com.questrail.waveform.token;

/**
 * Discriminant of a {@link VcdToken}.
 * <p>
 * Every concrete token record reports exactly one kind. The kind is carried
 * into structural fault reports so that a caller can locate the offending
 * token without inspecting its payload.
 */
public enum TokenKind
{
    SCOPE,
    UPSCOPE,
    VAR,
    CHANGE_TIME,
    CHANGE_SCALAR,
    CHANGE_VECTOR,
    CHANGE_REAL,
    CHANGE_STRING,
    DATE,
    TIMESCALE,
    VERSION,
    COMMENT;

    /**
     * Returns {@code true} for the four value-change kinds.
     */
    public boolean isChange()
    {
        return this == CHANGE_SCALAR
                || this == CHANGE_VECTOR
                || this == CHANGE_REAL
                || this == CHANGE_STRING;
    }
}
