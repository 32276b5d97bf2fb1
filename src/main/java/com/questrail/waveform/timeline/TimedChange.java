package com.questrail.waveform.timeline;

import com.questrail.waveform.token.TokenKind;

import java.util.Objects;

/**
 * One value change recorded at a timestamp, together with the token it came
 * from so that later validation can point back at the source.
 */
public record TimedChange(String idCode, String value, int tokenIndex, TokenKind kind)
{
    public TimedChange {
        Objects.requireNonNull(idCode, "idCode");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(kind, "kind");
    }
}
