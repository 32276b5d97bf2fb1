package com.questrail.waveform.api;

/**
 * Kinds of corruption that abort a reconstruction pass.
 */
public enum StructuralFault
{
    /** A variable declaration with no enclosing scope. */
    VAR_OUTSIDE_SCOPE,

    /** An upscope with no open scope to close. */
    UNBALANCED_UPSCOPE,

    /** A value change before any timestamp marker. */
    CHANGE_BEFORE_TIMESTAMP,

    /** A timestamp marker lower than its predecessor. */
    TIMESTAMP_REGRESSION,

    /** A value change whose id-code matches no declaration. */
    UNDECLARED_ID_CODE,

    /** A bit value with more characters than its declared width. */
    VALUE_WIDER_THAN_DECLARATION
}
