package com.questrail.waveform.render;

/**
 * How a channel value is spelled inside a segment's braces.
 */
public enum SymbolStyle
{
    /**
     * The channel value, verbatim.
     */
    RAW {
        @Override
        public String symbol(String value) {
            return value;
        }
    },

    /**
     * tikz-timing level letters: {@code 1 -> H}, {@code 0 -> L}, unknown and
     * high-impedance as {@code X} and {@code Z}. Any multi-character value is
     * drawn as a data bus labelled with the value, {@code D{value}}.
     */
    TIKZ_TIMING {
        @Override
        public String symbol(String value) {
            if (value.length() != 1) {
                return "D{" + value + "}";
            }
            switch (value.charAt(0)) {
                case '1':
                    return "H";
                case '0':
                    return "L";
                case 'x':
                case 'X':
                    return "X";
                case 'z':
                case 'Z':
                    return "Z";
                default:
                    return value;
            }
        }
    };

    /**
     * Maps a channel value to its rendered symbol.
     */
    public abstract String symbol(String value);
}
