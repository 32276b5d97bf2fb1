package com.questrail.waveform.render;

import java.util.Objects;

/**
 * Aggregated configuration for timing-diagram rendering.
 *
 * @param beginMarker line emitted before the first channel
 * @param endMarker   line emitted after the last channel
 * @param indent      prefix of every channel line
 * @param symbolStyle spelling of channel values inside segment braces
 */
public record DiagramConfig(
    String beginMarker,
    String endMarker,
    String indent,
    SymbolStyle symbolStyle
) {
    public static final String TIKZ_BEGIN = "\\begin{tikztimingtable}";
    public static final String TIKZ_END = "\\end{tikztimingtable}";

    public DiagramConfig {
        Objects.requireNonNull(beginMarker, "beginMarker");
        Objects.requireNonNull(endMarker, "endMarker");
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(symbolStyle, "symbolStyle");
    }

    public static DiagramConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String beginMarker = TIKZ_BEGIN;
        private String endMarker = TIKZ_END;
        private String indent = "\t";
        private SymbolStyle symbolStyle = SymbolStyle.RAW;

        public Builder withBeginMarker(String beginMarker) {
            this.beginMarker = beginMarker;
            return this;
        }

        public Builder withEndMarker(String endMarker) {
            this.endMarker = endMarker;
            return this;
        }

        public Builder withIndent(String indent) {
            this.indent = indent;
            return this;
        }

        public Builder withSymbolStyle(SymbolStyle symbolStyle) {
            this.symbolStyle = symbolStyle;
            return this;
        }

        public DiagramConfig build() {
            return new DiagramConfig(beginMarker, endMarker, indent, symbolStyle);
        }
    }
}
