package com.stealerlens.normalization.parsers;

import com.stealerlens.normalization.LineGrammar;

import java.util.Locale;

/**
 * One input line as seen by the scanner: the raw text, its normalized form
 * (dash prefix and indentation removed) and a lower-cased copy for label matching.
 */
public final class ScanLine {

    private final String raw;
    private final String text;
    private final String lower;
    private final int number;

    public ScanLine(String raw, int number) {
        this.raw = raw != null ? raw : "";
        this.text = LineGrammar.normalizeLine(this.raw);
        this.lower = text.toLowerCase(Locale.ROOT);
        this.number = number;
    }

    public String raw() {
        return raw;
    }

    public String text() {
        return text;
    }

    public String lower() {
        return lower;
    }

    public int number() {
        return number;
    }

    /**
     * Value part of a "Label: Value" line.
     */
    public String value() {
        return LineGrammar.extractValue(text);
    }

    public boolean isBlank() {
        return raw.isBlank();
    }

    @Override
    public String toString() {
        return number + ": " + raw;
    }
}
