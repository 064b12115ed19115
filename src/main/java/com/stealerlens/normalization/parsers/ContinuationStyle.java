package com.stealerlens.normalization.parsers;

import com.stealerlens.normalization.LineGrammar;

import java.util.regex.Pattern;

/**
 * How the item lines of a list-valued field are laid out under their header line.
 */
public enum ContinuationStyle {

    /**
     * Lines indented by a tab or two or more spaces, optionally dash-prefixed.
     * An indented "Label: value" line is the next field, not an item.
     */
    INDENTED {
        @Override
        boolean accepts(ScanLine line) {
            return LineGrammar.isIndented(line.raw()) && !LineGrammar.isLabelLine(line.text());
        }

        @Override
        String item(ScanLine line) {
            return line.text();
        }
    },

    /**
     * Lines numbered like "0) Intel(R) HD Graphics 5500".
     */
    NUMBERED {
        @Override
        boolean accepts(ScanLine line) {
            return NUMBER_PREFIX.matcher(line.raw().strip()).lookingAt();
        }

        @Override
        String item(ScanLine line) {
            return NUMBER_PREFIX.matcher(line.raw().strip()).replaceFirst("").strip();
        }
    },

    /**
     * Every line up to the next blank or divider line.
     */
    UNTIL_BLANK {
        @Override
        boolean accepts(ScanLine line) {
            return true;
        }

        @Override
        String item(ScanLine line) {
            return line.text();
        }
    };

    private static final Pattern NUMBER_PREFIX = Pattern.compile("^\\d+\\)\\s+");

    abstract boolean accepts(ScanLine line);

    abstract String item(ScanLine line);
}
