package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.SystemInfoField;
import com.stealerlens.normalization.LineGrammar;

import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A list-valued field such as a GPU or antivirus enumeration.
 *
 * The header line either carries the value inline ("GPU: NVIDIA ...") or opens a list
 * whose items follow on continuation lines. The list is collapsed into one value when a
 * non-continuation line, a separator or the end of input is reached.
 */
final class ListRule {

    /**
     * How accumulated items become the field value.
     */
    enum Collapse {
        FIRST,
        JOINED
    }

    private final SystemInfoField field;
    private final Predicate<ScanLine> header;
    private final Set<String> sections;
    private final ContinuationStyle style;
    private final Collapse collapse;
    private final Function<String, String> mapper;

    ListRule(SystemInfoField field, Predicate<ScanLine> header, Set<String> sections,
             ContinuationStyle style, Collapse collapse, Function<String, String> mapper) {
        this.field = field;
        this.header = header;
        this.sections = sections;
        this.style = style;
        this.collapse = collapse;
        this.mapper = mapper;
    }

    boolean matchesHeader(ScanLine line, ParseState state) {
        return !state.result().has(field)
            && (sections.isEmpty() || sections.contains(state.section()))
            && header.test(line);
    }

    /**
     * Inline value of a header line, mapped and cleaned, or null when the list body follows.
     */
    String inlineValue(ScanLine line) {
        return mapItem(line.value());
    }

    boolean isContinuation(ScanLine line) {
        return style.accepts(line) && !header.test(line);
    }

    String item(ScanLine line) {
        return mapItem(style.item(line));
    }

    String collapse(List<String> items) {
        if (items.isEmpty()) {
            return null;
        }
        return collapse == Collapse.FIRST ? items.get(0) : String.join(", ", items);
    }

    SystemInfoField field() {
        return field;
    }

    private String mapItem(String value) {
        String cleaned = LineGrammar.cleanValue(value);
        return cleaned != null ? LineGrammar.cleanValue(mapper.apply(cleaned)) : null;
    }

    @Override
    public String toString() {
        return "ListRule{" + field + ", " + style + ", " + collapse + '}';
    }
}
