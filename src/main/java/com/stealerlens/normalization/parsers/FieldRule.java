package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.SystemInfoField;
import com.stealerlens.normalization.LineGrammar;

import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One "label → field" row of a parser layout.
 *
 * A rule fires when its field is still empty, the current section is in scope and the
 * line matches. The extracted value is cleaned, mapped and cleaned again; a rule whose
 * value ends up null does not fire and the line is offered to the next rule.
 */
final class FieldRule {

    private final SystemInfoField field;
    private final String captureKey;
    private final Predicate<ScanLine> matcher;
    private final Set<String> sections;
    private final Function<ScanLine, String> extractor;
    private final Function<String, String> mapper;

    FieldRule(SystemInfoField field, String captureKey, Predicate<ScanLine> matcher, Set<String> sections,
              Function<ScanLine, String> extractor, Function<String, String> mapper) {
        this.field = field;
        this.captureKey = captureKey;
        this.matcher = matcher;
        this.sections = sections;
        this.extractor = extractor;
        this.mapper = mapper;
    }

    boolean apply(ScanLine line, ParseState state) {
        if (isFilled(state) || !inScope(state) || !matcher.test(line)) {
            return false;
        }
        String value = LineGrammar.cleanValue(extractor.apply(line));
        if (value == null) {
            return false;
        }
        String mapped = LineGrammar.cleanValue(mapper.apply(value));
        if (mapped == null) {
            return false;
        }
        return field != null ? state.result().offer(field, mapped) : state.capture(captureKey, mapped);
    }

    private boolean isFilled(ParseState state) {
        return field != null ? state.result().has(field) : state.hasCaptured(captureKey);
    }

    private boolean inScope(ParseState state) {
        return sections.isEmpty() || sections.contains(state.section());
    }

    @Override
    public String toString() {
        return "FieldRule{" + (field != null ? field : "capture:" + captureKey) + ", sections=" + sections + '}';
    }
}
