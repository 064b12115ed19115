package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.SystemInfoField;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Declarative description of one stealer family's text layout: how sections are marked,
 * which label lines fill which fields, and which fields are enumerated as lists.
 *
 * <pre>
 * ParserLayout.builder()
 *     .sections(SectionStyle.INI)
 *     .field(SystemInfoField.IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
 *     .field(SystemInfoField.CPU).startsWith("processor:").inSection("hardware")
 *     .list(SystemInfoField.GPU, ContinuationStyle.INDENTED, ListRule.Collapse.FIRST).startsWith("gpu:")
 *     .build();
 * </pre>
 *
 * Rules are evaluated in declaration order.
 */
public final class ParserLayout {

    /**
     * When the current section is cleared.
     */
    public enum SectionReset {
        NEVER,
        /** On non-blank separator lines only. */
        ON_DIVIDER,
        /** On every separator line, blank lines included. */
        ON_SEPARATOR
    }

    private final SectionStyle sectionStyle;
    private final SectionReset sectionReset;
    private final Map<String, String> sectionHeaders;
    private final List<FieldRule> fieldRules;
    private final List<ListRule> listRules;

    private ParserLayout(Builder builder) {
        this.sectionStyle = builder.sectionStyle;
        this.sectionReset = builder.sectionReset;
        this.sectionHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sectionHeaders));
        this.fieldRules = List.copyOf(builder.fieldRules);
        this.listRules = List.copyOf(builder.listRules);
    }

    public static Builder builder() {
        return new Builder();
    }

    SectionStyle sectionStyle() {
        return sectionStyle;
    }

    SectionReset sectionReset() {
        return sectionReset;
    }

    /**
     * Section named by a label-style header line such as "Network Info:", or null.
     */
    String headerSection(ScanLine line) {
        for (Map.Entry<String, String> entry : sectionHeaders.entrySet()) {
            if (line.lower().contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    List<FieldRule> fieldRules() {
        return fieldRules;
    }

    List<ListRule> listRules() {
        return listRules;
    }

    public static final class Builder {

        private SectionStyle sectionStyle = SectionStyle.NONE;
        private SectionReset sectionReset = SectionReset.NEVER;
        private final Map<String, String> sectionHeaders = new LinkedHashMap<>();
        private final List<FieldRule> fieldRules = new ArrayList<>();
        private final List<ListRule> listRules = new ArrayList<>();

        private Builder() {
        }

        public Builder sections(SectionStyle style) {
            this.sectionStyle = style;
            return this;
        }

        public Builder resetSection(SectionReset reset) {
            this.sectionReset = reset;
            return this;
        }

        /**
         * Lines containing any of the labels switch the current section to {@code section}.
         */
        public Builder sectionHeader(String section, String... labels) {
            for (String label : labels) {
                sectionHeaders.put(label.toLowerCase(Locale.ROOT), section);
            }
            return this;
        }

        public RuleBuilder field(SystemInfoField field) {
            return new RuleBuilder(this, field, null, null, null);
        }

        /**
         * Rule that stores its value under a key for a later combining step instead of a field.
         */
        public RuleBuilder capture(String key) {
            return new RuleBuilder(this, null, key, null, null);
        }

        public RuleBuilder list(SystemInfoField field, ContinuationStyle style, ListRule.Collapse collapse) {
            return new RuleBuilder(this, field, null, style, collapse);
        }

        public ParserLayout build() {
            return new ParserLayout(this);
        }
    }

    /**
     * Builds one rule, then hands back to the layout builder on the next {@code field},
     * {@code capture}, {@code list} or {@code build} call.
     */
    public static final class RuleBuilder {

        private final Builder parent;
        private final SystemInfoField field;
        private final String captureKey;
        private final ContinuationStyle listStyle;
        private final ListRule.Collapse collapse;

        private Predicate<ScanLine> matcher;
        private final Set<String> sections = new LinkedHashSet<>();
        private Function<ScanLine, String> extractor = ScanLine::value;
        private Function<String, String> mapper = Function.identity();

        private RuleBuilder(Builder parent, SystemInfoField field, String captureKey,
                            ContinuationStyle listStyle, ListRule.Collapse collapse) {
            this.parent = parent;
            this.field = field;
            this.captureKey = captureKey;
            this.listStyle = listStyle;
            this.collapse = collapse;
        }

        /**
         * Line starts with any of the labels (case-insensitive).
         */
        public RuleBuilder startsWith(String... labels) {
            List<String> lowered = lower(labels);
            return and(line -> lowered.stream().anyMatch(line.lower()::startsWith));
        }

        /**
         * Line contains any of the labels (case-insensitive).
         */
        public RuleBuilder contains(String... labels) {
            List<String> lowered = lower(labels);
            return and(line -> lowered.stream().anyMatch(line.lower()::contains));
        }

        public RuleBuilder containsAll(String... labels) {
            List<String> lowered = lower(labels);
            return and(line -> lowered.stream().allMatch(line.lower()::contains));
        }

        /**
         * Line contains none of the given fragments.
         */
        public RuleBuilder unless(String... fragments) {
            List<String> lowered = lower(fragments);
            return and(line -> lowered.stream().noneMatch(line.lower()::contains));
        }

        public RuleBuilder when(Predicate<ScanLine> predicate) {
            return and(predicate);
        }

        public RuleBuilder inSection(String... names) {
            sections.addAll(Arrays.asList(names));
            return this;
        }

        /**
         * Replace the default "text after the label separator" extraction.
         */
        public RuleBuilder value(Function<ScanLine, String> extractor) {
            this.extractor = extractor;
            return this;
        }

        /**
         * Post-process the cleaned value; returning null skips the rule.
         */
        public RuleBuilder map(Function<String, String> mapper) {
            this.mapper = this.mapper.andThen(value -> value != null ? mapper.apply(value) : null);
            return this;
        }

        public RuleBuilder field(SystemInfoField next) {
            commit();
            return parent.field(next);
        }

        public RuleBuilder capture(String key) {
            commit();
            return parent.capture(key);
        }

        public RuleBuilder list(SystemInfoField next, ContinuationStyle style, ListRule.Collapse collapse) {
            commit();
            return parent.list(next, style, collapse);
        }

        public ParserLayout build() {
            commit();
            return parent.build();
        }

        private RuleBuilder and(Predicate<ScanLine> predicate) {
            matcher = matcher == null ? predicate : matcher.and(predicate);
            return this;
        }

        private void commit() {
            if (matcher == null) {
                throw new IllegalStateException("Rule for " + (field != null ? field : captureKey) + " has no label");
            }
            Set<String> scope = Set.copyOf(sections);
            if (listStyle != null) {
                parent.listRules.add(new ListRule(field, matcher, scope, listStyle, collapse, mapper));
            } else {
                parent.fieldRules.add(new FieldRule(field, captureKey, matcher, scope, extractor, mapper));
            }
        }

        private static List<String> lower(String... labels) {
            List<String> lowered = new ArrayList<>(labels.length);
            for (String label : labels) {
                lowered.add(label.toLowerCase(Locale.ROOT));
            }
            return lowered;
        }
    }
}
