package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base class for parsers whose layout can be described by a {@link ParserLayout}.
 *
 * Each parse is a single fold over the lines of the file. Per line, in order:
 * open list continuation, separator handling, section headers, the {@link #handleLine}
 * hook, list headers, then field rules. Subclasses add family quirks through
 * {@link #handleLine} and {@link #finish}.
 */
public abstract class LineScanningParser implements SystemInfoParser {

    private static final Pattern LEADING_COUNTRY_CODE = Pattern.compile("^([A-Z]{2})");

    private final StealerFamily family;
    private final ParserLayout layout;

    protected LineScanningParser(StealerFamily family, ParserLayout layout) {
        this.family = family;
        this.layout = layout;
    }

    @Override
    public ParsedSystemInfo parse(String content, String fileName) throws ParseException {
        ParseState state = new ParseState(new ParsedSystemInfo(family.getTag()), fileName);
        try {
            List<String> lines = LineGrammar.splitLines(content);
            for (int i = 0; i < lines.size(); i++) {
                step(new ScanLine(lines.get(i), i + 1), state);
            }
            closeList(state);
            finish(state);
            return state.result();
        } catch (ParseException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ParseException("Failed to parse " + family.getTag() + " log: " + e.getMessage(),
                e, family.getTag(), fileName);
        }
    }

    @Override
    public StealerFamily getFamily() {
        return family;
    }

    /**
     * Family-specific handling that runs before list and field rules.
     *
     * @return true if the line was consumed
     */
    protected boolean handleLine(ScanLine line, ParseState state) {
        return false;
    }

    /**
     * Runs once after the last line, for combining captured values.
     */
    protected void finish(ParseState state) {
    }

    private void step(ScanLine line, ParseState state) {
        boolean separator = LineGrammar.isSeparatorLine(line.raw());

        ListRule open = state.openList();
        if (open != null) {
            if (!separator && open.isContinuation(line)) {
                String item = open.item(line);
                if (item != null) {
                    state.addListItem(item);
                }
                return;
            }
            closeList(state);
        }

        if (separator) {
            onSeparator(line, state);
            return;
        }

        if (layout.sectionStyle() == SectionStyle.INI) {
            String ini = LineGrammar.extractIniSection(line.text());
            if (ini != null) {
                state.enterSection(LineGrammar.canonicalSection(ini));
                return;
            }
        }

        String header = layout.headerSection(line);
        if (header != null) {
            state.enterSection(header);
            return;
        }

        if (handleLine(line, state)) {
            return;
        }

        for (ListRule rule : layout.listRules()) {
            if (rule.matchesHeader(line, state)) {
                String inline = rule.inlineValue(line);
                if (inline != null) {
                    state.result().offer(rule.field(), inline);
                } else {
                    state.openList(rule);
                }
                return;
            }
        }

        for (FieldRule rule : layout.fieldRules()) {
            if (rule.apply(line, state)) {
                return;
            }
        }
    }

    private void onSeparator(ScanLine line, ParseState state) {
        if (layout.sectionStyle() == SectionStyle.BANNER) {
            String banner = LineGrammar.extractSectionFromSeparator(line.raw());
            if (banner != null) {
                state.enterSection(LineGrammar.canonicalSection(banner));
                return;
            }
        }
        ParserLayout.SectionReset reset = layout.sectionReset();
        if (reset == ParserLayout.SectionReset.ON_SEPARATOR
                || (reset == ParserLayout.SectionReset.ON_DIVIDER && !line.isBlank())) {
            state.enterSection("");
        }
    }

    private static void closeList(ParseState state) {
        ListRule open = state.openList();
        if (open != null) {
            state.result().offer(open.field(), open.collapse(state.listItems()));
            state.closeList();
        }
    }

    /**
     * Country mapper: IP-shaped values are rejected, anything else becomes an ISO code
     * when one can be resolved.
     */
    protected static Function<String, String> country(CountryCodeNormalizer countries) {
        return value -> LineGrammar.isValidIp(value) ? null : countries.toCodeOrRaw(value);
    }

    /**
     * Mapper for values such as "US / United States" that start with an upper-case ISO code.
     * Other values are resolved through the normalizer when {@code fallback} is set, else skipped.
     */
    protected static Function<String, String> leadingCountryCode(CountryCodeNormalizer countries, boolean fallback) {
        return value -> {
            Matcher matcher = LEADING_COUNTRY_CODE.matcher(value);
            if (matcher.find()) {
                return matcher.group(1);
            }
            return fallback ? countries.toCodeOrRaw(value) : null;
        };
    }

    /**
     * Mapper that drops everything from the first match of a regex, e.g. a trailing " (4 cores)".
     */
    protected static Function<String, String> cutAt(String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return value -> {
            Matcher matcher = pattern.matcher(value);
            return matcher.find() ? value.substring(0, matcher.start()).strip() : value;
        };
    }

    /**
     * Mapper that keeps the first capture group of a regex, or null when it does not match.
     */
    protected static Function<String, String> group(String regex) {
        Pattern pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        return value -> {
            Matcher matcher = pattern.matcher(value);
            return matcher.find() ? matcher.group(1).strip() : null;
        };
    }
}
