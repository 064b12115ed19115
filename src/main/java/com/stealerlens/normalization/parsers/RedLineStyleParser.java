package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Shared layout of the RedLine family ("UserInformation.txt"), also used by its
 * ArechClientV2 fork.
 *
 * The "Hardwares:" block lists devices as "Name: ..." lines without saying which is which,
 * so each one is classified as RAM, CPU or GPU from its text.
 */
public abstract class RedLineStyleParser extends LineScanningParser {

    static final String HARDWARES = "hardwares";

    private static final Pattern RAM_AMOUNT = Pattern.compile("(\\d+\\.?\\d*)\\s*(mb|gb|bytes)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CPU_CORES = Pattern.compile("\\s*,\\s*\\d+\\s+cores?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern GPU_BYTES = Pattern.compile("\\s*,\\s*\\d+\\s+bytes$", Pattern.CASE_INSENSITIVE);

    protected RedLineStyleParser(StealerFamily family, ParserLayout layout) {
        super(family, layout);
    }

    /**
     * Header labels common to RedLine and ArechClientV2.
     *
     * @param withMachineDetails also read "MachineName:" and "Log date:" lines
     */
    protected static ParserLayout layout(CountryCodeNormalizer countries, boolean withMachineDetails) {
        ParserLayout.Builder builder = ParserLayout.builder()
            .resetSection(ParserLayout.SectionReset.ON_SEPARATOR)
            .sectionHeader(HARDWARES, "hardwares:", "hardware:");

        ParserLayout.RuleBuilder rules = builder
            .list(ANTIVIRUS, ContinuationStyle.UNTIL_BLANK, ListRule.Collapse.JOINED).contains("anti-viruses:", "antiviruses:")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .field(FILE_PATH).contains("filelocation:")
            .field(USERNAME).startsWith("username:").map(LineGrammar::extractUsername)
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .field(HWID).startsWith("hwid:")
            .field(OS).contains("operation system:");
        if (withMachineDetails) {
            rules = rules
                .field(COMPUTER_NAME).startsWith("machinename:")
                .field(LOG_DATE).contains("log date:");
        }
        return rules.build();
    }

    @Override
    protected boolean handleLine(ScanLine line, ParseState state) {
        if (!state.inSection(HARDWARES) || !line.lower().startsWith("name:")) {
            return false;
        }
        classifyHardware(line.value(), state.result());
        return true;
    }

    private static void classifyHardware(String value, ParsedSystemInfo result) {
        if (value == null || value.isBlank()) {
            return;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        if (lower.contains("ram")) {
            Matcher matcher = RAM_AMOUNT.matcher(value);
            if (matcher.find()) {
                result.offer(RAM, matcher.group(1) + " " + matcher.group(2).toUpperCase(Locale.ROOT));
            }
        } else if (lower.contains("cpu") || lower.contains("processor")) {
            result.offer(CPU, LineGrammar.cleanValue(CPU_CORES.matcher(value).replaceFirst("")));
        } else if (lower.contains("graphics") || lower.contains("gpu")) {
            result.offer(GPU, LineGrammar.cleanValue(GPU_BYTES.matcher(value).replaceFirst("")));
        }
    }
}
