package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Raccoon logs.
 *
 * Host fields live under a "System Information:" header that ends at the next divider;
 * GPUs follow "Display Devices:" as numbered lines.
 */
public class RaccoonParser extends LineScanningParser {

    private static final String SYSTEM = "system";

    private static final Pattern ANY_IP = Pattern.compile("(\\d+\\.\\d+\\.\\d+\\.\\d+)");

    public RaccoonParser(CountryCodeNormalizer countries) {
        super(StealerFamily.RACCOON, ParserLayout.builder()
            .resetSection(ParserLayout.SectionReset.ON_DIVIDER)
            .sectionHeader(SYSTEM, "system information:", "system info:")
            .list(GPU, ContinuationStyle.NUMBERED, ListRule.Collapse.FIRST).contains("display devices:", "display device:")
            .field(IP_ADDRESS).startsWith("ip:").inSection(SYSTEM).map(LineGrammar::extractIp)
            // "52.27, 21.08 | Warsaw, Mazovia, Poland (03-890)"
            .field(COUNTRY).startsWith("location:").inSection(SYSTEM)
                .map(group(",\\s*([^,]+)\\s*\\(")).map(country(countries))
            .field(COMPUTER_NAME).contains("computername:").inSection(SYSTEM)
            .field(USERNAME).startsWith("username:").inSection(SYSTEM).map(LineGrammar::extractUsername)
            .field(OS).contains("product name:").inSection(SYSTEM)
            .field(OS).contains("os:").inSection(SYSTEM)
            .field(CPU).startsWith("cpu:").inSection(SYSTEM).map(cutAt("\\s*\\(\\d+\\s+cores?\\)$"))
            .field(RAM).startsWith("ram:").inSection(SYSTEM).map(cutAt("\\s*\\([^)]*\\)$"))
            // "IP info: PL 31.60.52.174"
            .field(IP_ADDRESS).contains("ip info:").map(value -> {
                Matcher matcher = ANY_IP.matcher(value);
                return matcher.find() ? matcher.group(1) : null;
            })
            .build());
    }
}
