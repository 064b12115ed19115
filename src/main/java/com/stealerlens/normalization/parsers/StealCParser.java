package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for StealC logs. Fields are grouped under "Network Info:" and "System Summary:"
 * headers; the GPU list follows "GPU:" as indented dash items.
 */
public class StealCParser extends LineScanningParser {

    private static final String NETWORK = "network";
    private static final String SYSTEM = "system";

    public StealCParser(CountryCodeNormalizer countries) {
        super(StealerFamily.STEALC, ParserLayout.builder()
            .sectionHeader(NETWORK, "network info")
            .sectionHeader(SYSTEM, "system summary")
            .list(GPU, ContinuationStyle.INDENTED, ListRule.Collapse.FIRST).startsWith("gpu:").inSection(SYSTEM)
            .field(IP_ADDRESS).startsWith("ip:").inSection(NETWORK).map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").inSection(NETWORK).map(country(countries))
            .field(HWID).startsWith("hwid:").inSection(SYSTEM)
            .field(OS).startsWith("os:").inSection(SYSTEM)
            .field(USERNAME).startsWith("username:").inSection(SYSTEM).map(LineGrammar::extractUsername)
            .field(COMPUTER_NAME).startsWith("computer name:").inSection(SYSTEM)
            .field(LOG_DATE).contains("local time:").inSection(SYSTEM)
            .field(FILE_PATH).contains("running path:").inSection(SYSTEM)
            .field(CPU).startsWith("cpu:").inSection(SYSTEM)
            .field(RAM).startsWith("ram:").inSection(SYSTEM)
            .build());
    }
}
