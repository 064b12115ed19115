package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Vidar "information.txt". Recent builds redact most identity fields.
 */
public class VidarParser extends LineScanningParser {

    private static final String REDACTED = "[redacted]";

    public VidarParser(CountryCodeNormalizer countries) {
        super(StealerFamily.VIDAR, ParserLayout.builder()
            .sections(SectionStyle.INI)
            .field(IP_ADDRESS).startsWith("ip:").unless(REDACTED).map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").unless(REDACTED).map(country(countries))
            .field(LOG_DATE).startsWith("date:").unless(REDACTED)
            .field(HWID).contains("machineid:").unless(REDACTED)
            .field(HWID).startsWith("hwid:").unless(REDACTED)
            .field(FILE_PATH).startsWith("path:").unless(REDACTED)
            .field(OS).startsWith("windows:")
            .field(COMPUTER_NAME).startsWith("computer name:").unless(REDACTED)
            .field(USERNAME).startsWith("user name:").unless(REDACTED).map(LineGrammar::extractUsername)
            .field(LOG_DATE).contains("local time:").unless(REDACTED)
            .field(CPU).startsWith("processor:").inSection("hardware")
            .field(RAM).startsWith("ram:").inSection("hardware")
            .field(GPU).contains("videocard:").inSection("hardware")
            .build());
    }
}
