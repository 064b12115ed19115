package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Rhadamanthys logs. Identity fields are often "[redacted]" by the builder
 * and are skipped in that case.
 */
public class RhadamanthysParser extends LineScanningParser {

    public RhadamanthysParser(CountryCodeNormalizer countries) {
        super(StealerFamily.RHADAMANTHYS, ParserLayout.builder()
            .field(LOG_DATE).contains("install date:").map(LineGrammar::extractDatePrefix)
            .field(HWID).startsWith("hwid:").unless("[redacted]")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .field(CPU).startsWith("processor:")
            .field(RAM).contains("installed ram:")
            .field(OS).startsWith("os:")
            .field(GPU).contains("video card:")
            .field(COMPUTER_NAME).startsWith("computer name:").unless("[redacted]")
            .field(USERNAME).startsWith("user name:").unless("[redacted]").map(LineGrammar::extractUsername)
            .field(HWID).contains("machineid:").unless("[redacted]")
            .build());
    }
}
