package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Ailurophile logs ("PC Type: Microsoft Windows ...", "File Path: ...").
 */
public class AilurophileParser extends LineScanningParser {

    public AilurophileParser(CountryCodeNormalizer countries) {
        super(StealerFamily.AILUROPHILE, ParserLayout.builder()
            .field(IP_ADDRESS).startsWith("ip:").unless("[redacted]").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").unless("[redacted]").map(country(countries))
            .field(COMPUTER_NAME).startsWith("hostname:").unless("[redacted]")
            .field(OS).contains("pc type:").unless("[redacted]")
            .field(FILE_PATH).contains("file path:").unless("[redacted]")
            .build());
    }
}
