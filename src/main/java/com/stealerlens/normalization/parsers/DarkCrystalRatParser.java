package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for DarkCrystal RAT logs.
 * Hardware lines read "Unknown (Unknown)" on servers and are skipped in that case.
 */
public class DarkCrystalRatParser extends LineScanningParser {

    public DarkCrystalRatParser(CountryCodeNormalizer countries) {
        super(StealerFamily.DARKCRYSTAL_RAT, ParserLayout.builder()
            .field(COMPUTER_NAME).startsWith("pc name:")
            .field(USERNAME).startsWith("user name:").map(LineGrammar::extractUsername)
            .field(OS).startsWith("windows:")
            .field(CPU).startsWith("cpu name:").unless("unknown")
            .field(GPU).startsWith("gpu name:").unless("unknown")
            .field(RAM).startsWith("ram:").unless("unknown")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            // "US / United States"
            .field(COUNTRY).startsWith("country:").map(leadingCountryCode(countries, true))
            .field(LOG_DATE).contains("save time:").map(LineGrammar::extractDatePrefix)
            .field(FILE_PATH).startsWith("path:")
            .build());
    }
}
