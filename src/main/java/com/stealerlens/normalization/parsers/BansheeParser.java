package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Banshee macOS stealer logs.
 */
public class BansheeParser extends LineScanningParser {

    public BansheeParser(CountryCodeNormalizer countries) {
        super(StealerFamily.BANSHEE, ParserLayout.builder()
            .field(HWID).startsWith("hwid:")
            .field(LOG_DATE).contains("log date:").map(LineGrammar::extractDatePrefix)
            .field(COUNTRY).contains("country code:").map(country(countries))
            // "John Smith (johnsmith)"
            .field(USERNAME).startsWith("user name:").map(cutAt("\\s*\\([^)]*\\)$")).map(LineGrammar::extractUsername)
            .field(COMPUTER_NAME).startsWith("computer name:")
            .field(OS).contains("operation system:")
            .field(CPU).startsWith("cpu:").map(cutAt("\\s*,\\s*\\d+\\.\\d+\\s+ghz$"))
            .field(RAM).startsWith("ram:")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .build());
    }
}
