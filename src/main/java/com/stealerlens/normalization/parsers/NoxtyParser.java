package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Noxty "identification.txt" files.
 */
public class NoxtyParser extends LineScanningParser {

    public NoxtyParser(CountryCodeNormalizer countries) {
        super(StealerFamily.NOXTY, ParserLayout.builder()
            .field(USERNAME).startsWith("user:").map(LineGrammar::extractUsername)
            .field(OS).contains("operating system:")
            .field(FILE_PATH).contains("process executable path:")
            .field(CPU).startsWith("cpu:").map(cutAt("\\s+\\d+\\.\\d+\\s+ghz$"))
            .field(RAM).startsWith("ram:")
            .field(GPU).startsWith("gpu:").map(cutAt("\\s*\\([^)]*\\)$"))
            .field(HWID).contains("serial number:")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .build());
    }
}
