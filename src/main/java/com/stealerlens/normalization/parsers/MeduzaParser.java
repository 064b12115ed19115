package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Meduza "UserInfo.txt" files.
 */
public class MeduzaParser extends LineScanningParser {

    public MeduzaParser(CountryCodeNormalizer countries) {
        super(StealerFamily.MEDUZA, ParserLayout.builder()
            .field(HWID).startsWith("hwid:")
            .field(LOG_DATE).contains("log date:").map(LineGrammar::extractDatePrefix)
            .field(COUNTRY).contains("country code:").map(country(countries))
            .field(USERNAME).startsWith("user name:").map(LineGrammar::extractUsername)
            .field(COMPUTER_NAME).startsWith("computer name:")
            .field(OS).contains("operation system:", "operating system:")
            .field(CPU).startsWith("cpu:").map(cutAt("\\s*,\\s*\\d+\\s+cores?$"))
            .field(GPU).startsWith("gpu:")
            .field(RAM).startsWith("ram:")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .field(FILE_PATH).contains("execute path:")
            .build());
    }
}
