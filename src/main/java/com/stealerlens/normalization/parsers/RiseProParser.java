package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for RisePro "information.txt" files. Hardware lines sit under an INI-style [Hardware] header.
 */
public class RiseProParser extends LineScanningParser {

    public RiseProParser(CountryCodeNormalizer countries) {
        super(StealerFamily.RISEPRO, ParserLayout.builder()
            .sections(SectionStyle.INI)
            .field(LOG_DATE).startsWith("date:").map(LineGrammar::extractDatePrefix)
            .field(HWID).contains("machineid:").unless("[redacted]")
            .field(HWID).startsWith("hwid:").unless("[redacted]")
            .field(FILE_PATH).startsWith("path:")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            // "NL, Amsterdam"
            .field(COUNTRY).startsWith("location:").map(leadingCountryCode(countries, false))
            .field(OS).startsWith("windows:")
            // "DESKTOP-1 [WORKGROUP]"
            .field(COMPUTER_NAME).startsWith("computer name:").map(cutAt("\\s*\\[[^\\]]*\\]$"))
            .field(USERNAME).startsWith("user name:").map(LineGrammar::extractUsername)
            .field(LOG_DATE).contains("local time:").map(LineGrammar::extractDatePrefix)
            .field(CPU).startsWith("processor:").inSection("hardware")
            .field(RAM).startsWith("ram:").inSection("hardware")
            // "#1: NVIDIA GeForce GTX 1060"
            .field(GPU).contains("videocard").inSection("hardware").map(value -> value.replaceFirst("^#\\d+:\\s*", ""))
            .build());
    }
}
