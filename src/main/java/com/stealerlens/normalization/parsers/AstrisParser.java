package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Astris logs, INI sections [General], [Machine], [Geolocation], [Network], [Hardware].
 */
public class AstrisParser extends LineScanningParser {

    public AstrisParser(CountryCodeNormalizer countries) {
        super(StealerFamily.ASTRIS, ParserLayout.builder()
            .sections(SectionStyle.INI)
            .field(HWID).startsWith("hwid:").inSection("general")
            .field(LOG_DATE).startsWith("date:").inSection("general")
            .field(COMPUTER_NAME).startsWith("computer name:").inSection("machine")
            .field(USERNAME).startsWith("user name:").inSection("machine").map(LineGrammar::extractUsername)
            .field(OS).startsWith("system:").inSection("machine")
            .field(ANTIVIRUS).startsWith("antiviruses:").inSection("machine")
            .field(COUNTRY).startsWith("country:").inSection("geolocation").map(country(countries))
            .field(IP_ADDRESS).startsWith("public ip address:").inSection("network").map(LineGrammar::extractIp)
            .field(IP_ADDRESS).startsWith("private ip address:").inSection("network").map(LineGrammar::extractIp)
            .field(CPU).startsWith("cpu:").inSection("hardware")
            .field(GPU).startsWith("gpu:").inSection("hardware")
            .field(RAM).startsWith("ram:").inSection("hardware")
            .build());
    }
}
