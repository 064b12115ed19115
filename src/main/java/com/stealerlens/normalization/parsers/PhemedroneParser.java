package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Phemedrone logs, sectioned by banners such as "----- Geolocation Data -----".
 */
public class PhemedroneParser extends LineScanningParser {

    public PhemedroneParser(CountryCodeNormalizer countries) {
        super(StealerFamily.PHEMEDRONE, ParserLayout.builder()
            .sections(SectionStyle.BANNER)
            .field(IP_ADDRESS).startsWith("ip:").inSection("geolocation").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").inSection("geolocation").map(country(countries))
            .field(USERNAME).startsWith("username:").inSection("hardware").map(LineGrammar::extractUsername)
            .field(OS).contains("windows name:").inSection("hardware")
            .field(HWID).contains("hardware id:").inSection("hardware")
            .field(GPU).startsWith("gpu:").inSection("hardware")
            .field(CPU).startsWith("cpu:").inSection("hardware")
            .field(RAM).startsWith("ram:").inSection("hardware")
            .field(ANTIVIRUS).contains("antivirus products:").inSection("miscellaneous")
            .field(FILE_PATH).contains("file location:").inSection("miscellaneous")
            .build());
    }
}
