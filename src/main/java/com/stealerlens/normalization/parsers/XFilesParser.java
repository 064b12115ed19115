package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for XFiles logs ("CPU (Processor): ...", "GPU (Display Devices): ...").
 */
public class XFilesParser extends LineScanningParser {

    public XFilesParser(CountryCodeNormalizer countries) {
        super(StealerFamily.XFILES, ParserLayout.builder()
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .field(OS).contains("operating system:")
            .field(USERNAME).startsWith("username:").map(LineGrammar::extractUsername)
            .field(COMPUTER_NAME).startsWith("computer name:")
            .field(HWID).contains("hardware id:")
            .field(CPU).containsAll("cpu", "processor")
            .field(GPU).containsAll("gpu", "display devices")
            .field(RAM).containsAll("ram", "memory")
            .build());
    }
}
