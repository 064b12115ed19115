package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Lumma "System.txt".
 *
 * GPU and antivirus products may be listed on indented lines under an empty header.
 * The first GPU is kept; antivirus products are joined.
 */
public class LummaParser extends LineScanningParser {

    public LummaParser(CountryCodeNormalizer countries) {
        super(StealerFamily.LUMMA, ParserLayout.builder()
            .list(GPU, ContinuationStyle.INDENTED, ListRule.Collapse.FIRST).startsWith("gpu:")
            .list(ANTIVIRUS, ContinuationStyle.INDENTED, ListRule.Collapse.JOINED).startsWith("anti virus:", "antivirus:")
            .field(OS).startsWith("os version:")
            .field(IP_ADDRESS).startsWith("ip address:").map(LineGrammar::extractIp)
            .field(USERNAME).startsWith("user:", "username:").map(LineGrammar::extractUsername)
            .field(CPU).startsWith("cpu name:")
            .field(RAM).startsWith("ram size:")
            .field(COMPUTER_NAME).startsWith("computer:", "hostname:", "pc:")
            // some builds write the IP into the Country line
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .field(LOG_DATE).startsWith("local date:").map(value -> value.matches("\\d+") ? null : value)
            .field(LOG_DATE).startsWith("time:").map(LineGrammar::extractDatePrefix)
            .field(HWID).startsWith("hwid:")
            .field(FILE_PATH).startsWith("path:")
            .build());
    }
}
