package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for RL Stealer logs, which pad labels as "Operating system : ...".
 */
public class RlStealerParser extends LineScanningParser {

    public RlStealerParser() {
        super(StealerFamily.RL_STEALER, ParserLayout.builder()
            .field(OS).contains("operating system")
            // "DESKTOP-ABC / John"
            .field(USERNAME).contains("pc user").map(value -> {
                int slash = value.indexOf('/');
                return slash >= 0 ? value.substring(slash + 1) : value;
            }).map(LineGrammar::extractUsername)
            .field(FILE_PATH).contains("launch")
            .field(LOG_DATE).contains("current time").map(LineGrammar::extractDatePrefix)
            .field(HWID).contains("hwid")
            .field(CPU).startsWith("cpu")
            .field(RAM).startsWith("ram")
            .field(GPU).startsWith("gpu")
            // "127.0.0.1 [India]"
            .field(IP_ADDRESS).contains("ip geolocation").map(LineGrammar::leadingIp)
            .field(LOG_DATE).contains("log date").map(LineGrammar::extractDatePrefix)
            .build());
    }
}
