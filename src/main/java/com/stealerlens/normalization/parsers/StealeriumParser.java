package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Stealerium's INI-style report ([IP], [Machine], [Virtualization]).
 */
public class StealeriumParser extends LineScanningParser {

    private static final String MACHINE = "machine";

    public StealeriumParser() {
        super(StealerFamily.STEALERIUM, ParserLayout.builder()
            .sections(SectionStyle.INI)
            .field(IP_ADDRESS).contains("external ip:").inSection("ip").map(LineGrammar::extractIp)
            .field(IP_ADDRESS).contains("internal ip:").inSection("ip").map(LineGrammar::extractIp)
            .field(USERNAME).startsWith("username:").inSection(MACHINE).map(LineGrammar::extractUsername)
            .field(COMPUTER_NAME).startsWith("compname:").inSection(MACHINE)
            .field(OS).startsWith("system:").inSection(MACHINE)
            .field(CPU).startsWith("cpu:").inSection(MACHINE)
            .field(GPU).startsWith("gpu:").inSection(MACHINE)
            .field(RAM).startsWith("ram:").inSection(MACHINE)
            .field(LOG_DATE).startsWith("date:").inSection(MACHINE).map(LineGrammar::extractDatePrefix)
            .field(ANTIVIRUS).startsWith("antivirus:").inSection("virtualization")
            .build());
    }
}
