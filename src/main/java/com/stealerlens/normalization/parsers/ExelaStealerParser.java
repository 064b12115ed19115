package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for ExelaStealer logs: {@code systeminfo} output, sometimes preceded by a
 * Telegram banner block carrying the public IP and country.
 */
public class ExelaStealerParser extends WindowsSysteminfoParser {

    public ExelaStealerParser(CountryCodeNormalizer countries) {
        super(StealerFamily.EXELA_STEALER, systeminfoRules(ParserLayout.builder())
            .field(IP_ADDRESS).startsWith("ip:", "ip address:", "public ip:").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .field(USERNAME).startsWith("username:", "user name:").map(LineGrammar::extractUsername)
            .build());
    }
}
