package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import java.util.regex.Pattern;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Skalka, a Java stealer whose values come straight from JVM system properties.
 */
public class SkalkaParser extends LineScanningParser {

    private static final Pattern WIN_SHORT_NAME = Pattern.compile("^win(\\d+)", Pattern.CASE_INSENSITIVE);

    public SkalkaParser(CountryCodeNormalizer countries) {
        super(StealerFamily.SKALKA, ParserLayout.builder()
            // "win10" -> "Windows 10"
            .field(OS).contains("operation system:").map(value -> WIN_SHORT_NAME.matcher(value).replaceFirst("Windows $1"))
            .field(FILE_PATH).contains("current jarfile path:").map(value -> value.replace('/', '\\'))
            .field(USERNAME).startsWith("username:").map(LineGrammar::extractUsername)
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            // "2024-05-01T10:00:00.123+02:00[Europe/Berlin]"
            .field(LOG_DATE).startsWith("timezone:").map(value -> {
                String date = group("^([\\d\\-T:.]+)").apply(value);
                return date != null ? date : value;
            })
            // "en_US"
            .field(COUNTRY).contains("language & country:", "language and country:").map(value -> {
                String code = group("_([A-Z]{2})$").apply(value);
                return code != null ? code.toUpperCase() : countries.toCodeOrRaw(value);
            })
            .build());
    }
}
