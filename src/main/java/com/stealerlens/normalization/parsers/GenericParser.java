package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.StealerFamily;
import com.stealerlens.domain.SystemInfoField;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Best-effort parser for logs no signature recognized.
 *
 * Unlike the family parsers a line is not consumed by its first matching label: every
 * field whose synonyms occur in the line may take the value, first write wins.
 * Sections are read from both banner separators and INI headers.
 */
public class GenericParser extends LineScanningParser {

    private static final List<String> OS_LABELS = List.of(
        "os:", "os name:", "operation system:", "operating system:", "system:", "windows:", "pc type:", "productname:");
    private static final List<String> OS_NAME_LABELS = List.of("os name:", "productname:", "windows name:");
    private static final List<String> OS_VERSION_LABELS = List.of("os version:", "productversion:");
    private static final List<String> IP_LABELS = List.of(
        "ip:", "ip address:", "ip info:", "public ip address:", "external ip:", "private ip address:",
        "internal ip:", "ip geolocation:");
    private static final List<String> USERNAME_LABELS = List.of(
        "user:", "user name:", "username:", "pc user:", "registered owner:");
    private static final List<String> CPU_LABELS = List.of(
        "cpu:", "cpu (processor):", "cpu info:", "cpu name:", "processor:", "processor(s):");
    private static final List<String> RAM_LABELS = List.of(
        "ram:", "ram (memory):", "ram size:", "amount of ram:", "installed ram:", "total physical memory:", "memory:");
    private static final List<String> COMPUTER_NAME_LABELS = List.of(
        "computer:", "computer name:", "compname:", "host name:", "hostname:", "machine name:", "netbios:",
        "pc:", "pc name:");
    private static final List<String> GPU_LABELS = List.of(
        "gpu:", "gpu (display devices):", "gpu info:", "gpu name:", "display devices:", "video card:",
        "videocard:", "chipset model:");
    private static final List<String> COUNTRY_LABELS = List.of("country:", "country code:");
    private static final List<String> DATE_LABELS = List.of(
        "date:", "local date:", "current time:", "log date:", "save time:", "time:");
    private static final List<String> HWID_LABELS = List.of(
        "hwid:", "hardware id:", "hardware uuid:", "machineid:", "bot_id:", "user id:", "serial number:");
    private static final List<String> PATH_LABELS = List.of(
        "file location:", "path:", "execute path:", "running path:", "current jarfile path:",
        "process executable path:", "startup folder:", "launch:", "work dir:", "file path:");
    private static final List<String> ANTIVIRUS_LABELS = List.of(
        "av:", "anti virus:", "anti-viruses:", "antivirus:", "antivirus products:");

    private static final String OS_NAME = "osName";
    private static final String OS_VERSION = "osVersion";

    private static final Pattern LEADING_IP_RUN = Pattern.compile("^([\\d.]+)");

    // "Russia (RU)", "127.0.0.1 [India]"
    private static final Pattern EMBEDDED_COUNTRY = Pattern.compile("\\(([A-Z]{2})\\)|\\[([A-Z]{2,})\\]");

    private final CountryCodeNormalizer countries;

    public GenericParser(CountryCodeNormalizer countries) {
        super(StealerFamily.GENERIC, ParserLayout.builder()
            .sections(SectionStyle.BANNER)
            .build());
        this.countries = countries;
    }

    @Override
    protected boolean handleLine(ScanLine line, ParseState state) {
        String ini = LineGrammar.extractIniSection(line.text());
        if (ini != null) {
            state.enterSection(LineGrammar.canonicalSection(ini));
            return true;
        }

        String lower = line.lower();
        String value = line.value();
        ParsedSystemInfo result = state.result();

        // "windows name:" is an OS name only; it never fills USERNAME
        if (!result.has(OS) && (containsAny(lower, OS_LABELS)
                || (lower.contains("windows name:") && state.inSection("hardware")))
                && !mentionsUnknown(value)) {
            if (containsAny(lower, OS_NAME_LABELS)) {
                state.capture(OS_NAME, value);
            } else {
                result.offer(OS, LineGrammar.cleanValue(value));
            }
        }
        if (containsAny(lower, OS_VERSION_LABELS) && !mentionsUnknown(value)) {
            state.capture(OS_VERSION, value);
        }

        if (!result.has(IP_ADDRESS) && containsAny(lower, IP_LABELS)) {
            Matcher matcher = LEADING_IP_RUN.matcher(value);
            String ip = matcher.find() ? matcher.group(1) : value;
            result.offer(IP_ADDRESS, LineGrammar.cleanValue(LineGrammar.extractIp(ip)));
        }

        offerIfMatches(result, USERNAME, lower, USERNAME_LABELS, LineGrammar.extractUsername(value), false);
        offerIfMatches(result, CPU, lower, CPU_LABELS, value, true);
        offerIfMatches(result, RAM, lower, RAM_LABELS, value, true);
        offerIfMatches(result, COMPUTER_NAME, lower, COMPUTER_NAME_LABELS, value, false);
        offerIfMatches(result, GPU, lower, GPU_LABELS, value, true);

        if (!result.has(COUNTRY) && (containsAny(lower, COUNTRY_LABELS)
                || (lower.contains("location:") && state.inSection("geolocation")))) {
            offerCountry(result, value);
        }

        offerIfMatches(result, LOG_DATE, lower, DATE_LABELS, value, false);
        if (!value.toLowerCase(Locale.ROOT).contains("[redacted]")) {
            offerIfMatches(result, HWID, lower, HWID_LABELS, value, true);
        }
        offerIfMatches(result, FILE_PATH, lower, PATH_LABELS, value, false);
        offerIfMatches(result, ANTIVIRUS, lower, ANTIVIRUS_LABELS, value, true);
        return true;
    }

    @Override
    protected void finish(ParseState state) {
        String osName = state.captured(OS_NAME);
        String osVersion = state.captured(OS_VERSION);
        if (osName != null || osVersion != null) {
            state.result().offer(OS, LineGrammar.cleanValue(LineGrammar.combineOs(osName, osVersion)));
        }
    }

    private void offerCountry(ParsedSystemInfo result, String value) {
        Matcher matcher = EMBEDDED_COUNTRY.matcher(value);
        String candidate;
        if (matcher.find()) {
            candidate = matcher.group(1) != null ? matcher.group(1) : matcher.group(2);
        } else if (LineGrammar.isValidIp(value)) {
            // an address written into the country field is left out
            return;
        } else {
            candidate = value;
        }
        String cleaned = LineGrammar.cleanValue(candidate);
        if (cleaned != null) {
            result.offer(COUNTRY, LineGrammar.cleanValue(countries.toCodeOrRaw(cleaned)));
        }
    }

    private static void offerIfMatches(ParsedSystemInfo result, SystemInfoField field, String lower,
                                       List<String> labels, String value, boolean rejectUnknown) {
        if (result.has(field) || !containsAny(lower, labels)) {
            return;
        }
        if (rejectUnknown && mentionsUnknown(value)) {
            return;
        }
        result.offer(field, LineGrammar.cleanValue(value));
    }

    private static boolean mentionsUnknown(String value) {
        return value == null || value.toLowerCase(Locale.ROOT).contains("unknown");
    }

    private static boolean containsAny(String lower, List<String> labels) {
        for (String label : labels) {
            if (lower.contains(label)) {
                return true;
            }
        }
        return false;
    }
}
