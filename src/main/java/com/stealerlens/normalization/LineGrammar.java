package com.stealerlens.normalization;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Low-level line utilities shared by every system information parser.
 * All methods are total over string input and never throw.
 */
public final class LineGrammar {

    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");

    private static final Pattern DASH_PREFIX = Pattern.compile("^-\\s*");

    private static final Pattern PURE_SEPARATOR = Pattern.compile("^(?:={8,}|-{8,})$");

    // "----- Hardware Info -----", "==== Text ====", also mixed runs like "---=== x ===---"
    private static final Pattern BRACKETED_SEPARATOR = Pattern.compile("^[-=]{3,}\\s*(.+?)\\s*[-=]{3,}$");

    private static final Pattern FIELD_LABEL = Pattern.compile("[A-Za-z][A-Za-z ()_/&.-]*?\\s*:");

    private static final Pattern LEADING_IP = Pattern.compile("^(\\d{1,3}(?:\\.\\d{1,3}){3})");

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    private static final Pattern IPV6 = Pattern.compile("^([0-9a-fA-F]{1,4}:){7}[0-9a-fA-F]{1,4}$");

    private static final Pattern HAS_LETTER = Pattern.compile("[a-zA-Z]");

    private static final Pattern HAS_ALNUM = Pattern.compile("[\\p{L}\\p{N}]");

    private static final Pattern DAY_FIRST_TEXT_DATE =
        Pattern.compile("^(\\d+\\s+\\w+\\s+[\\d:]+(?:\\s+[\\d:]+)*(?:\\s+[A-Z]{2,})?)", Pattern.CASE_INSENSITIVE);

    private static final Pattern MONTH_FIRST_TEXT_DATE =
        Pattern.compile("^(\\w+\\s+\\d+,?\\s+[\\d:]+(?:\\s+[\\d:]+)*(?:\\s+[A-Z]{2,})?)", Pattern.CASE_INSENSITIVE);

    private static final Pattern UNTIL_ANNOTATION = Pattern.compile("^([^(\\[]+)");

    private static final Pattern NUMERIC_DATE_RUN =
        Pattern.compile("^([\\d./\\-\\s:,]+(?:\\s*[AP]M)?)", Pattern.CASE_INSENSITIVE);

    private static final Set<String> JUNK_VALUES = Set.of("unknown", "[redacted]", "n/a", "none", "null", "");

    private static final List<String> SECTION_KEYWORDS =
        Arrays.asList("geolocation", "hardware", "network", "system", "machine", "miscellaneous");

    private LineGrammar() {
    }

    /**
     * Split text into lines on LF or CRLF.
     */
    public static List<String> splitLines(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(LINE_BREAK.split(content, -1));
    }

    /**
     * Strip one leading "- " style dash prefix and any indentation.
     * "\t- OS Version: x" becomes "OS Version: x".
     */
    public static String normalizeLine(String line) {
        if (line == null) {
            return "";
        }
        String normalized = line.strip();
        normalized = DASH_PREFIX.matcher(normalized).replaceFirst("");
        return normalized.strip();
    }

    /**
     * True for blank lines, runs of 8+ '=' or '-', and bracketed banners such as
     * "----- Geolocation Data -----" unless the banner text itself looks like a field.
     */
    public static boolean isSeparatorLine(String line) {
        if (line == null) {
            return true;
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return true;
        }
        if (PURE_SEPARATOR.matcher(trimmed).matches()) {
            return true;
        }
        Matcher matcher = BRACKETED_SEPARATOR.matcher(trimmed);
        if (matcher.matches()) {
            return !looksLikeField(matcher.group(1));
        }
        return false;
    }

    /**
     * Pull the banner text out of a bracketed separator.
     * "----- Hardware Info -----" yields "Hardware Info"; dividers without letters or digits yield null.
     */
    public static String extractSectionFromSeparator(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.strip();
        if (PURE_SEPARATOR.matcher(trimmed).matches()) {
            return null;
        }
        Matcher matcher = BRACKETED_SEPARATOR.matcher(trimmed);
        if (matcher.matches() && !looksLikeField(matcher.group(1))) {
            String text = matcher.group(1).strip();
            // "-------" is a divider, not a banner
            return HAS_ALNUM.matcher(text).find() ? text : null;
        }
        return null;
    }

    /**
     * Map a free-text section name to one of the canonical section tags. Names that
     * carry no known keyword are returned lower-cased.
     */
    public static String canonicalSection(String sectionName) {
        if (sectionName == null) {
            return "";
        }
        String lower = sectionName.strip().toLowerCase(Locale.ROOT);
        for (String keyword : SECTION_KEYWORDS) {
            if (lower.contains(keyword)) {
                return keyword;
            }
        }
        return lower;
    }

    /**
     * Return the INI-style header name of a "[Section]" line, or null.
     */
    public static String extractIniSection(String line) {
        if (line == null) {
            return null;
        }
        String trimmed = line.strip();
        if (trimmed.length() > 2 && trimmed.startsWith("[") && trimmed.endsWith("]")) {
            return trimmed.substring(1, trimmed.length() - 1).strip().toLowerCase(Locale.ROOT);
        }
        return null;
    }

    /**
     * Return the trimmed text after the first separator of a "Label: Value" line.
     * The separator is the first ':', else the first '-' not at position 0, else the first '='.
     * Lines without a separator are returned trimmed.
     */
    public static String extractValue(String line) {
        if (line == null) {
            return "";
        }
        int separatorIndex = line.indexOf(':');
        if (separatorIndex == -1) {
            int dashIndex = line.indexOf('-');
            if (dashIndex > 0) {
                separatorIndex = dashIndex;
            } else {
                separatorIndex = line.indexOf('=');
            }
        }
        if (separatorIndex != -1) {
            return line.substring(separatorIndex + 1).strip();
        }
        return line.strip();
    }

    /**
     * Null for junk tokens ("unknown", "[redacted]", "n/a", "none", "null", empty),
     * otherwise the trimmed original-case value.
     */
    public static String cleanValue(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value.strip();
        if (JUNK_VALUES.contains(cleaned.toLowerCase(Locale.ROOT))) {
            return null;
        }
        return cleaned;
    }

    /**
     * "EC2AMAZ-75HN4R3/Administrator" and "DOMAIN\\user" both yield the account part.
     */
    public static String extractUsername(String username) {
        if (username == null) {
            return null;
        }
        int slashIndex = username.indexOf('/');
        if (slashIndex != -1) {
            return username.substring(slashIndex + 1).strip();
        }
        int backslashIndex = username.indexOf('\\');
        if (backslashIndex != -1) {
            return username.substring(backslashIndex + 1).strip();
        }
        return username.strip();
    }

    /**
     * "47.160.126.208/284629518" yields "47.160.126.208".
     */
    public static String extractIp(String ip) {
        if (ip == null) {
            return null;
        }
        int slashIndex = ip.indexOf('/');
        if (slashIndex != -1) {
            return ip.substring(0, slashIndex).strip();
        }
        return ip.strip();
    }

    /**
     * Leading dotted-quad of a value such as "127.0.0.1 [India]", or null.
     */
    public static String leadingIp(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = LEADING_IP.matcher(value.strip());
        return matcher.find() ? matcher.group(1) : null;
    }

    /**
     * IPv4 with each octet in 0-255, or a full eight-group IPv6 address.
     */
    public static boolean isValidIp(String ip) {
        if (ip == null) {
            return false;
        }
        String candidate = ip.strip();
        Matcher matcher = IPV4.matcher(candidate);
        if (matcher.matches()) {
            for (int i = 1; i <= 4; i++) {
                if (Integer.parseInt(matcher.group(i)) > 255) {
                    return false;
                }
            }
            return true;
        }
        return IPV6.matcher(candidate).matches();
    }

    /**
     * Keep the date/time part of a raw timestamp value, dropping trailing annotations
     * such as "(sig:...)" or "[ UTC: ... ]".
     *
     * Text forms ("29 Jun 25 21:02 CEST", "Jun 29, 2025 21:02") keep their leading
     * date/time run; numeric forms keep the leading run of digits and separators.
     */
    public static String extractDatePrefix(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.strip();
        if (trimmed.isEmpty()) {
            return trimmed;
        }
        if (HAS_LETTER.matcher(trimmed).find()) {
            Matcher dayFirst = DAY_FIRST_TEXT_DATE.matcher(trimmed);
            Matcher monthFirst = MONTH_FIRST_TEXT_DATE.matcher(trimmed);
            String textDate = null;
            if (dayFirst.find()) {
                textDate = dayFirst.group(1).strip();
            } else if (monthFirst.find()) {
                textDate = monthFirst.group(1).strip();
            }
            if (textDate != null && textDate.length() > 5) {
                return textDate;
            }
            Matcher untilAnnotation = UNTIL_ANNOTATION.matcher(trimmed);
            if (untilAnnotation.find() && untilAnnotation.group(1).strip().length() > 5) {
                return untilAnnotation.group(1).strip();
            }
            return trimmed;
        }
        Matcher numeric = NUMERIC_DATE_RUN.matcher(trimmed);
        if (numeric.find() && numeric.group(1).strip().length() > 5) {
            return numeric.group(1).strip();
        }
        return trimmed;
    }

    /**
     * Join an OS name and version, dropping "N/A Build" noise from Windows systeminfo output.
     * Falls back to whichever part exists when the combination is implausibly short.
     */
    public static String combineOs(String osName, String osVersion) {
        if (osName == null && osVersion == null) {
            return null;
        }
        if (osVersion == null) {
            return osName;
        }
        if (osName == null) {
            return osVersion;
        }
        String cleanVersion = osVersion
            .replaceFirst("(?i)N/A\\s+Build\\s+", "")
            .replaceFirst("(?i)\\s+Build\\s+", " ")
            .replaceAll("(?i)N/A", "")
            .strip();
        String combined = (osName + " " + cleanVersion).strip();
        if (combined.length() < 5) {
            return osName;
        }
        return combined;
    }

    /**
     * True when the line is indented by a tab or at least two spaces.
     */
    public static boolean isIndented(String rawLine) {
        return rawLine != null && (rawLine.startsWith("\t") || rawLine.startsWith("  "));
    }

    /**
     * True when the text starts with a "Label:" such as "RAM Size:" or "CPU (Processor):".
     */
    public static boolean isLabelLine(String text) {
        return text != null && looksLikeField(text);
    }

    private static boolean looksLikeField(String text) {
        return FIELD_LABEL.matcher(text).lookingAt();
    }
}
