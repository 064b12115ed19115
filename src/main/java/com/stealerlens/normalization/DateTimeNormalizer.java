package com.stealerlens.normalization;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts the free-form timestamps found in stealer logs into a canonical
 * ("YYYY-MM-DD", "HH:mm:ss") pair.
 *
 * Formats are tried in priority order and the first match wins:
 * <ol>
 *   <li>blank or junk input</li>
 *   <li>ISO "YYYY-MM-DD[ HH:mm:ss]"</li>
 *   <li>numeric "P1.P2.P3 [time] [AM/PM]" with '.', '/' or '-' separators</li>
 *   <li>month-name forms such as "29 Jun 25 21:02 CEST" or "Jun 29, 2025 21:02"</li>
 *   <li>a small set of calendar formats, accepted only for years 2000-2100</li>
 * </ol>
 * Numeric dates whose day/month order cannot be decided are read day-first.
 */
@Component
public class DateTimeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DateTimeNormalizer.class);

    private static final Set<String> NON_DATES = Set.of("disabled", "none", "n/a", "null", "unknown", "[redacted]");

    private static final Pattern ISO_DATE = Pattern.compile(
        "^(\\d{4})-(\\d{2})-(\\d{2})(?:[ T](\\d{2}):(\\d{2}):(\\d{2}))?"
    );

    private static final Pattern NUMERIC_DATE = Pattern.compile(
        "^(\\d{1,4})[./-](\\d{1,2})[./-](\\d{2,4})" +
        "(?:,?\\s+(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2}))?(?:\\s*(AM|PM))?)?",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern DAY_FIRST_TEXT = Pattern.compile(
        "(?<!\\d)(\\d{1,2})(?:st|nd|rd|th)?\\s+([A-Za-z]{3,9})\\.?,?\\s+(\\d{2,4})\\b"
    );

    // "2024 June 29"
    private static final Pattern YEAR_FIRST_TEXT = Pattern.compile(
        "(?<!\\d)(\\d{4})\\s+([A-Za-z]{3,9})\\.?,?\\s+(\\d{1,2})\\b(?!:)"
    );

    private static final Pattern MONTH_FIRST_TEXT = Pattern.compile(
        "([A-Za-z]{3,9})\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{2,4})\\b(?!:)"
    );

    // "Sat Jul 06 3:43:57 2024", "Sat Jul 06 03:43:57 UTC 2024"
    private static final Pattern CTIME_TEXT = Pattern.compile(
        "([A-Za-z]{3,9})\\s+(\\d{1,2})\\s+\\d{1,2}:\\d{2}(?::\\d{2})?(?:\\s+[A-Za-z]{2,5})?\\s+(\\d{4})\\b"
    );

    private static final Pattern TIME_OF_DAY = Pattern.compile(
        "(\\d{1,2}):(\\d{1,2})(?::(\\d{1,2}))?(?:\\s*(AM|PM))?",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern HAS_LETTER = Pattern.compile("[A-Za-z]");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm:ss");

    private static final List<DateTimeFormatter> CALENDAR_FORMATS = List.of(
        DateTimeFormatter.RFC_1123_DATE_TIME,
        caseInsensitive("EEE MMM d HH:mm:ss zzz yyyy"),
        caseInsensitive("yyyyMMddHHmmss"),
        caseInsensitive("yyyyMMdd")
    );

    private static final Map<String, Integer> MONTHS = new HashMap<>();

    static {
        String[] names = {"january", "february", "march", "april", "may", "june",
                          "july", "august", "september", "october", "november", "december"};
        for (int i = 0; i < names.length; i++) {
            MONTHS.put(names[i], i + 1);
            MONTHS.put(names[i].substring(0, 3), i + 1);
        }
        MONTHS.put("sept", 9);
    }

    /**
     * Normalize without a fallback timestamp.
     */
    public NormalizedDateTime normalize(String raw) {
        return normalize(raw, null);
    }

    /**
     * Normalize a raw date string.
     *
     * @param raw      raw value as found in the log, may be null
     * @param fallback timestamp to use when nothing can be parsed, may be null
     * @return canonical pair; the time is "00:00:00" when unknown
     */
    public NormalizedDateTime normalize(String raw, LocalDateTime fallback) {
        if (raw == null || raw.isBlank() || NON_DATES.contains(raw.strip().toLowerCase(Locale.ROOT))) {
            return fromFallback(fallback);
        }

        String cleaned = stripAnnotations(raw.strip());

        NormalizedDateTime result = parseIso(cleaned);
        if (result == null) {
            result = parseNumeric(cleaned);
        }
        if (result == null && HAS_LETTER.matcher(cleaned).find()) {
            result = parseTextMonth(cleaned);
        }
        if (result == null) {
            result = parseCalendar(cleaned);
        }
        if (result == null) {
            log.debug("Unrecognized date value '{}'", raw);
            return fromFallback(fallback);
        }
        return result;
    }

    private NormalizedDateTime parseIso(String value) {
        Matcher matcher = ISO_DATE.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        String date = matcher.group(1) + "-" + matcher.group(2) + "-" + matcher.group(3);
        if (matcher.group(4) != null) {
            return new NormalizedDateTime(date, matcher.group(4) + ":" + matcher.group(5) + ":" + matcher.group(6));
        }
        // "2024-12-25 7:27:19 AM"
        String time = extractTime(value.substring(matcher.end()));
        return new NormalizedDateTime(date, time != null ? time : NormalizedDateTime.MIDNIGHT);
    }

    private NormalizedDateTime parseNumeric(String value) {
        Matcher matcher = NUMERIC_DATE.matcher(value);
        if (!matcher.find()) {
            return null;
        }
        String part1 = matcher.group(1);
        String part2 = matcher.group(2);
        String part3 = matcher.group(3);
        int num1 = Integer.parseInt(part1);
        int num2 = Integer.parseInt(part2);
        int num3 = Integer.parseInt(part3);

        int year;
        int month;
        int day;
        if (part3.length() == 4 || part1.length() != 4) {
            year = part3.length() == 4 ? num3 : expandYear(num3);
            if (num1 > 12) {
                day = num1;
                month = num2;
            } else if (num2 > 12) {
                month = num1;
                day = num2;
            } else {
                // ambiguous, read day-first
                day = num1;
                month = num2;
            }
        } else {
            year = num1;
            month = num2;
            day = num3;
        }

        if (month < 1 || month > 12 || day < 1 || day > 31) {
            return null;
        }

        String time = NormalizedDateTime.MIDNIGHT;
        if (matcher.group(4) != null) {
            time = formatClock(matcher.group(4), matcher.group(5), matcher.group(6), matcher.group(7));
        }
        return new NormalizedDateTime(String.format("%04d-%02d-%02d", year, month, day), time);
    }

    private NormalizedDateTime parseTextMonth(String value) {
        int[] ymd = findTextDate(DAY_FIRST_TEXT, value, 2, 1, 3);
        if (ymd == null) {
            ymd = findTextDate(CTIME_TEXT, value, 1, 2, 3);
        }
        if (ymd == null) {
            ymd = findTextDate(MONTH_FIRST_TEXT, value, 1, 2, 3);
        }
        if (ymd == null) {
            ymd = findTextDate(YEAR_FIRST_TEXT, value, 2, 3, 1);
        }
        if (ymd == null) {
            return null;
        }
        String time = extractTime(value);
        return new NormalizedDateTime(String.format("%04d-%02d-%02d", ymd[0], ymd[1], ymd[2]),
            time != null ? time : NormalizedDateTime.MIDNIGHT);
    }

    private int[] findTextDate(Pattern pattern, String value, int monthGroup, int dayGroup, int yearGroup) {
        Matcher matcher = pattern.matcher(value);
        while (matcher.find()) {
            Integer month = resolveMonth(matcher.group(monthGroup));
            if (month == null) {
                continue;
            }
            int day = Integer.parseInt(matcher.group(dayGroup));
            String yearText = matcher.group(yearGroup);
            int year = yearText.length() <= 2 ? expandYear(Integer.parseInt(yearText)) : Integer.parseInt(yearText);
            if (day >= 1 && day <= 31) {
                return new int[] {year, month, day};
            }
        }
        return null;
    }

    private NormalizedDateTime parseCalendar(String value) {
        for (DateTimeFormatter formatter : CALENDAR_FORMATS) {
            try {
                TemporalAccessor parsed = formatter.parse(value);
                LocalDateTime dateTime = toLocalDateTime(parsed);
                if (dateTime.getYear() < 2000 || dateTime.getYear() > 2100) {
                    log.debug("Rejected out-of-range year {} for '{}'", dateTime.getYear(), value);
                    return null;
                }
                String time = extractTime(value);
                return new NormalizedDateTime(dateTime.format(DATE_FORMAT),
                    time != null ? time : dateTime.format(TIME_FORMAT));
            } catch (DateTimeParseException e) {
                log.trace("Format {} did not match '{}'", formatter, value);
            }
        }
        return null;
    }

    private static LocalDateTime toLocalDateTime(TemporalAccessor parsed) {
        try {
            return ZonedDateTime.from(parsed).toLocalDateTime();
        } catch (Exception e) {
            try {
                return LocalDateTime.from(parsed);
            } catch (Exception inner) {
                return java.time.LocalDate.from(parsed).atStartOfDay();
            }
        }
    }

    /**
     * First "HH:mm[:ss][ AM/PM]" found anywhere in the value, formatted as HH:mm:ss.
     */
    String extractTime(String value) {
        Matcher matcher = TIME_OF_DAY.matcher(value);
        if (matcher.find()) {
            return formatClock(matcher.group(1), matcher.group(2), matcher.group(3), matcher.group(4));
        }
        return null;
    }

    private static String formatClock(String hour, String minute, String second, String meridiem) {
        int h = Integer.parseInt(hour);
        int m = Integer.parseInt(minute);
        int s = second != null ? Integer.parseInt(second) : 0;
        if (meridiem != null) {
            boolean pm = meridiem.equalsIgnoreCase("PM");
            if (pm && h < 12) {
                h += 12;
            } else if (!pm && h == 12) {
                h = 0;
            }
        }
        return String.format("%02d:%02d:%02d", h, m, s);
    }

    private static NormalizedDateTime fromFallback(LocalDateTime fallback) {
        if (fallback == null) {
            return NormalizedDateTime.empty();
        }
        return new NormalizedDateTime(fallback.format(DATE_FORMAT), fallback.format(TIME_FORMAT));
    }

    private static String stripAnnotations(String value) {
        int cut = -1;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '(' || c == '[') {
                cut = i;
                break;
            }
        }
        if (cut > 0) {
            return value.substring(0, cut).strip();
        }
        return value;
    }

    private static Integer resolveMonth(String token) {
        String lower = token.toLowerCase(Locale.ROOT);
        Integer month = MONTHS.get(lower);
        if (month == null && lower.length() > 3) {
            month = MONTHS.get(lower.substring(0, 3));
            // "Junk" must not read as June
            if (month != null && !isMonthPrefix(lower)) {
                month = null;
            }
        }
        return month;
    }

    private static boolean isMonthPrefix(String lower) {
        for (String name : MONTHS.keySet()) {
            if (name.length() > 3 && name.startsWith(lower)) {
                return true;
            }
        }
        return false;
    }

    private static int expandYear(int year) {
        return year < 100 ? 2000 + year : year;
    }

    private static DateTimeFormatter caseInsensitive(String pattern) {
        return new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern(pattern)
            .toFormatter(Locale.ENGLISH);
    }
}
