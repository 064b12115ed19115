package com.stealerlens.normalization.country;

import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Country normalizer backed by the JDK's ISO 3166 table.
 *
 * Resolution order: bare ISO code, "(XX)" embedded code, leading "XX," or "XX /" code,
 * "ll_XX" locale form, known variations and misspellings, then English country names.
 */
@Component
public class IsoCountryCodeNormalizer implements CountryCodeNormalizer {

    private static final Pattern BARE_CODE = Pattern.compile("^[A-Z]{2}$");
    private static final Pattern EMBEDDED_CODE = Pattern.compile("\\(([A-Z]{2})\\)");
    private static final Pattern LEADING_CODE = Pattern.compile("^([A-Z]{2})[,/\\s]");
    private static final Pattern LOCALE_CODE = Pattern.compile("_([A-Z]{2})$");

    private static final Set<String> ISO_CODES = Set.of(Locale.getISOCountries());

    private static final Map<String, String> VARIATIONS = new HashMap<>();
    private static final Map<String, String> NAMES = new HashMap<>();

    static {
        for (String code : Locale.getISOCountries()) {
            String name = new Locale("", code).getDisplayCountry(Locale.ENGLISH);
            if (!name.isEmpty()) {
                NAMES.put(name.toLowerCase(Locale.ROOT), code);
            }
        }

        variation("US", "usa", "u.s.a", "u.s.a.", "united states of america", "america", "us");
        variation("GB", "uk", "u.k.", "great britain", "gb", "britain", "england", "scotland",
            "wales", "northern ireland");
        variation("AE", "uae", "u.a.e", "arab emirate", "arab emirates", "dubai", "abu dhabi");
        variation("RU", "russian federation", "russian", "rossiya");
        variation("CN", "peoples republic of china", "prc", "p.r.c.");
        variation("KR", "south korea", "korea (south)", "republic of korea", "rok", "korea, republic of");
        variation("KP", "north korea", "korea (north)", "dprk");
        variation("DE", "deutschland", "germani", "gemany");
        variation("NL", "holland", "netherland", "nederland");
        variation("SA", "ksa", "saudi");
        variation("ZA", "rsa", "s. africa");
        variation("BR", "brasil");
        variation("MM", "burma");
        variation("CI", "cote divoire", "côte d'ivoire", "ivory coast");
        variation("ES", "espana", "espanha");
        variation("FR", "frace");
        variation("GR", "hellas");
        variation("IT", "italia");
        variation("JP", "japon");
        variation("HU", "magyarország");
        variation("NO", "norge");
        variation("AT", "österreich");
        variation("PL", "polska");
        variation("PT", "portugual");
        variation("FI", "suomi");
        variation("SE", "sverige");
        variation("CH", "schweiz", "suisse", "svizzera", "switz");
        variation("TR", "turkey", "turkiye", "türkiye");
        variation("CD", "zaire");
        variation("IR", "iran");
        variation("SY", "syria");
        variation("LA", "laos");
        variation("VN", "vietnam", "viet nam");
        variation("BO", "bolivia");
        variation("BN", "brunei");
        variation("FK", "falkland islands");
        variation("MK", "macedonia");
        variation("FM", "micronesia");
        variation("MD", "moldova");
        variation("PS", "palestine");
        variation("TW", "taiwan", "roc");
        variation("TZ", "tanzania");
        variation("VE", "venezuela");
        variation("VA", "vatican");
        variation("AF", "afganistan");
        variation("CO", "columbia");
        variation("ID", "indonesi", "indo");
        variation("IL", "isreal");
        variation("MY", "malasia");
        variation("PK", "pakis");
        variation("PH", "philipines", "philippine", "phillipines");
        variation("SG", "singapre");
        variation("SK", "slovak");
        variation("TH", "thai");
        variation("UA", "ukranie");
    }

    private static void variation(String code, String... names) {
        for (String name : names) {
            VARIATIONS.put(name, code);
        }
    }

    @Override
    public Optional<String> toCode(String country) {
        if (country == null || country.isBlank()) {
            return Optional.empty();
        }
        String trimmed = country.strip();

        if (BARE_CODE.matcher(trimmed).matches() && ISO_CODES.contains(trimmed)) {
            return Optional.of(trimmed);
        }

        Optional<String> code = knownCode(EMBEDDED_CODE.matcher(trimmed));
        if (code.isEmpty()) {
            code = knownCode(LEADING_CODE.matcher(trimmed));
        }
        if (code.isEmpty()) {
            code = knownCode(LOCALE_CODE.matcher(trimmed));
        }
        if (code.isPresent()) {
            return code;
        }

        String lower = trimmed.toLowerCase(Locale.ROOT);
        String variation = VARIATIONS.get(lower);
        if (variation != null) {
            return Optional.of(variation);
        }
        return Optional.ofNullable(NAMES.get(lower));
    }

    private static Optional<String> knownCode(Matcher matcher) {
        if (matcher.find() && ISO_CODES.contains(matcher.group(1))) {
            return Optional.of(matcher.group(1));
        }
        return Optional.empty();
    }
}
