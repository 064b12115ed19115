package com.stealerlens.normalization.country;

import java.util.Optional;

/**
 * Maps the free-text country values found in stealer logs to ISO 3166-1 alpha-2 codes.
 */
public interface CountryCodeNormalizer {

    /**
     * @param country raw country text such as "US", "Russia (RU)", "ru_RU" or "Holland"
     * @return upper-case two letter code, or empty when the value cannot be resolved
     */
    Optional<String> toCode(String country);

    /**
     * Code for the value when one can be resolved, otherwise the trimmed raw value.
     */
    default String toCodeOrRaw(String country) {
        if (country == null) {
            return null;
        }
        return toCode(country).orElse(country.strip());
    }
}
