package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

/**
 * Parser for RedLine and META logs.
 */
public class RedLineMetaParser extends RedLineStyleParser {

    public RedLineMetaParser(CountryCodeNormalizer countries) {
        super(StealerFamily.REDLINE_META, layout(countries, true));
    }
}
