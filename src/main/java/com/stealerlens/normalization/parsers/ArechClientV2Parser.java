package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

/**
 * Parser for ArechClientV2, a RedLine fork that drops the machine name and log date lines.
 */
public class ArechClientV2Parser extends RedLineStyleParser {

    public ArechClientV2Parser(CountryCodeNormalizer countries) {
        super(StealerFamily.ARECH_CLIENT_V2, layout(countries, false));
    }
}
