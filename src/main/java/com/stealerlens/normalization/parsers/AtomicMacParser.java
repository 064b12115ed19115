package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.LineGrammar;
import com.stealerlens.normalization.country.CountryCodeNormalizer;

import static com.stealerlens.domain.SystemInfoField.*;

/**
 * Parser for Atomic macOS Stealer logs, which embed sw_vers and system_profiler output.
 *
 * The OS is assembled from ProductName, ProductVersion and BuildVersion,
 * e.g. "macOS 14.6 (23G5075b)".
 */
public class AtomicMacParser extends LineScanningParser {

    private static final String PRODUCT_NAME = "productName";
    private static final String PRODUCT_VERSION = "productVersion";
    private static final String BUILD_VERSION = "buildVersion";

    public AtomicMacParser(CountryCodeNormalizer countries) {
        super(StealerFamily.ATOMIC_MAC, ParserLayout.builder()
            .sectionHeader("hardware", "hardware overview:")
            .sectionHeader("graphics", "graphics/displays:")
            .capture(PRODUCT_NAME).startsWith("productname:")
            .capture(PRODUCT_VERSION).startsWith("productversion:")
            .capture(BUILD_VERSION).startsWith("buildversion:")
            .field(IP_ADDRESS).startsWith("ip:").map(LineGrammar::extractIp)
            .field(COUNTRY).startsWith("country:").map(country(countries))
            .field(COMPUTER_NAME).contains("model name:").inSection("hardware")
            .field(CPU).contains("chip:").inSection("hardware")
            .field(RAM).contains("memory:").inSection("hardware")
            .field(HWID).contains("serial number").inSection("hardware")
            .field(GPU).contains("chipset model:").inSection("graphics")
            .build());
    }

    @Override
    protected void finish(ParseState state) {
        String version = state.captured(PRODUCT_VERSION);
        String build = state.captured(BUILD_VERSION);
        if (version != null && build != null) {
            version = version + " (" + build + ")";
        }
        state.result().offer(OS, LineGrammar.cleanValue(LineGrammar.combineOs(state.captured(PRODUCT_NAME), version)));
    }
}
