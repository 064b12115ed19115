package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.normalization.country.IsoCountryCodeNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GenericParser Tests")
class GenericParserTest {

    private GenericParser parser;

    @BeforeEach
    void setUp() {
        parser = new GenericParser(new IsoCountryCodeNormalizer());
    }

    @Test
    @DisplayName("Should read common label synonyms from an unknown layout")
    void shouldParseSynonyms() {
        // Given
        String content = String.join("\n",
            "==== System ====",
            "OS Name: Microsoft Windows 11 Pro",
            "OS Version: 10.0.22631 N/A Build 22631",
            "IP: 11.22.33.44 (home)",
            "Username: DOMAIN\\oscar",
            "Country: Russia (RU)",
            "CPU: Unknown",
            "Processor: AMD Ryzen 9",
            "HWID: [redacted]",
            "Hardware UUID: HW-UUID-1",
            "Date: 2024-09-09 09:09:09");

        // When
        ParsedSystemInfo info = parser.parse(content, "Info.txt");

        // Then
        assertThat(info.getStealerType()).isEqualTo("Generic");
        assertThat(info.getOs()).isEqualTo("Microsoft Windows 11 Pro 10.0.22631 22631");
        assertThat(info.getIpAddress()).isEqualTo("11.22.33.44");
        assertThat(info.getUsername()).isEqualTo("oscar");
        assertThat(info.getCountry()).isEqualTo("RU");
        assertThat(info.getCpu()).isEqualTo("AMD Ryzen 9");
        assertThat(info.getHwid()).isEqualTo("HW-UUID-1");
        assertThat(info.getLogDate()).isEqualTo("2024-09-09 09:09:09");
    }

    @Test
    @DisplayName("Should read INI sections and geolocation-scoped location lines")
    void shouldReadLocationInGeolocationSection() {
        String content = "[Geolocation]\nLocation: Netherlands\n[Hardware]\nRAM: 8 GB";

        ParsedSystemInfo info = parser.parse(content, "Info.txt");

        assertThat(info.getCountry()).isEqualTo("NL");
        assertThat(info.getRam()).isEqualTo("8 GB");
    }

    @Test
    @DisplayName("Should read a hardware Windows Name as the OS and never as the username")
    void shouldReadWindowsNameAsOsOnly() {
        ParsedSystemInfo info = parser.parse("[Hardware]\nWindows Name: Windows 10 Pro", "Info.txt");

        assertThat(info.getOs()).isEqualTo("Windows 10 Pro");
        assertThat(info.getUsername()).isNull();
    }

    @Test
    @DisplayName("Should keep the banner section across a plain dash divider")
    void shouldKeepSectionAcrossDivider() {
        String content = "----- Geolocation Data -----\n-------\nLocation: Netherlands";

        ParsedSystemInfo info = parser.parse(content, "Info.txt");

        assertThat(info.getCountry()).isEqualTo("NL");
    }

    @Test
    @DisplayName("Should leave out an IP address written into the country field")
    void shouldSkipIpInCountry() {
        ParsedSystemInfo info = parser.parse("Country: 1.2.3.4\nCountry: Spain", "Info.txt");

        assertThat(info.getCountry()).isEqualTo("ES");
    }

    @Test
    @DisplayName("Should read an upper-case bracketed country name")
    void shouldReadBracketedCountry() {
        ParsedSystemInfo info = parser.parse("Country: 127.0.0.1 [INDIA]", "Info.txt");

        assertThat(info.getCountry()).isEqualTo("IN");
    }

    @Test
    @DisplayName("Should return an empty record for text without labels")
    void shouldHandleUnlabelledText() {
        ParsedSystemInfo info = parser.parse("hello world", "Info.txt");

        assertThat(info.getOs()).isNull();
        assertThat(info.getIpAddress()).isNull();
        assertThat(info.getUsername()).isNull();
    }
}
