package com.stealerlens.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ParsedSystemInfo Tests")
class ParsedSystemInfoTest {

    @Test
    @DisplayName("Should keep the first non-blank value offered")
    void shouldKeepFirstValue() {
        ParsedSystemInfo info = new ParsedSystemInfo("Lumma");

        assertThat(info.offer(SystemInfoField.CPU, "  ")).isFalse();
        assertThat(info.offer(SystemInfoField.CPU, "Intel Core i7")).isTrue();
        assertThat(info.offer(SystemInfoField.CPU, "AMD Ryzen 5")).isFalse();

        assertThat(info.getCpu()).isEqualTo("Intel Core i7");
    }

    @Test
    @DisplayName("Should clear a field when replaced with a blank value")
    void shouldReplaceAndClear() {
        ParsedSystemInfo info = new ParsedSystemInfo();
        info.offer(SystemInfoField.COUNTRY, "Germany");

        info.replace(SystemInfoField.COUNTRY, "DE");
        assertThat(info.getCountry()).isEqualTo("DE");

        info.replace(SystemInfoField.COUNTRY, "");
        assertThat(info.has(SystemInfoField.COUNTRY)).isFalse();
    }

    @Test
    @DisplayName("Should default to the Generic tag and midnight")
    void shouldApplyDefaults() {
        ParsedSystemInfo info = new ParsedSystemInfo(null);

        assertThat(info.getStealerType()).isEqualTo(StealerFamily.GENERIC.getTag());
        assertThat(info.getLogTime()).isEqualTo(ParsedSystemInfo.DEFAULT_LOG_TIME);
    }

    @Test
    @DisplayName("Should refuse every mutation once sealed")
    void shouldRefuseMutationAfterSeal() {
        ParsedSystemInfo info = new ParsedSystemInfo("Vidar");
        info.offer(SystemInfoField.OS, "Windows 11");
        info.seal();

        assertThat(info.isSealed()).isTrue();
        assertThatThrownBy(() -> info.offer(SystemInfoField.RAM, "16 GB")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> info.replace(SystemInfoField.OS, "x")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> info.setLogTime("12:00:00")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> info.setStealerType("Lumma")).isInstanceOf(IllegalStateException.class);
        assertThat(info.getOs()).isEqualTo("Windows 11");
    }
}
