package com.stealerlens.normalization.parsers;

import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.StealerFamily;
import com.stealerlens.normalization.country.IsoCountryCodeNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ParserRegistry Tests")
class ParserRegistryTest {

    private ParserRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ParserRegistry(new IsoCountryCodeNormalizer());
    }

    @ParameterizedTest
    @EnumSource(StealerFamily.class)
    @DisplayName("Should register a parser for every family")
    void shouldRegisterEveryFamily(StealerFamily family) {
        SystemInfoParser parser = registry.getParser(family);

        assertThat(parser).isNotNull();
        assertThat(parser.getFamily()).isEqualTo(family);
    }

    @Test
    @DisplayName("Should fall back to the generic parser for null")
    void shouldFallBackToGeneric() {
        assertThat(registry.getParser(null)).isInstanceOf(GenericParser.class);
    }

    @Test
    @DisplayName("Should replace a registered parser")
    void shouldReplaceParser() {
        // Given
        SystemInfoParser custom = new SystemInfoParser() {
            @Override
            public ParsedSystemInfo parse(String content, String fileName) {
                return new ParsedSystemInfo(StealerFamily.VIDAR.getTag());
            }

            @Override
            public StealerFamily getFamily() {
                return StealerFamily.VIDAR;
            }
        };

        // When
        registry.registerParser(StealerFamily.VIDAR, custom);

        // Then
        assertThat(registry.getParser(StealerFamily.VIDAR)).isSameAs(custom);
    }
}
