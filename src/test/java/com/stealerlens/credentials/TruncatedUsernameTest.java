package com.stealerlens.credentials;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TruncatedUsername Tests")
class TruncatedUsernameTest {

    @Test
    @DisplayName("Should keep a username within the limit")
    void shouldKeepShortUsername() {
        TruncatedUsername username = TruncatedUsername.of("alice");

        assertThat(username.getValue()).isEqualTo("alice");
        assertThat(username.wasTruncated()).isFalse();
        assertThat(username.getOriginalLength()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should cut a username to the default 500 characters")
    void shouldTruncateLongUsername() {
        String longName = "x".repeat(750);

        TruncatedUsername username = TruncatedUsername.of(longName);

        assertThat(username.getValue()).hasSize(500);
        assertThat(username.wasTruncated()).isTrue();
        assertThat(username.getOriginalLength()).isEqualTo(750);
    }

    @Test
    @DisplayName("Should keep a username exactly at the limit")
    void shouldKeepUsernameAtLimit() {
        assertThat(TruncatedUsername.of("abcd", 4).wasTruncated()).isFalse();
        assertThat(TruncatedUsername.of("abcde", 4).getValue()).isEqualTo("abcd");
    }

    @Test
    @DisplayName("Should turn null into an empty username")
    void shouldHandleNull() {
        TruncatedUsername username = TruncatedUsername.of(null);

        assertThat(username.getValue()).isEmpty();
        assertThat(username.wasTruncated()).isFalse();
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void shouldRejectInvalidLimit() {
        assertThatThrownBy(() -> TruncatedUsername.of("a", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
