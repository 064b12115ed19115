package com.stealerlens.storage;

import com.stealerlens.domain.CredentialRecord;
import com.stealerlens.domain.ParsedSystemInfo;
import com.stealerlens.domain.SystemInfoField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("InMemoryStealerLogRepository Tests")
class InMemoryStealerLogRepositoryTest {

    private InMemoryStealerLogRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryStealerLogRepository();
    }

    @Test
    @DisplayName("Should keep system information per device in insertion order")
    void shouldStoreSystemInformation() {
        // Given
        ParsedSystemInfo first = new ParsedSystemInfo("Lumma");
        first.offer(SystemInfoField.OS, "Windows 10 Pro");
        ParsedSystemInfo second = new ParsedSystemInfo("Vidar");

        // When
        repository.saveSystemInformation("dev-1", first.seal(), "System.txt");
        repository.saveSystemInformation("dev-1", second.seal(), "information.txt");

        // Then
        List<InMemoryStealerLogRepository.StoredSystemInformation> stored = repository.findSystemInformation("dev-1");
        assertThat(stored).extracting(InMemoryStealerLogRepository.StoredSystemInformation::getSourceFileName)
            .containsExactly("System.txt", "information.txt");
        assertThat(stored.get(0).getInfo().getOs()).isEqualTo("Windows 10 Pro");
        assertThat(repository.findSystemInformation("dev-2")).isEmpty();
    }

    @Test
    @DisplayName("Should reject a blank device id")
    void shouldRejectBlankDevice() {
        CredentialRecord credential = new CredentialRecord("https://a.com", "u", "p", null, "a.com", "com", null);

        assertThatThrownBy(() -> repository.saveCredential(" ", credential))
            .isInstanceOf(StorageException.class)
            .hasMessageContaining("https://a.com");
        assertThatThrownBy(() -> repository.saveSystemInformation(null, new ParsedSystemInfo(), "System.txt"))
            .isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Should accept concurrent credential writes")
    void shouldAcceptConcurrentWrites() throws InterruptedException {
        // Given
        ExecutorService executor = Executors.newFixedThreadPool(4);

        // When
        for (int i = 0; i < 200; i++) {
            String url = "https://site" + i + ".com";
            executor.submit(() -> repository.saveCredential("dev-1",
                new CredentialRecord(url, "u", "p", "Chrome", null, null, "passwords.txt")));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        assertThat(repository.findCredentials("dev-1")).hasSize(200);
    }
}
