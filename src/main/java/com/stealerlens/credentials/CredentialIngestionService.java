package com.stealerlens.credentials;

import com.stealerlens.domain.CredentialRecord;
import com.stealerlens.domain.RawFile;
import com.stealerlens.storage.CredentialRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts credentials from a device's password files and hands them to the credential store.
 *
 * Usernames are cut to the column limit and passwords are escaped before storage.
 * A file that cannot be analyzed, or a record the store rejects, is logged and skipped.
 */
@Service
public class CredentialIngestionService {

    private static final Logger log = LoggerFactory.getLogger(CredentialIngestionService.class);

    static final String UNKNOWN_BROWSER = "Unknown";

    private final PasswordFileAnalyzer analyzer;
    private final CredentialRepository repository;
    private final CredentialMetrics metrics;
    private final Set<String> passwordFileNames;
    private final int maxUsernameLength;

    public CredentialIngestionService(
            PasswordFileAnalyzer analyzer,
            CredentialRepository repository,
            CredentialMetrics metrics,
            @Value("${stealerlens.credentials.file-names:all passwords.txt,all_passwords.txt,passwords.txt,allpasswords_list.txt,_allpasswords_list}")
            List<String> passwordFileNames,
            @Value("${stealerlens.credentials.max-username-length:500}") int maxUsernameLength) {
        this.analyzer = analyzer;
        this.repository = repository;
        this.metrics = metrics;
        this.passwordFileNames = passwordFileNames.stream()
            .map(name -> name.strip().toLowerCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        this.maxUsernameLength = maxUsernameLength;
    }

    /**
     * Ingest every password file among the device's files.
     */
    public CredentialIngestionResult ingest(String deviceId, List<RawFile> files) {
        CredentialIngestionResult result = new CredentialIngestionResult();

        for (RawFile file : files) {
            if (!isPasswordFile(file.getFileName())) {
                continue;
            }
            log.debug("Processing password file {} for device {}", file.getFileName(), deviceId);

            PasswordFileAnalysis analysis;
            try {
                analysis = analyzer.analyze(file.getContent());
            } catch (RuntimeException e) {
                log.error("Failed to analyze password file {} for device {}", file.getFileName(), deviceId, e);
                result.recordFileFailure();
                continue;
            }
            result.addAnalysis(analysis);
            metrics.recordExtracted(analysis.getCredentials().size());
            log.debug("Collected {} credentials from {}", analysis.getCredentials().size(), file.getFileName());

            for (CredentialRecord credential : analysis.getCredentials()) {
                store(deviceId, prepare(credential, file.getFileName(), result), result);
            }
        }

        long special = result.getPasswordCounts().keySet().stream()
            .filter(PasswordEscaper::hasSpecialCharacters)
            .count();
        log.info("Stored {}/{} credentials for device {} ({} distinct passwords, {} with special characters)",
            result.getCredentialsSaved(), result.getCredentialsExtracted(), deviceId,
            result.getPasswordCounts().size(), special);
        return result;
    }

    /**
     * True if the base name of the file, lower-cased, is one of the configured password file names.
     */
    public boolean isPasswordFile(String fileName) {
        if (fileName == null) {
            return false;
        }
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String baseName = slash >= 0 ? fileName.substring(slash + 1) : fileName;
        return passwordFileNames.contains(baseName.toLowerCase(Locale.ROOT));
    }

    private CredentialRecord prepare(CredentialRecord credential, String fileName, CredentialIngestionResult result) {
        TruncatedUsername username = TruncatedUsername.of(credential.getUsername(), maxUsernameLength);
        if (username.wasTruncated()) {
            log.warn("Username truncated from {} to {} characters for {} ({})",
                username.getOriginalLength(), maxUsernameLength, credential.getUrl(), fileName);
            result.recordTruncation();
            metrics.recordTruncated();
        }

        String password = credential.getPassword();
        log.trace("Password for {}: length {}, special characters {}",
            credential.getUrl(), password.length(), PasswordEscaper.hasSpecialCharacters(password));

        return credential
            .withUsername(username.getValue())
            .withPassword(PasswordEscaper.escape(password))
            .withBrowser(credential.getBrowser() != null ? credential.getBrowser() : UNKNOWN_BROWSER)
            .withFilePath(fileName);
    }

    private void store(String deviceId, CredentialRecord credential, CredentialIngestionResult result) {
        try {
            repository.saveCredential(deviceId, credential);
            result.recordSaved();
        } catch (RuntimeException e) {
            log.error("Failed to save credential for {} on device {}: {}", credential.getUrl(), deviceId, e.getMessage());
            result.recordSaveFailure();
            metrics.recordDropped();
        }
    }
}
