package com.stealerlens.credentials;

import com.stealerlens.normalization.LineGrammar;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.stealerlens.credentials.CredentialBlockExtractor.PASSWORD_LABELS;
import static com.stealerlens.credentials.CredentialBlockExtractor.URL_LABELS;
import static com.stealerlens.credentials.CredentialBlockExtractor.containsAny;
import static com.stealerlens.credentials.CredentialBlockExtractor.labelOf;
import static com.stealerlens.credentials.CredentialBlockExtractor.valueOf;

/**
 * Counts passwords, URLs and domains in a password file and extracts its credentials.
 */
@Component
public class PasswordFileAnalyzer {

    private final CredentialBlockExtractor extractor;

    public PasswordFileAnalyzer(CredentialBlockExtractor extractor) {
        this.extractor = extractor;
    }

    public PasswordFileAnalysis analyze(String content) {
        if (content == null || content.isBlank()) {
            return PasswordFileAnalysis.empty();
        }

        int credentialCount = 0;
        int urlCount = 0;
        int domainCount = 0;
        Map<String, Integer> passwordCounts = new LinkedHashMap<>();

        for (String line : LineGrammar.splitLines(content)) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) {
                continue;
            }
            String label = labelOf(trimmed);

            if (containsAny(label, PASSWORD_LABELS)) {
                String password = valueOf(trimmed);
                if (!password.isEmpty()) {
                    credentialCount++;
                    passwordCounts.merge(password, 1, Integer::sum);
                }
            } else if (containsAny(label, URL_LABELS)) {
                String url = valueOf(trimmed);
                if (!url.isEmpty()) {
                    urlCount++;
                    if (!UrlInfo.isIpAddress(url)) {
                        domainCount++;
                    }
                }
            }
        }

        return new PasswordFileAnalysis(credentialCount, urlCount, domainCount, passwordCounts,
            extractor.extract(content));
    }
}
