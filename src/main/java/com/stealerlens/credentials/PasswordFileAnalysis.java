package com.stealerlens.credentials;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.stealerlens.domain.CredentialRecord;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Summary counts of one password file plus the credentials extracted from it.
 */
public class PasswordFileAnalysis {

    @JsonProperty("credential_count")
    private final int credentialCount;

    @JsonProperty("url_count")
    private final int urlCount;

    @JsonProperty("domain_count")
    private final int domainCount;

    @JsonProperty("password_counts")
    private final Map<String, Integer> passwordCounts;

    @JsonProperty("credentials")
    private final List<CredentialRecord> credentials;

    public PasswordFileAnalysis(int credentialCount, int urlCount, int domainCount,
                                Map<String, Integer> passwordCounts, List<CredentialRecord> credentials) {
        this.credentialCount = credentialCount;
        this.urlCount = urlCount;
        this.domainCount = domainCount;
        this.passwordCounts = Collections.unmodifiableMap(passwordCounts);
        this.credentials = List.copyOf(credentials);
    }

    public static PasswordFileAnalysis empty() {
        return new PasswordFileAnalysis(0, 0, 0, Map.of(), List.of());
    }

    /** Non-empty password values. */
    public int getCredentialCount() {
        return credentialCount;
    }

    /** Non-empty URL values. */
    public int getUrlCount() {
        return urlCount;
    }

    /** URL values whose host is not an IP address. */
    public int getDomainCount() {
        return domainCount;
    }

    /** Occurrences of each distinct password, in first-seen order. */
    public Map<String, Integer> getPasswordCounts() {
        return passwordCounts;
    }

    public List<CredentialRecord> getCredentials() {
        return credentials;
    }

    @Override
    public String toString() {
        return "PasswordFileAnalysis{credentials=" + credentialCount + ", urls=" + urlCount
            + ", domains=" + domainCount + ", extracted=" + credentials.size() + '}';
    }
}
