package com.stealerlens.credentials;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Totals of one credential ingestion run for a device.
 */
public class CredentialIngestionResult {

    @JsonProperty("files_processed")
    private int filesProcessed;

    @JsonProperty("files_failed")
    private int filesFailed;

    @JsonProperty("credentials_extracted")
    private int credentialsExtracted;

    @JsonProperty("credentials_saved")
    private int credentialsSaved;

    @JsonProperty("credentials_failed")
    private int credentialsFailed;

    @JsonProperty("usernames_truncated")
    private int usernamesTruncated;

    @JsonProperty("url_count")
    private int urlCount;

    @JsonProperty("domain_count")
    private int domainCount;

    @JsonProperty("password_counts")
    private final Map<String, Integer> passwordCounts = new LinkedHashMap<>();

    void addAnalysis(PasswordFileAnalysis analysis) {
        filesProcessed++;
        credentialsExtracted += analysis.getCredentials().size();
        urlCount += analysis.getUrlCount();
        domainCount += analysis.getDomainCount();
        analysis.getPasswordCounts().forEach((password, count) -> passwordCounts.merge(password, count, Integer::sum));
    }

    void recordFileFailure() {
        filesFailed++;
    }

    void recordSaved() {
        credentialsSaved++;
    }

    void recordSaveFailure() {
        credentialsFailed++;
    }

    void recordTruncation() {
        usernamesTruncated++;
    }

    public int getFilesProcessed() {
        return filesProcessed;
    }

    public int getFilesFailed() {
        return filesFailed;
    }

    public int getCredentialsExtracted() {
        return credentialsExtracted;
    }

    public int getCredentialsSaved() {
        return credentialsSaved;
    }

    public int getCredentialsFailed() {
        return credentialsFailed;
    }

    public int getUsernamesTruncated() {
        return usernamesTruncated;
    }

    public int getUrlCount() {
        return urlCount;
    }

    public int getDomainCount() {
        return domainCount;
    }

    /**
     * Occurrences of each distinct password across every processed file, unescaped.
     */
    public Map<String, Integer> getPasswordCounts() {
        return Collections.unmodifiableMap(passwordCounts);
    }

    @Override
    public String toString() {
        return "CredentialIngestionResult{files=" + filesProcessed + ", filesFailed=" + filesFailed
            + ", extracted=" + credentialsExtracted + ", saved=" + credentialsSaved
            + ", failed=" + credentialsFailed + ", truncated=" + usernamesTruncated + '}';
    }
}
