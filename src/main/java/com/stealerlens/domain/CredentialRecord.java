package com.stealerlens.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A stored browser credential recovered from a password dump.
 * {@code password} may be an empty string, which is distinct from an absent password.
 */
public class CredentialRecord {

    @JsonProperty("url")
    private final String url;

    @JsonProperty("username")
    private final String username;

    @JsonProperty("password")
    private final String password;

    @JsonProperty("browser")
    private final String browser;

    @JsonProperty("domain")
    private final String domain;

    @JsonProperty("tld")
    private final String tld;

    @JsonProperty("file_path")
    private final String filePath;

    public CredentialRecord(String url, String username, String password, String browser,
                            String domain, String tld, String filePath) {
        this.url = Objects.requireNonNull(url, "url");
        this.username = Objects.requireNonNull(username, "username");
        this.password = Objects.requireNonNull(password, "password");
        this.browser = browser;
        this.domain = domain;
        this.tld = tld;
        this.filePath = filePath;
    }

    /**
     * Copy with a different file path
     */
    public CredentialRecord withFilePath(String filePath) {
        return new CredentialRecord(url, username, password, browser, domain, tld, filePath);
    }

    /**
     * Copy with a different username
     */
    public CredentialRecord withUsername(String username) {
        return new CredentialRecord(url, username, password, browser, domain, tld, filePath);
    }

    /**
     * Copy with a different password
     */
    public CredentialRecord withPassword(String password) {
        return new CredentialRecord(url, username, password, browser, domain, tld, filePath);
    }

    /**
     * Copy with a different browser
     */
    public CredentialRecord withBrowser(String browser) {
        return new CredentialRecord(url, username, password, browser, domain, tld, filePath);
    }

    public String getUrl() {
        return url;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    public String getBrowser() {
        return browser;
    }

    public String getDomain() {
        return domain;
    }

    public String getTld() {
        return tld;
    }

    public String getFilePath() {
        return filePath;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialRecord that = (CredentialRecord) o;
        return url.equals(that.url)
            && username.equals(that.username)
            && password.equals(that.password)
            && Objects.equals(browser, that.browser)
            && Objects.equals(domain, that.domain)
            && Objects.equals(tld, that.tld)
            && Objects.equals(filePath, that.filePath);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, username, password, browser, domain, tld, filePath);
    }

    @Override
    public String toString() {
        // password omitted
        return "CredentialRecord{" +
                "url='" + url + '\'' +
                ", username='" + username + '\'' +
                ", browser='" + browser + '\'' +
                ", domain='" + domain + '\'' +
                ", tld='" + tld + '\'' +
                ", filePath='" + filePath + '\'' +
                '}';
    }
}
