package com.stealerlens.credentials;

import com.stealerlens.domain.CredentialRecord;
import com.stealerlens.normalization.LineGrammar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Splits a browser password dump into credential records.
 *
 * <pre>
 * URL: https://a.com
 * Username: u
 * Password: p
 * ===============
 * </pre>
 *
 * Labels are matched on the text before the first colon, so values such as
 * "Password: user:1" stay passwords. A block ends at a separator line or when a second
 * URL label shows up in the same block.
 * Blocks without a URL, a username line or a password line are dropped; an empty password
 * value is kept.
 */
@Component
public class CredentialBlockExtractor {

    private static final Logger log = LoggerFactory.getLogger(CredentialBlockExtractor.class);

    static final List<String> URL_LABELS = List.of("url:", "host:", "hostname:");
    static final List<String> USERNAME_LABELS = List.of("username:", "user:", "login:");
    static final List<String> PASSWORD_LABELS = List.of("password:", "pass:");
    static final List<String> BROWSER_LABELS = List.of("browser:", "soft:", "application:");

    private static final Pattern PURE_SEPARATOR = Pattern.compile("^(?:={8,}|-{8,})$");

    // "========Daisy========"
    private static final Pattern BRANDED_SEPARATOR = Pattern.compile("^(?:={8,}.+={8,}|-{8,}.+-{8,})$");

    /**
     * Extract every valid credential in file order.
     */
    public List<CredentialRecord> extract(String content) {
        List<CredentialRecord> records = new ArrayList<>();
        if (content == null || content.isBlank()) {
            return records;
        }

        Block block = new Block();
        for (String line : LineGrammar.splitLines(content)) {
            String trimmed = line.strip();
            if (isSeparator(trimmed)) {
                block.flushInto(records);
                block = new Block();
                continue;
            }

            String label = labelOf(trimmed);
            if (containsAny(label, URL_LABELS)) {
                if (block.url != null) {
                    block.flushInto(records);
                    block = new Block();
                }
                String url = valueOf(trimmed);
                block.url = url.isEmpty() ? null : url;
            } else if (containsAny(label, USERNAME_LABELS)) {
                block.username = valueOf(trimmed);
            } else if (containsAny(label, PASSWORD_LABELS)) {
                block.password = valueOf(trimmed);
            } else if (containsAny(label, BROWSER_LABELS)) {
                block.browser = valueOf(trimmed);
            }
        }
        block.flushInto(records);

        log.debug("Extracted {} credentials", records.size());
        return records;
    }

    /**
     * Blank lines, 8+ runs of '=' or '-', and branded banners that carry no credential label.
     */
    static boolean isSeparator(String trimmed) {
        if (trimmed.isEmpty() || PURE_SEPARATOR.matcher(trimmed).matches()) {
            return true;
        }
        if (BRANDED_SEPARATOR.matcher(trimmed).matches()) {
            String lower = trimmed.toLowerCase(Locale.ROOT);
            return !containsAny(lower, URL_LABELS) && !containsAny(lower, USERNAME_LABELS)
                && !containsAny(lower, PASSWORD_LABELS) && !containsAny(lower, BROWSER_LABELS);
        }
        return false;
    }

    /**
     * Lower-cased label part of a line, up to and including the first ':'.
     * Lines without a colon have no label.
     */
    static String labelOf(String line) {
        int colon = line.indexOf(':');
        return colon >= 0 ? line.substring(0, colon + 1).toLowerCase(Locale.ROOT) : "";
    }

    /**
     * Text after the first ':', trimmed; the whole line when there is none.
     */
    static String valueOf(String line) {
        int colon = line.indexOf(':');
        return colon >= 0 ? line.substring(colon + 1).strip() : line.strip();
    }

    static boolean containsAny(String lower, List<String> labels) {
        for (String label : labels) {
            if (lower.contains(label)) {
                return true;
            }
        }
        return false;
    }

    private static final class Block {

        private String url;
        private String username;
        private String password;
        private String browser;

        void flushInto(List<CredentialRecord> records) {
            if (url == null && username == null && password == null) {
                return;
            }
            if (url == null || username == null || password == null) {
                log.trace("Dropping incomplete credential block (url={}, username present={}, password present={})",
                    url, username != null, password != null);
                return;
            }
            UrlInfo info = UrlInfo.extractUrlInfo(url);
            records.add(new CredentialRecord(url, username, password,
                browser == null || browser.isEmpty() ? null : browser,
                info.getDomain(), info.getTld(), null));
        }
    }
}
