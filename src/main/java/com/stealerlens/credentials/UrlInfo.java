package com.stealerlens.credentials;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Registrable domain and top-level domain derived from a credential URL.
 */
public final class UrlInfo {

    private static final UrlInfo EMPTY = new UrlInfo(null, null);

    private static final Pattern SCHEME = Pattern.compile("^https?://", Pattern.CASE_INSENSITIVE);
    private static final Pattern IPV4_SHAPE = Pattern.compile("^(\\d{1,3}\\.){3}\\d{1,3}$");

    private final String domain;
    private final String tld;

    private UrlInfo(String domain, String tld) {
        this.domain = domain;
        this.tld = tld;
    }

    /**
     * "https://v1.api.example.com:8080/path" yields ("example.com", "com");
     * an IPv4 host yields (host, null).
     */
    public static UrlInfo extractUrlInfo(String url) {
        if (url == null || url.isBlank()) {
            return EMPTY;
        }
        String host = host(url).toLowerCase(Locale.ROOT);
        if (host.startsWith("www.")) {
            host = host.substring(4);
        }
        if (host.isEmpty()) {
            return EMPTY;
        }
        if (IPV4_SHAPE.matcher(host).matches()) {
            return new UrlInfo(host, null);
        }
        String[] labels = host.split("\\.");
        if (labels.length >= 2) {
            String tld = labels[labels.length - 1];
            String domain = labels.length > 2 ? labels[labels.length - 2] + "." + tld : host;
            return new UrlInfo(domain, tld);
        }
        return new UrlInfo(host, null);
    }

    /**
     * True when the URL's host is a dotted quad.
     */
    public static boolean isIpAddress(String url) {
        return url != null && IPV4_SHAPE.matcher(host(url)).matches();
    }

    private static String host(String url) {
        String stripped = SCHEME.matcher(url.strip()).replaceFirst("");
        int slash = stripped.indexOf('/');
        if (slash >= 0) {
            stripped = stripped.substring(0, slash);
        }
        int colon = stripped.indexOf(':');
        if (colon >= 0) {
            stripped = stripped.substring(0, colon);
        }
        return stripped;
    }

    public String getDomain() {
        return domain;
    }

    public String getTld() {
        return tld;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        UrlInfo urlInfo = (UrlInfo) o;
        return Objects.equals(domain, urlInfo.domain) && Objects.equals(tld, urlInfo.tld);
    }

    @Override
    public int hashCode() {
        return Objects.hash(domain, tld);
    }

    @Override
    public String toString() {
        return "UrlInfo{domain='" + domain + "', tld='" + tld + "'}";
    }
}
