package io.github.jbellis.wikimark.config;

/**
 * Settings accepted by the converter.
 *
 * @param siteBaseUrl         prefix for site-relative links (those starting with "/")
 * @param issueTrackerBaseUrl prefix that an issue key is appended to
 * @param maxHeadingLevel     deepest heading the target dialect supports; deeper headings are clamped
 * @param calloutStyle        rendering of info/note macros
 */
public record ConverterConfig(String siteBaseUrl,
                              String issueTrackerBaseUrl,
                              int maxHeadingLevel,
                              CalloutStyle calloutStyle) {

    public static final String DEFAULT_SITE_BASE_URL = "https://wiki.example.com";
    public static final String DEFAULT_ISSUE_TRACKER_BASE_URL = "https://issues.example.com/browse/";
    public static final int DEFAULT_MAX_HEADING_LEVEL = 3;

    public ConverterConfig {
        if (siteBaseUrl == null || siteBaseUrl.isBlank()) {
            throw new IllegalArgumentException("siteBaseUrl must not be blank");
        }
        if (issueTrackerBaseUrl == null || issueTrackerBaseUrl.isBlank()) {
            throw new IllegalArgumentException("issueTrackerBaseUrl must not be blank");
        }
        if (maxHeadingLevel < 1 || maxHeadingLevel > 6) {
            throw new IllegalArgumentException("maxHeadingLevel must be between 1 and 6, got " + maxHeadingLevel);
        }
        if (calloutStyle == null) {
            throw new IllegalArgumentException("calloutStyle must not be null");
        }
        // relative links are appended directly, so drop a trailing slash
        while (siteBaseUrl.endsWith("/")) {
            siteBaseUrl = siteBaseUrl.substring(0, siteBaseUrl.length() - 1);
        }
    }

    public static ConverterConfig defaults() {
        return new ConverterConfig(DEFAULT_SITE_BASE_URL,
                                   DEFAULT_ISSUE_TRACKER_BASE_URL,
                                   DEFAULT_MAX_HEADING_LEVEL,
                                   CalloutStyle.BLOCKQUOTE);
    }

    public ConverterConfig withSiteBaseUrl(String url) {
        return new ConverterConfig(url, issueTrackerBaseUrl, maxHeadingLevel, calloutStyle);
    }

    public ConverterConfig withIssueTrackerBaseUrl(String url) {
        return new ConverterConfig(siteBaseUrl, url, maxHeadingLevel, calloutStyle);
    }

    public ConverterConfig withMaxHeadingLevel(int level) {
        return new ConverterConfig(siteBaseUrl, issueTrackerBaseUrl, level, calloutStyle);
    }

    public ConverterConfig withCalloutStyle(CalloutStyle style) {
        return new ConverterConfig(siteBaseUrl, issueTrackerBaseUrl, maxHeadingLevel, style);
    }
}
