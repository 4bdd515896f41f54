package dev.crawlwatch.page;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class that normalizes page URLs so that sitemap entries, manual imports and extraction
 * requests of the same page map to the same {@link PageRecord}.
 * Removes fragments, tracking query params, normalizes trailing slashes and host casing.
 */
public final class UrlNormalizer {

    private static final Logger log = LoggerFactory.getLogger(UrlNormalizer.class);

    private static final Set<String> TRACKING_PARAMS = Set.of(
            "utm_source", "utm_medium", "utm_campaign", "utm_term", "utm_content",
            "gclid", "fbclid", "ref"
    );

    private UrlNormalizer() {
        // utility class
    }

    /**
     * Normalize a URL for page identity:
     * - Remove fragments (#section)
     * - Remove common tracking query params (utm_*, gclid, fbclid, ref)
     * - Remove trailing slash unless URL is just the domain root
     * - Lowercase scheme and host (path is case-sensitive)
     *
     * @param url the URL to normalize
     * @return normalized URL string, or the input trimmed if malformed
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }
        String trimmed = url.trim();

        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            log.warn("Malformed URL, returning unchanged: {}", trimmed);
            return trimmed;
        }

        if (uri.getScheme() == null || uri.getHost() == null) {
            log.warn("URL missing scheme or host, returning unchanged: {}", trimmed);
            return trimmed;
        }

        String scheme = uri.getScheme().toLowerCase();
        String host = uri.getHost().toLowerCase();
        int port = uri.getPort();
        String path = uri.getRawPath();
        String query = uri.getRawQuery();

        if (path == null || path.isEmpty()) {
            path = "/";
        }
        if (path.length() > 1 && path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }

        String filteredQuery = filterQueryParams(query);

        StringBuilder sb = new StringBuilder();
        sb.append(scheme).append("://").append(host);
        if (port != -1 && !isDefaultPort(scheme, port)) {
            sb.append(':').append(port);
        }
        sb.append(path);
        if (filteredQuery != null && !filteredQuery.isEmpty()) {
            sb.append('?').append(filteredQuery);
        }

        return sb.toString();
    }

    /**
     * Whether the URL is an absolute http(s) URL with a host. Anything else is rejected at
     * discovery time and counted as a failed page.
     */
    public static boolean isValidPageUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    /**
     * Derive the page slug from the URL path: the path without its leading and trailing slashes,
     * or {@code "home"} for the site root.
     *
     * @param url the page URL
     * @return slug, never empty
     */
    public static String slugOf(String url) {
        String path;
        try {
            path = new URI(url).getPath();
        } catch (URISyntaxException e) {
            path = null;
        }
        if (path == null) {
            return "home";
        }
        String slug = path.replaceAll("^/+|/+$", "");
        return slug.isEmpty() ? "home" : slug;
    }

    /**
     * Extract the base URL (scheme://host[:port]) from a full URL.
     * Non-default ports are preserved; default ports (80 for HTTP, 443 for HTTPS) are omitted.
     *
     * @param url the URL to extract the base from
     * @return the base URL, or the input unchanged if malformed
     */
    public static String normalizeToBase(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getScheme() == null || uri.getHost() == null) {
                log.warn("URL missing scheme or host, returning unchanged: {}", url);
                return url;
            }
            String scheme = uri.getScheme().toLowerCase();
            String host = uri.getHost().toLowerCase();
            int port = uri.getPort();
            if (port == -1 || isDefaultPort(scheme, port)) {
                return scheme + "://" + host;
            }
            return scheme + "://" + host + ":" + port;
        } catch (URISyntaxException e) {
            log.warn("Malformed URL, returning unchanged: {}", url);
            return url;
        }
    }

    private static String filterQueryParams(String query) {
        if (query == null || query.isEmpty()) {
            return null;
        }
        String filtered = Arrays.stream(query.split("&"))
                .filter(param -> {
                    String key = param.contains("=") ? param.substring(0, param.indexOf('=')) : param;
                    return !TRACKING_PARAMS.contains(key.toLowerCase());
                })
                .sorted()
                .collect(Collectors.joining("&"));
        return filtered.isEmpty() ? null : filtered;
    }

    private static boolean isDefaultPort(String scheme, int port) {
        return ("http".equals(scheme) && port == 80)
                || ("https".equals(scheme) && port == 443);
    }
}
