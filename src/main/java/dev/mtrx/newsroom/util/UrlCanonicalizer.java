package dev.mtrx.newsroom.util;

import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical form of article URLs, used as the deduplication key.
 *
 * <pre>
 * HTTPS://www.LeMonde.fr/economie/article/?utm_source=rss#xtor=RSS  ->  https://www.lemonde.fr/economie/article
 * </pre>
 */
public final class UrlCanonicalizer {

    private static final Set<String> TRACKING_PARAMS = Set.of("fbclid", "gclid", "mc_cid", "mc_eid");

    private UrlCanonicalizer() {}

    /**
     * Empty when the value is blank, not absolute, or not http(s).
     */
    public static Optional<String> canonicalize(String url) {
        if (url == null || url.isBlank()) return Optional.empty();
        UriComponents parsed;
        try {
            parsed = UriComponentsBuilder.fromUriString(url.trim()).build();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
        String scheme = parsed.getScheme();
        String host = parsed.getHost();
        if (scheme == null || host == null || host.isBlank()) return Optional.empty();
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) return Optional.empty();

        UriComponentsBuilder builder = UriComponentsBuilder.newInstance()
                .scheme(scheme)
                .host(host.toLowerCase(Locale.ROOT))
                .port(parsed.getPort())
                .path(stripTrailingSlash(parsed.getPath()));
        parsed.getQueryParams().forEach((name, values) -> {
            if (!isTracking(name)) {
                builder.queryParam(name, values.toArray());
            }
        });
        return Optional.of(builder.build().toUriString());
    }

    static boolean isTracking(String param) {
        String lower = param.toLowerCase(Locale.ROOT);
        return lower.startsWith("utm_") || TRACKING_PARAMS.contains(lower);
    }

    private static String stripTrailingSlash(String path) {
        if (path == null) return null;
        String result = path;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result.equals("/") ? null : result;
    }
}
