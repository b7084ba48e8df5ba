package com.detour.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * URL test used by mock rules.
 */
@FunctionalInterface
public interface UrlMatcher {

    boolean matches(String url);

    /**
     * Matches any URL containing the literal fragment.
     */
    static UrlMatcher contains(String fragment) {
        Objects.requireNonNull(fragment, "fragment");
        return new UrlMatcher() {
            @Override
            public boolean matches(String url) {
                return url != null && url.contains(fragment);
            }

            @Override
            public String toString() {
                return "contains(" + fragment + ")";
            }
        };
    }

    /**
     * Matches any URL in which the pattern is found (not necessarily the whole URL).
     */
    static UrlMatcher pattern(Pattern pattern) {
        Objects.requireNonNull(pattern, "pattern");
        return new UrlMatcher() {
            @Override
            public boolean matches(String url) {
                return url != null && pattern.matcher(url).find();
            }

            @Override
            public String toString() {
                return "pattern(" + pattern.pattern() + ")";
            }
        };
    }

    static UrlMatcher pattern(String regex) {
        return pattern(Pattern.compile(regex));
    }
}
