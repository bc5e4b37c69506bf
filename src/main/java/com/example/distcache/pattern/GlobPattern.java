package com.example.distcache.pattern;

import com.example.distcache.core.CacheArguments;

/**
 * Compiled glob pattern. {@code *} matches any run of characters (including none), {@code ?}
 * exactly one; everything else is literal. Matching is case-sensitive and anchored at both ends.
 */
public final class GlobPattern {

    private final String pattern;
    private final String literalPrefix;
    private final boolean literal;

    private GlobPattern(String pattern) {
        this.pattern = pattern;
        int firstWildcard = firstWildcard(pattern);
        this.literal = firstWildcard < 0;
        this.literalPrefix = literal ? pattern : pattern.substring(0, firstWildcard);
    }

    public static GlobPattern compile(String pattern) {
        return new GlobPattern(CacheArguments.requirePattern(pattern));
    }

    /** Pattern matching every key under {@code namespace + ":"}. */
    public static GlobPattern namespace(String namespace) {
        return compile(CacheArguments.requireNamespace(namespace) + ":*");
    }

    public String pattern() {
        return pattern;
    }

    /** Characters every match must start with. */
    public String literalPrefix() {
        return literalPrefix;
    }

    /** True when the pattern contains no wildcard and so matches one key at most. */
    public boolean isLiteral() {
        return literal;
    }

    public boolean matches(String key) {
        if (key == null || !key.startsWith(literalPrefix)) {
            return false;
        }
        if (literal) {
            return key.length() == pattern.length();
        }
        return matchFrom(key, literalPrefix.length(), literalPrefix.length());
    }

    /**
     * The pattern rewritten for Redis {@code SCAN MATCH}, which also treats {@code [}, {@code ]}
     * and {@code \} as special.
     */
    public String toRedisPattern() {
        StringBuilder sb = new StringBuilder(pattern.length() + 8);
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '[' || c == ']' || c == '\\') {
                sb.append('\\');
            }
            sb.append(c);
        }
        return sb.toString();
    }

    // Iterative matcher; on mismatch resume after the last star, consuming one more key char.
    private boolean matchFrom(String key, int k, int p) {
        int starP = -1;
        int starK = -1;
        while (k < key.length()) {
            if (p < pattern.length()) {
                char c = pattern.charAt(p);
                if (c == '*') {
                    starP = p++;
                    starK = k;
                    continue;
                }
                if (c == '?' || c == key.charAt(k)) {
                    p++;
                    k++;
                    continue;
                }
            }
            if (starP < 0) {
                return false;
            }
            p = starP + 1;
            k = ++starK;
        }
        while (p < pattern.length() && pattern.charAt(p) == '*') {
            p++;
        }
        return p == pattern.length();
    }

    private static int firstWildcard(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            char c = pattern.charAt(i);
            if (c == '*' || c == '?') {
                return i;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return pattern;
    }
}
