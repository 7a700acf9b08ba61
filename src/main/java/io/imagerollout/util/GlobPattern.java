package io.imagerollout.util;

import java.util.regex.Pattern;

/**
 * Case-insensitive glob matcher supporting '*' (any run of characters) and '?' (one character).
 * Everything else matches literally; the glob must cover the whole input.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern pattern;

    private GlobPattern(String glob, Pattern pattern) {
        this.glob = glob;
        this.pattern = pattern;
    }

    public static GlobPattern compile(String glob) {
        String effective = glob == null || glob.isBlank() ? "*" : glob.trim();
        StringBuilder regex = new StringBuilder();
        StringBuilder literal = new StringBuilder();
        for (char c : effective.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return new GlobPattern(effective, Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL));
    }

    public boolean matches(String value) {
        return value != null && pattern.matcher(value).matches();
    }

    public boolean matchesAll() {
        return "*".equals(glob);
    }

    @Override
    public String toString() {
        return glob;
    }
}
