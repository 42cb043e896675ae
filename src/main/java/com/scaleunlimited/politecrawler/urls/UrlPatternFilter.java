package com.scaleunlimited.politecrawler.urls;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies user-supplied exclude and include glob patterns to canonical URLs.
 * Any exclude match rejects the URL. If there are include patterns, the URL
 * must match at least one of them.
 */
public class UrlPatternFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(UrlPatternFilter.class);

    private final List<Pattern> _excludePatterns;
    private final List<Pattern> _includePatterns;

    public UrlPatternFilter() {
        this(Collections.<String> emptyList(), Collections.<String> emptyList());
    }

    public UrlPatternFilter(List<String> excludeGlobs, List<String> includeGlobs) {
        _excludePatterns = compile(excludeGlobs);
        _includePatterns = compile(includeGlobs);
    }

    public boolean isAllowedByPatterns(String url) {
        for (Pattern pattern : _excludePatterns) {
            if (pattern.matcher(url).matches()) {
                LOGGER.debug("URL excluded by pattern '{}': {}", pattern.pattern(), url);
                return false;
            }
        }

        if (_includePatterns.isEmpty()) {
            return true;
        }

        for (Pattern pattern : _includePatterns) {
            if (pattern.matcher(url).matches()) {
                return true;
            }
        }

        LOGGER.debug("URL doesn't match any include pattern: {}", url);
        return false;
    }

    public boolean hasPatterns() {
        return !_excludePatterns.isEmpty() || !_includePatterns.isEmpty();
    }

    /**
     * Translate a glob into a case-insensitive regular expression that has to
     * match the entire URL. <code>*</code> matches any run of characters,
     * <code>?</code> matches one character, and <code>[...]</code> is a
     * character class (<code>[!...]</code> negates it). A leading
     * <code>^</code> or trailing <code>$</code> is an explicit anchor, not a
     * literal.
     * 
     * @param glob pattern to translate
     * @return compiled pattern
     */
    public static Pattern globToPattern(String glob) {
        int start = 0;
        int end = glob.length();
        if (glob.startsWith("^")) {
            start = 1;
        }

        if ((end > start) && glob.endsWith("$")) {
            end -= 1;
        }

        StringBuilder regex = new StringBuilder();
        int i = start;
        while (i < end) {
            char c = glob.charAt(i);
            if (c == '*') {
                regex.append(".*");
                i += 1;
            } else if (c == '?') {
                regex.append('.');
                i += 1;
            } else if (c == '[') {
                int close = findClassEnd(glob, i + 1, end);
                if (close == -1) {
                    regex.append("\\[");
                    i += 1;
                } else {
                    regex.append(translateClass(glob.substring(i + 1, close)));
                    i = close + 1;
                }
            } else {
                regex.append(Pattern.quote(Character.toString(c)));
                i += 1;
            }
        }

        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }

    private static int findClassEnd(String glob, int from, int end) {
        int i = from;
        if ((i < end) && (glob.charAt(i) == '!')) {
            i += 1;
        }

        // A ']' right after the opening bracket is a literal.
        if ((i < end) && (glob.charAt(i) == ']')) {
            i += 1;
        }

        while (i < end) {
            if (glob.charAt(i) == ']') {
                return i;
            }

            i += 1;
        }

        return -1;
    }

    private static String translateClass(String body) {
        StringBuilder result = new StringBuilder("[");
        int i = 0;
        if (body.startsWith("!")) {
            result.append('^');
            i = 1;
        }

        for (; i < body.length(); i++) {
            char c = body.charAt(i);
            if ((c == '\\') || (c == '[') || (c == ']') || (c == '^') || (c == '&')) {
                result.append('\\');
            }

            result.append(c);
        }

        return result.append(']').toString();
    }

    private static List<Pattern> compile(List<String> globs) {
        List<Pattern> result = new ArrayList<>();
        if (globs != null) {
            for (String glob : globs) {
                result.add(globToPattern(glob));
            }
        }

        return Collections.unmodifiableList(result);
    }
}
