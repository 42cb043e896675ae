package com.scaleunlimited.politecrawler.urls;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

public class UrlPatternFilterTest {

    @Test
    public void testNoPatterns() {
        UrlPatternFilter filter = new UrlPatternFilter();
        assertThat(filter.hasPatterns()).isFalse();
        assertThat(filter.isAllowedByPatterns("http://domain.com/anything")).isTrue();
    }

    @Test
    public void testExclude() {
        UrlPatternFilter filter = new UrlPatternFilter(Arrays.asList("*/login*"), Collections.<String> emptyList());
        assertThat(filter.hasPatterns()).isTrue();
        assertThat(filter.isAllowedByPatterns("http://domain.com/about")).isTrue();
        assertThat(filter.isAllowedByPatterns("http://domain.com/login")).isFalse();
        assertThat(filter.isAllowedByPatterns("http://domain.com/login/reset")).isFalse();
        assertThat(filter.isAllowedByPatterns("http://domain.com/LOGIN")).isFalse();
    }

    @Test
    public void testIncludeIsDefaultDeny() {
        UrlPatternFilter filter = new UrlPatternFilter(Collections.<String> emptyList(),
                Arrays.asList("*/blog/*", "*/news/*"));
        assertThat(filter.isAllowedByPatterns("http://domain.com/blog/post1")).isTrue();
        assertThat(filter.isAllowedByPatterns("http://domain.com/news/today")).isTrue();
        assertThat(filter.isAllowedByPatterns("http://domain.com/about")).isFalse();
    }

    @Test
    public void testExcludeWinsOverInclude() {
        UrlPatternFilter filter = new UrlPatternFilter(Arrays.asList("*/blog/draft*"),
                Arrays.asList("*/blog/*"));
        assertThat(filter.isAllowedByPatterns("http://domain.com/blog/post1")).isTrue();
        assertThat(filter.isAllowedByPatterns("http://domain.com/blog/draft-2")).isFalse();
    }

    @Test
    public void testGlobSyntax() {
        assertThat(UrlPatternFilter.globToPattern("*/page?.html").matcher("http://domain.com/page1.html").matches()).isTrue();
        assertThat(UrlPatternFilter.globToPattern("*/page?.html").matcher("http://domain.com/page12.html").matches()).isFalse();
        assertThat(UrlPatternFilter.globToPattern("*/page[0-9]").matcher("http://domain.com/page7").matches()).isTrue();
        assertThat(UrlPatternFilter.globToPattern("*/page[!0-9]").matcher("http://domain.com/page7").matches()).isFalse();
        assertThat(UrlPatternFilter.globToPattern("*/page[!0-9]").matcher("http://domain.com/pageX").matches()).isTrue();

        // Dots and other regex characters are literals.
        assertThat(UrlPatternFilter.globToPattern("*.pdf").matcher("http://domain.com/filexpdf").matches()).isFalse();
        assertThat(UrlPatternFilter.globToPattern("*.pdf").matcher("http://domain.com/file.pdf").matches()).isTrue();
    }

    @Test
    public void testAnchors() {
        assertThat(UrlPatternFilter.globToPattern("^http://domain.com/*$").matcher("http://domain.com/page").matches()).isTrue();
        assertThat(UrlPatternFilter.globToPattern("^http://domain.com/*$").matcher("https://domain.com/page").matches()).isFalse();

        // Without a wildcard, the whole URL has to match.
        assertThat(UrlPatternFilter.globToPattern("login").matcher("http://domain.com/login").matches()).isFalse();
    }
}
