package com.scaleunlimited.politecrawler.fetcher;

/**
 * The User-Agent header we send with every request, plus the (usually
 * shorter) token that robots.txt User-agent lines are matched against.
 */
public class CrawlerUserAgent {

    private final String _agentName;
    private final String _userAgentString;

    public CrawlerUserAgent(String agentName, String userAgentString) {
        _agentName = agentName;
        _userAgentString = userAgentString;
    }

    public String getAgentName() {
        return _agentName;
    }

    public String getUserAgentString() {
        return _userAgentString;
    }

    @Override
    public String toString() {
        return String.format("%s (robots.txt name '%s')", _userAgentString, _agentName);
    }
}
