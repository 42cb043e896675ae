package com.scaleunlimited.politecrawler.urls;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a URL's domain is in scope for the crawl. The start domain
 * is always in scope. Other domains are admitted, first come first served,
 * until the external hop budget is used up. Once admitted, a domain stays in
 * scope for the rest of the session.
 */
public class DomainScopeGuard {
    private static final Logger LOGGER = LoggerFactory.getLogger(DomainScopeGuard.class);

    private final String _startDomain;
    private final boolean _allowExternal;
    private final int _externalHopBudget;

    private int _hopsUsed = 0;
    private final Set<String> _admittedDomains = new LinkedHashSet<>();

    public DomainScopeGuard(String startDomain) {
        this(startDomain, false, 0);
    }

    public DomainScopeGuard(String startDomain, boolean allowExternal, int externalHopBudget) {
        if (externalHopBudget < 0) {
            throw new IllegalArgumentException("External hop budget can't be negative: " + externalHopBudget);
        }

        _startDomain = startDomain;
        _allowExternal = allowExternal;
        _externalHopBudget = externalHopBudget;
    }

    /**
     * Check the URL's domain, and admit it as a new external domain if
     * there's still budget left. This is the only place where the hop
     * budget is consumed.
     * 
     * @param url canonical URL
     * @return true if the URL may be crawled
     */
    public synchronized boolean isInScope(String url) {
        String domain = UrlCanonicalizer.getDomain(url);
        if (domain.equals(_startDomain) || _admittedDomains.contains(domain)) {
            return true;
        }

        if (!_allowExternal) {
            return false;
        }

        if (_hopsUsed < _externalHopBudget) {
            _hopsUsed += 1;
            _admittedDomains.add(domain);
            LOGGER.info("Following to external domain: {} ({}/{})", domain, _hopsUsed, _externalHopBudget);
            return true;
        }

        LOGGER.debug("Max external hops reached, skipping: {}", domain);
        return false;
    }

    public String getStartDomain() {
        return _startDomain;
    }

    public boolean isAllowExternal() {
        return _allowExternal;
    }

    public int getExternalHopBudget() {
        return _externalHopBudget;
    }

    public synchronized int getHopsUsed() {
        return _hopsUsed;
    }

    public synchronized Set<String> getAdmittedDomains() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(_admittedDomains));
    }
}
