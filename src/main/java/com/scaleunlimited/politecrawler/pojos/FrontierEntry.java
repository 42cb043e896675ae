package com.scaleunlimited.politecrawler.pojos;

/**
 * A canonical URL waiting in the frontier, with the link depth at which it
 * was discovered (the seed is depth 0).
 */
public class FrontierEntry {

    private final String _url;
    private final int _depth;

    public FrontierEntry(String url, int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Depth can't be negative: " + depth);
        }

        _url = url;
        _depth = depth;
    }

    public String getUrl() {
        return _url;
    }

    public int getDepth() {
        return _depth;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + _depth;
        result = prime * result + ((_url == null) ? 0 : _url.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        FrontierEntry other = (FrontierEntry) obj;
        if (_depth != other._depth)
            return false;
        if (_url == null) {
            if (other._url != null)
                return false;
        } else if (!_url.equals(other._url))
            return false;
        return true;
    }

    @Override
    public String toString() {
        return String.format("%s (depth %d)", _url, _depth);
    }
}
