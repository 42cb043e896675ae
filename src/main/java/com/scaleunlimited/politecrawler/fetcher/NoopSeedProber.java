package com.scaleunlimited.politecrawler.fetcher;

import org.apache.http.HttpStatus;

public class NoopSeedProber extends BaseSeedProber {

    @Override
    public int probe(String url) {
        return HttpStatus.SC_OK;
    }

}
