/*
 * Copyright 2009-2019 Scale Unlimited
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package com.scaleunlimited.politecrawler.fetcher;

import com.scaleunlimited.politecrawler.pojos.FetchStatus;

/**
 * Base for failures fetching a single page. These never stop the crawl; the
 * crawler records the status and moves on to the next URL.
 */
@SuppressWarnings("serial")
public abstract class PageFetchException extends Exception {

    private String _url;

    protected PageFetchException(String url, String msg) {
        super(msg);
        _url = url;
    }

    protected PageFetchException(String url, String msg, Throwable cause) {
        super(msg, cause);
        _url = url;
    }

    public String getUrl() {
        return _url;
    }

    public abstract FetchStatus getFetchStatus();
}
