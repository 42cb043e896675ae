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
 * We never got a usable response: timeout, connection failure, too many
 * redirects, content we refused to download, etc.
 */
@SuppressWarnings("serial")
public class TransportFetchException extends PageFetchException {

    private FetchStatus _status;

    public TransportFetchException(String url, FetchStatus status, Throwable cause) {
        super(url, String.format("%s fetching %s: %s", status, url, cause.getMessage()), cause);

        _status = status;
    }

    public boolean isTimeout() {
        return _status == FetchStatus.ERROR_TIMEOUT;
    }

    @Override
    public FetchStatus getFetchStatus() {
        return _status;
    }
}
