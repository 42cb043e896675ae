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
import com.scaleunlimited.politecrawler.utils.ExceptionUtils;

/**
 * The server responded, but not with a 2xx status.
 */
@SuppressWarnings("serial")
public class HttpFetchException extends PageFetchException {

    public static final int SC_TOO_MANY_REQUESTS = 429;

    private int _httpStatus;

    public HttpFetchException(String url, int httpStatus) {
        super(url, String.format("Error fetching %s (%d)", url, httpStatus));

        _httpStatus = httpStatus;
    }

    public int getHttpStatus() {
        return _httpStatus;
    }

    public boolean isRateLimited() {
        return _httpStatus == SC_TOO_MANY_REQUESTS;
    }

    @Override
    public FetchStatus getFetchStatus() {
        return ExceptionUtils.mapHttpStatusToFetchStatus(_httpStatus);
    }
}
