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
package com.scaleunlimited.politecrawler.pojos;

/**
 * Outcome for one URL taken off the frontier (or dropped before it got
 * there). Every outcome is counted by the crawler.
 */
public enum FetchStatus {

    FETCHED,                // Fetched, parsed and recorded

    SKIPPED_VISITED,        // Already processed earlier in the crawl
    SKIPPED_DEPTH,          // Deeper than the max crawl depth
    SKIPPED_BLOCKED,        // Disallowed by robots.txt
    SKIPPED_FILTERED,       // Rejected by an exclude or include pattern
    SKIPPED_OUT_OF_SCOPE,   // Domain not in scope, or external hop budget used up
    SKIPPED_NOT_HTML,       // Content type isn't HTML
    SKIPPED_QUEUE_FULL,     // Frontier was at capacity when the link was found
    SKIPPED_INTERRUPTED,    // Fetching thread was interrupted, so the request was aborted

    RATE_LIMITED,           // Server returned 429

    HTTP_REDIRECTION_ERROR, // 3xx that we couldn't follow
    HTTP_UNAUTHORIZED,      // 401, 407
    HTTP_FORBIDDEN,         // 403
    HTTP_NOT_FOUND,         // 404
    HTTP_GONE,              // 410
    HTTP_CLIENT_ERROR,      // Other 4xx
    HTTP_SERVER_ERROR,      // 5xx

    ERROR_TIMEOUT,          // Connect or read timeout
    ERROR_IOEXCEPTION,      // Connection refused, reset, DNS failure, etc.
    ERROR_INVALID_URL,      // URL rejected by the fetcher
    ERROR_PARSE,            // Content couldn't be parsed
    ERROR_UNKNOWN;          // Anything else caught at the page boundary
}
