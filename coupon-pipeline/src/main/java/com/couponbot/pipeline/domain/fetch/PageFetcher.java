package com.couponbot.pipeline.domain.fetch;

/**
 * Blocking HTTP GET shared by collectors and validators.
 * Non-2xx responses are returned as pages; only transport failures throw
 * {@link com.couponbot.pipeline.domain.exceptions.PageFetchException}.
 */
public interface PageFetcher {

    FetchedPage fetch(String url);
}
