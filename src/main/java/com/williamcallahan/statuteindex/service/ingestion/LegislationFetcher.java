package com.williamcallahan.statuteindex.service.ingestion;

import com.williamcallahan.statuteindex.domain.ingestion.FetchResult;

/**
 * Source of raw legislation feed pages and document markup.
 */
public interface LegislationFetcher {

    /**
     * Fetches one page (1-based) of the collection's Atom feed.
     *
     * @throws LegislationFetchException when the page cannot be retrieved at all
     */
    FetchResult fetchFeedPage(int page);

    /**
     * Fetches the markup rendition of one document.
     *
     * @throws LegislationFetchException when the document cannot be retrieved at all
     */
    FetchResult fetchDocumentMarkup(int year, int number);
}
