package com.scoutmind.core.search;

import com.scoutmind.core.model.SearchHit;

import java.util.List;

/**
 * Web search backend used by the search task.
 */
public interface SearchClient {

    /**
     * @throws SearchException when the backend is unconfigured or the call fails
     */
    List<SearchHit> search(String query, int maxResults);

    boolean isConfigured();
}
