package com.edgen.postfetch.source;

import com.edgen.postfetch.model.PostReference;
import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceFailure;
import com.edgen.postfetch.model.SourceFetchException;
import com.edgen.postfetch.model.SourceFetchResult;

/**
 * One retrieval strategy for a single post.
 * Implementations build the request, normalize the response and classify errors.
 * They never retry; fallback decisions belong to the orchestrator.
 */
public interface PostSourceClient {

    PostSource source();

    boolean isEnabled();

    /**
     * Fetches one post.
     *
     * @throws SourceFetchException with a classified failure when the source cannot produce a complete record
     */
    SourceFetchResult fetch(PostReference reference);

    /**
     * Maps anything thrown by {@link #fetch(PostReference)} into the shared failure taxonomy.
     */
    SourceFailure classify(Throwable error);
}
