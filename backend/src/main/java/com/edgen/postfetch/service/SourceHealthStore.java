package com.edgen.postfetch.service;

import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceHealthSnapshot;

import java.util.Optional;

/**
 * Where breaker state survives restarts. Implementations must not throw on
 * backend failures; losing a write only costs a re-learned failure count.
 */
public interface SourceHealthStore {

    Optional<SourceHealthSnapshot> load(PostSource source);

    void save(SourceHealthSnapshot snapshot);
}
