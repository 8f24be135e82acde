package com.edgen.postfetch.service;

import com.edgen.postfetch.model.PostSource;
import com.edgen.postfetch.model.SourceHealthSnapshot;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class InMemorySourceHealthStore implements SourceHealthStore {

    private final Map<PostSource, SourceHealthSnapshot> snapshots = new ConcurrentHashMap<>();

    @Override
    public Optional<SourceHealthSnapshot> load(PostSource source) {
        return Optional.ofNullable(snapshots.get(source));
    }

    @Override
    public void save(SourceHealthSnapshot snapshot) {
        SourceHealthSnapshot requiredSnapshot = Objects.requireNonNull(snapshot, "snapshot is required");
        snapshots.put(requiredSnapshot.source(), requiredSnapshot);
    }
}
