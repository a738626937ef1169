package com.pricelens.engine.repository;

import com.pricelens.engine.model.Match;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface MatchRepository {
    /** Matches of a store ordered by creation sequence. */
    List<Match> findByStore(String storeId);

    Optional<Match> findById(String id);

    void saveAll(List<Match> matches);

    /**
     * Atomically replaces the match with {@code update.apply(current)}. Exceptions thrown by
     * {@code update} leave the stored match unchanged and propagate.
     */
    Match update(String id, UnaryOperator<Match> update);
}
