package com.pricelens.engine.repository;

import com.pricelens.engine.error.NotFoundException;
import com.pricelens.engine.model.Match;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Repository
public class InMemoryMatchRepository implements MatchRepository {
    private final Map<String, Match> matches = new ConcurrentHashMap<>();

    @Override
    public List<Match> findByStore(String storeId) {
        return matches.values().stream()
                .filter(m -> storeId.equals(m.getStoreId()))
                .map(Match::copy)
                .sorted(Comparator.comparingLong(Match::getSequence))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Match> findById(String id) {
        return Optional.ofNullable(matches.get(id)).map(Match::copy);
    }

    @Override
    public void saveAll(List<Match> toSave) {
        for (Match m : toSave) {
            matches.put(m.getId(), m.copy());
        }
    }

    @Override
    public Match update(String id, UnaryOperator<Match> update) {
        Match updated = matches.computeIfPresent(id, (k, current) -> update.apply(current.copy()));
        if (updated == null) {
            throw new NotFoundException("match", id);
        }
        return updated.copy();
    }
}
