package com.pricelens.engine.matching;

import com.pricelens.engine.model.Match;

import java.util.List;

/**
 * Output of one matcher pass.
 *
 * @param matches every match of the store after the pass, ordered by sequence
 * @param created matches made for listings that had none
 * @param rescored existing AUTO_MATCHED/PENDING matches whose recomputed confidence differs from the stored one
 * @param preserved number of matches carried over unchanged (reviewed, same score, or product or listing gone)
 */
public record MatchResult(List<Match> matches, List<Match> created, List<Match> rescored, int preserved) {

    public int createdCount() { return created.size(); }

    public int updatedCount() { return rescored.size(); }
}
