package com.gnovoa.livematch.core;

import com.gnovoa.livematch.cache.CacheKeys;
import com.gnovoa.livematch.cache.ReadCache;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.Match;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Derives the scoreboard from the event log. The score is always rebuilt from scratch, so running
 * it any number of times yields the same result.
 */
public final class ScoreProjector {

    private static final Logger log = LoggerFactory.getLogger(ScoreProjector.class);

    public record Score(int home, int away) {}

    private final TransactionRunner runner;
    private final ReadCache cache;

    public ScoreProjector(TransactionRunner runner, ReadCache cache) {
        this.runner = runner;
        this.cache = cache;
    }

    public Score recompute(String matchId) {
        return runner.run(matchId, tx -> {
            Match match = tx.match();
            Score score = project(match, tx.events());
            if (score.home() != match.homeScore() || score.away() != match.awayScore()) {
                tx.updateMatch(match.withScore(score.home(), score.away()));
                tx.afterCommit("cache invalidation", () -> cache.invalidate(CacheKeys.matchStatus(matchId)));
                log.info("Match {} score {}-{}", matchId, score.home(), score.away());
            }
            return score;
        });
    }

    /**
     * Folds the live goal and own-goal events of a match: a goal counts for its team, an own goal
     * for the other one. Events of teams outside the match are ignored.
     */
    public static Score project(Match match, Collection<MatchEvent> events) {
        int home = 0;
        int away = 0;
        for (MatchEvent e : events) {
            if (e.isDeleted() || !e.kind().affectsScore() || !match.involves(e.teamId())) continue;
            boolean forHome = match.isHome(e.teamId()) == (e.kind() == EventKind.GOAL);
            if (forHome) home++;
            else away++;
        }
        return new Score(home, away);
    }
}
