package com.gnovoa.livematch.quota;

import com.gnovoa.livematch.error.FailureKind;
import com.gnovoa.livematch.error.MatchOperationException;
import com.gnovoa.livematch.events.EventKind;
import com.gnovoa.livematch.events.MatchEvent;
import com.gnovoa.livematch.model.Requester;
import com.gnovoa.livematch.store.MatchStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Enforces {@link QuotaProperties} against the committed event log of a match.
 *
 * <p>Admins are treated as premium. Scoring and formation events are not counted towards the
 * per-match event limit; formation changes have their own limit. Hard caps apply to every plan.
 */
public final class PlanQuotaChecker implements QuotaChecker {

    private static final Logger log = LoggerFactory.getLogger(PlanQuotaChecker.class);

    private final MatchStore store;
    private final QuotaProperties props;

    public PlanQuotaChecker(MatchStore store, QuotaProperties props) {
        this.store = store;
        this.props = props;
    }

    @Override
    public void checkEventCreate(Requester requester, String matchId, EventKind kind) {
        if (!props.enabled()) return;
        PlanType plan = planOf(requester);
        QuotaProperties.PlanLimits limits = props.limits(plan);
        requireAllowed(plan, limits, kind);

        List<MatchEvent> live = liveEvents(matchId);
        if (live.size() >= props.hardCaps().totalEventsPerMatch()) {
            throw exceeded("Match " + matchId + " reached the limit of "
                    + props.hardCaps().totalEventsPerMatch() + " events");
        }
        if (!isCounted(kind)) return;
        long counted = live.stream().filter(e -> isCounted(e.kind())).count();
        if (counted >= limits.eventsPerMatch()) {
            throw exceeded("Plan " + plan + " allows " + limits.eventsPerMatch() + " events per match");
        }
    }

    @Override
    public void checkKindChange(Requester requester, String matchId, EventKind newKind) {
        if (!props.enabled()) return;
        PlanType plan = planOf(requester);
        requireAllowed(plan, props.limits(plan), newKind);
    }

    @Override
    public void checkFormationChange(Requester requester, String matchId) {
        if (!props.enabled()) return;
        PlanType plan = planOf(requester);
        QuotaProperties.PlanLimits limits = props.limits(plan);
        long changes = liveEvents(matchId).stream().filter(e -> e.kind() == EventKind.FORMATION_CHANGE).count();
        int limit = Math.min(limits.formationChangesPerMatch(), props.hardCaps().formationChangesPerMatch());
        if (changes >= limit) {
            throw exceeded("Plan " + plan + " allows " + limit + " formation changes per match");
        }
    }

    private PlanType planOf(Requester requester) {
        return requester.isAdmin() ? PlanType.PREMIUM : props.planFor(requester.userId());
    }

    private static void requireAllowed(PlanType plan, QuotaProperties.PlanLimits limits, EventKind kind) {
        if (kind != null && !limits.allowedKinds().contains(kind)) {
            throw exceeded("Event kind " + kind.wireName() + " is not available on the " + plan + " plan");
        }
    }

    private static boolean isCounted(EventKind kind) {
        return kind != null && !kind.affectsScore() && kind != EventKind.FORMATION_CHANGE;
    }

    private List<MatchEvent> liveEvents(String matchId) {
        return store.inTransaction(matchId, tx -> tx.events().stream().filter(e -> !e.isDeleted()).toList());
    }

    private static MatchOperationException exceeded(String message) {
        log.debug("Quota rejected: {}", message);
        return new MatchOperationException(FailureKind.QUOTA_EXCEEDED, message);
    }
}
