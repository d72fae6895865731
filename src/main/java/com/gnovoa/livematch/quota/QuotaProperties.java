package com.gnovoa.livematch.quota;

import com.gnovoa.livematch.events.EventKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Plan based usage limits ({@code quota.*}). Missing sections fall back to the built-in free and
 * premium plans.
 */
@ConfigurationProperties(prefix = "quota")
public record QuotaProperties(
        boolean enabled,
        PlanType defaultPlan,
        Set<String> premiumUsers,
        HardCaps hardCaps,
        Map<PlanType, PlanLimits> plans
) {

    public static final Set<EventKind> CORE_KINDS = EnumSet.of(
            EventKind.GOAL, EventKind.OWN_GOAL, EventKind.PENALTY, EventKind.FOUL,
            EventKind.FREE_KICK, EventKind.ASSIST, EventKind.YELLOW_CARD, EventKind.RED_CARD);

    public QuotaProperties {
        if (defaultPlan == null) defaultPlan = PlanType.FREE;
        if (premiumUsers == null) premiumUsers = Set.of();
        if (hardCaps == null) hardCaps = new HardCaps(10_000, 500);
        Map<PlanType, PlanLimits> merged = new EnumMap<>(PlanType.class);
        merged.put(PlanType.FREE, new PlanLimits(40, 5, CORE_KINDS));
        merged.put(PlanType.PREMIUM, new PlanLimits(150, 20, EnumSet.allOf(EventKind.class)));
        if (plans != null) merged.putAll(plans);
        plans = merged;
    }

    public PlanType planFor(String userId) {
        return premiumUsers.contains(userId) ? PlanType.PREMIUM : defaultPlan;
    }

    public PlanLimits limits(PlanType plan) {
        return plans.get(plan);
    }

    public record HardCaps(int totalEventsPerMatch, int formationChangesPerMatch) {}

    public record PlanLimits(int eventsPerMatch, int formationChangesPerMatch, Set<EventKind> allowedKinds) {
        public PlanLimits {
            allowedKinds = allowedKinds == null || allowedKinds.isEmpty()
                    ? EnumSet.allOf(EventKind.class)
                    : EnumSet.copyOf(allowedKinds);
        }
    }
}
