package com.gnovoa.livematch.broadcast;

/** Handle returned by {@link BroadcastHub#subscribe}; closing it unsubscribes. */
public final class Subscription implements AutoCloseable {

    private final BroadcastHub hub;
    private final String matchId;
    private final MatchSubscriber subscriber;

    Subscription(BroadcastHub hub, String matchId, MatchSubscriber subscriber) {
        this.hub = hub;
        this.matchId = matchId;
        this.subscriber = subscriber;
    }

    public String matchId() {
        return matchId;
    }

    @Override
    public void close() {
        hub.unsubscribe(matchId, subscriber);
    }
}
