package com.gnovoa.livematch.broadcast;

import java.io.IOException;

/** Receiver of match notifications, typically one viewer connection. */
@FunctionalInterface
public interface MatchSubscriber {

    /** @throws IOException when the receiver is gone; the hub drops it */
    void deliver(MatchNotification notification) throws IOException;
}
