package com.gnovoa.livematch.store;

/** Unit of work executed inside a single match transaction. */
@FunctionalInterface
public interface TransactionWork<T> {

    T execute(MatchTransaction tx);
}
