package com.containerkit.engine.event;

/** Aggregate delivery counters for all subscriptions of one event type. */
public record SubscriptionStats(int subscriptions, int active, long handled, long errors) {}
