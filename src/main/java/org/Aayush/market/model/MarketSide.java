package org.Aayush.market.model;

/**
 * Selects a side of a two-sided market.
 *
 * <p>Used to choose which side proposes in deferred acceptance, or which side plays
 * the agent role in top trading cycles (the side whose efficiency is guaranteed).</p>
 */
public enum MarketSide {
    STUDENTS,
    SCHOOLS
}
