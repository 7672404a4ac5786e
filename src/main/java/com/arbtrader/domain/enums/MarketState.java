package com.arbtrader.domain.enums;

/**
 * Relationship between the two legs' quotes after the latest update.
 * <ul>
 *   <li>CROSSED: one leg's bid is above the other leg's ask, executable with market orders</li>
 *   <li>LIMIT_OPPORTUNITY: quotes interleave so a resting limit order could capture the spread</li>
 *   <li>NO_OPPORTUNITY: valid quotes, nothing to capture</li>
 *   <li>UNKNOWN: at least one quote is missing or inverted</li>
 * </ul>
 */
public enum MarketState {
    CROSSED,
    LIMIT_OPPORTUNITY,
    NO_OPPORTUNITY,
    UNKNOWN
}
