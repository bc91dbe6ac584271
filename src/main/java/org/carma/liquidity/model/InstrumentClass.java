package org.carma.liquidity.model;

/**
 * Instrument class of a reaction. Determines how much of the action amount is
 * realised as liquidity in Stage 2, and which cumulative counters it feeds.
 */
public enum InstrumentClass {
    /** Outright asset sale; realisation degrades with bid/ask spreads. */
    SALE,
    /** Repo-type funding; realisation follows market repo availability. */
    REPO,
    /** Central bank facility draw. */
    CENTRAL_BANK,
    /** Redemption from a fund complex. */
    REDEMPTION,
    /** Collateral posting, recapitalisation, credit-line and cash-buffer draws. */
    OTHER,
    /** Swing pricing or redemption gates: throttles future outflows, raises no cash. */
    GATE
}
