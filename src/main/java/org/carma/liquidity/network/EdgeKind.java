package org.carma.liquidity.network;

import org.carma.liquidity.model.AgentType;

import java.util.EnumSet;
import java.util.Set;

/**
 * Relationship kinds in the network. Every edge is undirected.
 */
public enum EdgeKind {
    /** Bank to hedge fund prime brokerage and repo. */
    PRIME_BROKERAGE_REPO(EnumSet.of(AgentType.BANK), EnumSet.of(AgentType.HEDGE_FUND)),
    /** Bank to LDI fund clearing and repo. */
    CLEARING(EnumSet.of(AgentType.BANK), EnumSet.of(AgentType.LDI_PENSION)),
    /** Bank to insurer derivatives and repo. */
    DERIVATIVES_REPO(EnumSet.of(AgentType.BANK), EnumSet.of(AgentType.INSURER)),
    /** Redeemer to fund complex. */
    REDEMPTION(
        EnumSet.of(AgentType.HEDGE_FUND, AgentType.LDI_PENSION, AgentType.INSURER, AgentType.FUND_COMPLEX),
        EnumSet.of(AgentType.FUND_COMPLEX));

    private final Set<AgentType> firstEnd;
    private final Set<AgentType> secondEnd;

    EdgeKind(Set<AgentType> firstEnd, Set<AgentType> secondEnd) {
        this.firstEnd = firstEnd;
        this.secondEnd = secondEnd;
    }

    /**
     * Whether an edge of this kind may join agents of the two types, in the
     * given orientation (bank or redeemer first).
     */
    public boolean allows(AgentType first, AgentType second) {
        return firstEnd.contains(first) && secondEnd.contains(second);
    }

    /**
     * Whether this kind links a bank to a non-bank.
     */
    public boolean isBankEdge() {
        return this != REDEMPTION;
    }

    /**
     * Bank edge kind serving a non-bank type, or null when the type has none.
     */
    public static EdgeKind bankEdgeFor(AgentType nonBank) {
        return switch (nonBank) {
            case HEDGE_FUND -> PRIME_BROKERAGE_REPO;
            case LDI_PENSION -> CLEARING;
            case INSURER -> DERIVATIVES_REPO;
            default -> null;
        };
    }
}
