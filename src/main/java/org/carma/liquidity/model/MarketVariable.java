package org.carma.liquidity.model;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Exogenous market variables a scenario can drive.
 * Yields, spreads and basis are in basis points, equity, FX and haircuts in percent,
 * VIX in index points. Scenario paths are cumulative changes (VIX is a level).
 */
public enum MarketVariable {
    GILT_10Y_YIELD("gilt_10y_yield", 0.0),
    GILT_30Y_YIELD("gilt_30y_yield", 0.0),
    IL_GILT_YIELD("il_gilt_yield", 0.0),
    UST_10Y_YIELD("ust_10y_yield", 0.0),
    IG_CORP_SPREAD("ig_corp_spread", 0.0),
    HY_CORP_SPREAD("hy_corp_spread", 0.0),
    EQUITY("equity", 0.0),
    SONIA_SWAP("sonia_swap", 0.0),
    FX_GBPUSD("fx_gbpusd", 0.0),
    REPO_HAIRCUT_GILT("repo_haircut_gilt", 0.0),
    REPO_HAIRCUT_CORP("repo_haircut_corp", 0.0),
    BOND_FUTURES_BASIS("bond_futures_basis", 0.0),
    VIX("vix", 15.0);

    private static final Map<String, MarketVariable> BY_ID = new HashMap<>();

    static {
        for (MarketVariable v : values()) {
            BY_ID.put(v.id, v);
        }
    }

    private final String id;
    private final double neutralLevel;

    MarketVariable(String id, double neutralLevel) {
        this.id = id;
        this.neutralLevel = neutralLevel;
    }

    /**
     * Identifier used in scenario files.
     */
    public String getId() {
        return id;
    }

    /**
     * Level assumed when a scenario does not drive this variable.
     */
    public double getNeutralLevel() {
        return neutralLevel;
    }

    public static Optional<MarketVariable> fromId(String id) {
        if (id == null) return Optional.empty();
        MarketVariable v = BY_ID.get(id.toLowerCase());
        if (v != null) return Optional.of(v);
        try {
            return Optional.of(MarketVariable.valueOf(id.toUpperCase()));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    public String toString() {
        return id;
    }
}
