package org.carma.liquidity.model;

/**
 * Named mitigation actions available to the agent waterfalls.
 */
public enum Reaction {
    DRAW_CENTRAL_BANK_FACILITY("boe_facility", InstrumentClass.CENTRAL_BANK, null),
    REDUCE_REPO_LENDING("reduce_repo_lending", InstrumentClass.REPO, null),
    POST_COLLATERAL("post_collateral", InstrumentClass.OTHER, null),
    RECAPITALISATION("recapitalisation", InstrumentClass.OTHER, null),
    DRAW_REPO_LINE("draw_repo_line", InstrumentClass.REPO, null),
    DRAW_CREDIT_FACILITY("draw_rcf", InstrumentClass.OTHER, null),
    USE_CASH_BUFFER("use_cash_buffer", InstrumentClass.OTHER, null),
    SEEK_REPO("seek_repo", InstrumentClass.REPO, null),
    SELL_GILT("sell_gilt", InstrumentClass.SALE, AssetClass.GILT),
    SELL_IL_GILT("sell_gilt_il", InstrumentClass.SALE, AssetClass.GILT),
    SELL_GILT_BASIS_UNWIND("sell_gilt_basis_unwind", InstrumentClass.SALE, AssetClass.GILT),
    SELL_CORP_BONDS("sell_corp_bonds", InstrumentClass.SALE, AssetClass.CORPORATE_BOND),
    SELL_EQUITY("sell_equity", InstrumentClass.SALE, AssetClass.EQUITY),
    REDEEM_FUND("redeem_mmf", InstrumentClass.REDEMPTION, null),
    SWING_PRICING("swing_pricing", InstrumentClass.GATE, null);

    private final String actionName;
    private final InstrumentClass instrumentClass;
    private final AssetClass assetClass;

    Reaction(String actionName, InstrumentClass instrumentClass, AssetClass assetClass) {
        this.actionName = actionName;
        this.instrumentClass = instrumentClass;
        this.assetClass = assetClass;
    }

    public String getActionName() {
        return actionName;
    }

    public InstrumentClass getInstrumentClass() {
        return instrumentClass;
    }

    /**
     * Asset class sold by this reaction, or null for non-sale reactions.
     */
    public AssetClass getAssetClass() {
        return assetClass;
    }

    public boolean isSale() {
        return instrumentClass == InstrumentClass.SALE;
    }

    public boolean isRepo() {
        return instrumentClass == InstrumentClass.REPO;
    }

    @Override
    public String toString() {
        return actionName;
    }
}
