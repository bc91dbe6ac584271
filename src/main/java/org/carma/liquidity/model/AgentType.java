package org.carma.liquidity.model;

/**
 * Institution types participating in the stress simulation.
 * Each type has a display name, a short id prefix used by generated populations,
 * and a description for documentation.
 */
public enum AgentType {
    BANK("Bank", "Bank", "Intermediary, repo provider and market maker"),
    HEDGE_FUND("Hedge Fund", "HF", "Leveraged fund financed through prime brokerage repo"),
    LDI_PENSION("LDI / Pension", "LDI", "Liability-driven investment fund with rate hedges"),
    INSURER("Insurer", "Insurer", "Insurer with derivative hedges and committed lines"),
    FUND_COMPLEX("Fund Complex", "Fund", "Open-ended or money-market fund facing redemptions");

    private final String displayName;
    private final String idPrefix;
    private final String description;

    AgentType(String displayName, String idPrefix, String description) {
        this.displayName = displayName;
        this.idPrefix = idPrefix;
        this.description = description;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getIdPrefix() {
        return idPrefix;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Everything that is not a bank. Non-banks route repo requests to banks
     * and may redeem from fund complexes.
     */
    public boolean isNonBank() {
        return this != BANK;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
