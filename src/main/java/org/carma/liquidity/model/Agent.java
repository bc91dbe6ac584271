package org.carma.liquidity.model;

import org.carma.liquidity.agent.AgentBehavior;
import org.carma.liquidity.agent.BankBehavior;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State of one institution in the simulation.
 *
 * Each agent has:
 * - Identity, reaction threshold θ and buffer usability u
 * - An ordered balance sheet
 * - The day's liquidity position (B0..B3, E1, E2)
 * - The day's executed waterfall actions
 * - Cumulative counters that never reset
 * - A variant {@link AgentBehavior} carrying variant parameters and state
 *
 * The shared three-stage mechanics live in {@code LiquidityMechanics} and
 * operate on this state together with the behaviour.
 */
public class Agent {

    /** Absolute lower bound on B0, so stress ratios are always defined */
    public static final double ABSOLUTE_BUFFER_FLOOR = 1e-6;

    private final String id;
    private final double theta;
    private final double bufferUsability;
    private final double sizeFactor;
    private final List<BalanceSheetItem> balanceSheet;
    private final AgentBehavior behavior;
    private final LiquidityPosition liquidity;

    private boolean degenerateBuffer;
    private boolean reacted;
    private final List<ExecutedAction> actions;

    private double cumulativeMarginCalls;
    private double cumulativeAssetSales;
    private double cumulativeGiltSales;
    private double cumulativeRepoDemand;
    private double cumulativeRedemptions;

    public Agent(String id, double theta, double bufferUsability, double sizeFactor,
                 List<BalanceSheetItem> balanceSheet, AgentBehavior behavior) {
        this.id = Objects.requireNonNull(id, "Agent ID cannot be null");
        if (!Double.isFinite(theta) || theta <= 0) {
            throw new IllegalArgumentException("Agent " + id + ": theta must be finite and > 0: " + theta);
        }
        if (!Double.isFinite(bufferUsability) || bufferUsability < 0 || bufferUsability > 1) {
            throw new IllegalArgumentException("Agent " + id + ": buffer usability must be in [0, 1]: " + bufferUsability);
        }
        if (!Double.isFinite(sizeFactor) || sizeFactor < 0) {
            throw new IllegalArgumentException("Agent " + id + ": size factor must be finite and >= 0: " + sizeFactor);
        }
        this.theta = theta;
        this.bufferUsability = bufferUsability;
        this.sizeFactor = sizeFactor;
        this.balanceSheet = new ArrayList<>(Objects.requireNonNull(balanceSheet, "Balance sheet cannot be null"));
        this.behavior = Objects.requireNonNull(behavior, "Behavior cannot be null");
        this.liquidity = new LiquidityPosition();
        this.actions = new ArrayList<>();
    }

    // ========================================================================
    // Identity and Parameters
    // ========================================================================

    public String getId() {
        return id;
    }

    public AgentType getType() {
        return behavior.type();
    }

    public double getTheta() {
        return theta;
    }

    public double getBufferUsability() {
        return bufferUsability;
    }

    /**
     * Effective reaction threshold θ·(1 + u).
     */
    public double getEffectiveThreshold() {
        return theta * (1.0 + bufferUsability);
    }

    /**
     * Balance sheet size (GBP millions) used for network weighting and redemption sizing.
     */
    public double getSizeFactor() {
        return sizeFactor;
    }

    public AgentBehavior getBehavior() {
        return behavior;
    }

    /**
     * Typed access to the variant behaviour.
     * @throws IllegalStateException if the agent is of another variant
     */
    public <B extends AgentBehavior> B behavior(Class<B> variant) {
        if (!variant.isInstance(behavior)) {
            throw new IllegalStateException("Agent " + id + " is a " + getType() + ", not " + variant.getSimpleName());
        }
        return variant.cast(behavior);
    }

    public BankBehavior asBank() {
        return behavior(BankBehavior.class);
    }

    public boolean isBank() {
        return getType() == AgentType.BANK;
    }

    // ========================================================================
    // Balance Sheet
    // ========================================================================

    public List<BalanceSheetItem> getBalanceSheet() {
        return Collections.unmodifiableList(balanceSheet);
    }

    public Optional<BalanceSheetItem> findItem(String name) {
        for (BalanceSheetItem item : balanceSheet) {
            if (item.getName().equals(name)) {
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    /**
     * Amount of a named item, zero when the agent does not hold it.
     */
    public double itemAmount(String name) {
        return findItem(name).map(BalanceSheetItem::getAmount).orElse(0.0);
    }

    // ========================================================================
    // Daily State
    // ========================================================================

    public LiquidityPosition getLiquidity() {
        return liquidity;
    }

    public boolean isDegenerateBuffer() {
        return degenerateBuffer;
    }

    public void setDegenerateBuffer(boolean degenerateBuffer) {
        this.degenerateBuffer = degenerateBuffer;
    }

    public boolean hasReacted() {
        return reacted;
    }

    public void setReacted(boolean reacted) {
        this.reacted = reacted;
    }

    public List<ExecutedAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public void setActions(List<ExecutedAction> executed) {
        actions.clear();
        actions.addAll(executed);
    }

    /**
     * Today's executed actions keyed by reaction, in waterfall order.
     * Repeated reactions are summed.
     */
    public Map<Reaction, Double> getReactions() {
        Map<Reaction, Double> byReaction = new LinkedHashMap<>();
        for (ExecutedAction a : actions) {
            byReaction.merge(a.reaction(), a.amount(), Double::sum);
        }
        return byReaction;
    }

    public double getReactionAmount(Reaction reaction) {
        double total = 0.0;
        for (ExecutedAction a : actions) {
            if (a.reaction() == reaction) {
                total += a.amount();
            }
        }
        return total;
    }

    /**
     * Sum of today's executed action amounts.
     */
    public double getTotalActionAmount() {
        double total = 0.0;
        for (ExecutedAction a : actions) {
            total += a.amount();
        }
        return total;
    }

    /**
     * Clear per-day fields before a new day starts. Cumulative counters are kept.
     */
    public void resetDay() {
        reacted = false;
        degenerateBuffer = false;
        actions.clear();
        liquidity.startDay(0.0);
    }

    // ========================================================================
    // Cumulative Counters
    // ========================================================================

    public double getCumulativeMarginCalls() {
        return cumulativeMarginCalls;
    }

    public double getCumulativeAssetSales() {
        return cumulativeAssetSales;
    }

    public double getCumulativeGiltSales() {
        return cumulativeGiltSales;
    }

    public double getCumulativeRepoDemand() {
        return cumulativeRepoDemand;
    }

    public double getCumulativeRedemptions() {
        return cumulativeRedemptions;
    }

    public void addMarginCalls(double amount) {
        cumulativeMarginCalls += requireNonNegative("margin calls", amount);
    }

    public void addAssetSales(double amount) {
        cumulativeAssetSales += requireNonNegative("asset sales", amount);
    }

    public void addGiltSales(double amount) {
        cumulativeGiltSales += requireNonNegative("gilt sales", amount);
    }

    public void addRepoDemand(double amount) {
        cumulativeRepoDemand += requireNonNegative("repo demand", amount);
    }

    public void addRedemptions(double amount) {
        cumulativeRedemptions += requireNonNegative("redemptions", amount);
    }

    private double requireNonNegative(String what, double amount) {
        if (!Double.isFinite(amount) || amount < 0) {
            throw new IllegalStateException("Agent " + id + ": " + what + " must be finite and >= 0: " + amount);
        }
        return amount;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Agent) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Agent[%s, %s, θ=%.3f, u=%.2f, %s]",
            id, getType().getDisplayName(), theta, bufferUsability, liquidity);
    }
}
