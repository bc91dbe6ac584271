package org.carma.liquidity.agent;

import org.carma.liquidity.config.ReactionCap;
import org.carma.liquidity.model.ExecutedAction;
import org.carma.liquidity.model.Reaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered mitigation waterfall for one agent on one day.
 *
 * Starts from the day's shortfall. Each step takes
 * {@code min(remaining × share, ceiling)}; non-positive amounts are skipped and
 * the remaining shortfall never goes negative.
 */
public class Waterfall {

    /**
     * Audit record of an executed step: the shortfall allocation and the cap it was bounded by.
     */
    public record Step(Reaction reaction, String sourceItem, double allocation, double cap, double amount) {}

    private final double initialShortfall;
    private double remaining;
    private final List<ExecutedAction> actions = new ArrayList<>();
    private final List<Step> steps = new ArrayList<>();

    public Waterfall(double shortfall) {
        if (!Double.isFinite(shortfall) || shortfall < 0) {
            throw new IllegalStateException("Shortfall must be finite and >= 0: " + shortfall);
        }
        this.initialShortfall = shortfall;
        this.remaining = shortfall;
    }

    /**
     * Execute one step.
     *
     * @param reaction   action to take
     * @param sourceItem item drawn on, or null
     * @param share      fraction of the remaining shortfall allocated to this step
     * @param ceiling    absolute cap from the holding or capacity
     * @return the executed amount, zero when the step was skipped
     * @throws IllegalStateException on a share outside [0, 1] or a negative or NaN ceiling
     */
    public double step(Reaction reaction, String sourceItem, double share, double ceiling) {
        if (Double.isNaN(share) || share < 0 || share > 1) {
            throw new IllegalStateException(reaction + ": share must be in [0, 1]: " + share);
        }
        if (Double.isNaN(ceiling) || ceiling < 0) {
            throw new IllegalStateException(reaction + ": ceiling must be >= 0: " + ceiling);
        }
        if (remaining <= 0) {
            return 0.0;
        }
        double allocation = remaining * share;
        double amount = Math.min(allocation, ceiling);
        if (!(amount > 0)) {
            return 0.0;
        }
        remaining = Math.max(0.0, remaining - amount);
        actions.add(new ExecutedAction(reaction, amount, sourceItem));
        steps.add(new Step(reaction, sourceItem, allocation, ceiling, amount));
        return amount;
    }

    /**
     * Execute a step sized by a configured cap applied to a holding or capacity.
     */
    public double step(Reaction reaction, String sourceItem, ReactionCap cap, double base) {
        return step(reaction, sourceItem, cap.share(), cap.ceilingFor(base));
    }

    public double getInitialShortfall() {
        return initialShortfall;
    }

    public double getRemaining() {
        return remaining;
    }

    public boolean isExhausted() {
        return remaining <= 0;
    }

    public List<ExecutedAction> getActions() {
        return Collections.unmodifiableList(actions);
    }

    public List<Step> getSteps() {
        return Collections.unmodifiableList(steps);
    }
}
