package org.carma.liquidity.model;

import java.util.Objects;

/**
 * One executed waterfall step.
 *
 * @param reaction   the action taken
 * @param amount     GBP millions, finite and positive
 * @param sourceItem balance sheet item the action draws on, or null when it
 *                   does not deplete a holding (repo, facilities, gates)
 */
public record ExecutedAction(Reaction reaction, double amount, String sourceItem) {

    public ExecutedAction {
        Objects.requireNonNull(reaction, "reaction");
        if (!Double.isFinite(amount) || amount <= 0) {
            throw new IllegalArgumentException(
                "Action " + reaction + " amount must be finite and positive: " + amount);
        }
    }
}
