package org.carma.liquidity.agent;

import org.carma.liquidity.model.Agent;

import java.util.List;

/**
 * Repo funding state of a non-bank: the latest request and whether the agent
 * has ever sought repo or been refused by every bank it asked.
 *
 * Requests only reach banks the requester is connected to. With no connected
 * bank nothing is obtained and the request counts as refused.
 */
public class RepoFunding {

    private boolean everSought;
    private boolean refusedByAll;
    private int lastRequestDay = -1;
    private double lastAsk;
    private double lastObtained;

    /**
     * Ask connected banks for repo, splitting the ask evenly across them.
     *
     * @return the total amount the banks agreed to extend
     */
    public double request(Agent requester, double ask, StepContext ctx) {
        if (!Double.isFinite(ask) || ask < 0) {
            throw new IllegalStateException("Agent " + requester.getId() + ": repo ask must be finite and >= 0: " + ask);
        }
        if (ask == 0) {
            return 0.0;
        }
        everSought = true;
        lastRequestDay = ctx.day();
        lastAsk = ask;

        List<String> banks = ctx.network().banksOf(requester.getId());
        double obtained = 0.0;
        if (!banks.isEmpty()) {
            double perBank = ask / banks.size();
            for (String bankId : banks) {
                Agent bank = ctx.agent(bankId);
                obtained += bank.asBank().assessRepoRequest(bank, requester.getId(), perBank, ctx);
            }
        }
        lastObtained = obtained;
        if (obtained <= 0) {
            refusedByAll = true;
        }
        return obtained;
    }

    public boolean hasEverSought() {
        return everSought;
    }

    /**
     * Sticky: once every bank refused a request the flag stays set for the run.
     */
    public boolean isRefusedByAll() {
        return refusedByAll;
    }

    /**
     * Whether a request made on the given day obtained nothing.
     */
    public boolean wasRefusedOn(int day) {
        return lastRequestDay == day && lastObtained <= 0;
    }

    public int getLastRequestDay() {
        return lastRequestDay;
    }

    public double getLastAsk() {
        return lastAsk;
    }

    public double getLastObtained() {
        return lastObtained;
    }
}
