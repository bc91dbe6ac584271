package org.carma.liquidity.engine;

import org.carma.liquidity.market.MarketSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of a completed run: daily agent and market snapshots, the
 * amplification report and the run summary.
 */
public class SimulationResult {

    private final String scenario;
    private final List<AgentSnapshot> agentSnapshots;
    private final List<MarketSnapshot> marketHistory;
    private final AmplificationReport amplification;
    private final RunSummary summary;

    SimulationResult(String scenario, List<AgentSnapshot> agentSnapshots, List<MarketSnapshot> marketHistory,
                     AmplificationReport amplification, RunSummary summary) {
        this.scenario = scenario;
        this.agentSnapshots = Collections.unmodifiableList(new ArrayList<>(agentSnapshots));
        this.marketHistory = Collections.unmodifiableList(new ArrayList<>(marketHistory));
        this.amplification = amplification;
        this.summary = summary;
    }

    public String getScenario() {
        return scenario;
    }

    public int getDays() {
        return marketHistory.size();
    }

    /**
     * All agent snapshots, day by day in agent order.
     */
    public List<AgentSnapshot> getAgentSnapshots() {
        return agentSnapshots;
    }

    public List<AgentSnapshot> getSnapshotsForDay(int day) {
        List<AgentSnapshot> result = new ArrayList<>();
        for (AgentSnapshot s : agentSnapshots) {
            if (s.day() == day) result.add(s);
        }
        return result;
    }

    /**
     * One agent's snapshots over the horizon.
     */
    public List<AgentSnapshot> getAgentHistory(String id) {
        List<AgentSnapshot> result = new ArrayList<>();
        for (AgentSnapshot s : agentSnapshots) {
            if (s.id().equals(id)) result.add(s);
        }
        return result;
    }

    /**
     * @throws IllegalArgumentException if there is no snapshot for that day and agent
     */
    public AgentSnapshot getSnapshot(int day, String id) {
        for (AgentSnapshot s : agentSnapshots) {
            if (s.day() == day && s.id().equals(id)) return s;
        }
        throw new IllegalArgumentException("No snapshot for " + id + " on day " + day);
    }

    public List<MarketSnapshot> getMarketHistory() {
        return marketHistory;
    }

    public AmplificationReport getAmplification() {
        return amplification;
    }

    public RunSummary getSummary() {
        return summary;
    }

    @Override
    public String toString() {
        return String.format("SimulationResult[%s, %d days, %d snapshots, %s]",
            scenario, getDays(), agentSnapshots.size(), amplification);
    }
}
