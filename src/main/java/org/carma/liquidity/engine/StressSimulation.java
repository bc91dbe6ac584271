package org.carma.liquidity.engine;

import org.carma.liquidity.agent.RepoFunding;
import org.carma.liquidity.agent.StepContext;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.event.EventBus;
import org.carma.liquidity.event.SimulationEvent;
import org.carma.liquidity.market.MarketSnapshot;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.market.Scenario;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AssetClass;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.network.RelationshipNetwork;
import org.carma.liquidity.validation.InputValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Day-by-day stress simulation over a scenario horizon.
 *
 * <p>Each day runs, in order:
 * <ol>
 *   <li>exogenous scenario levels applied to the market</li>
 *   <li>daily fields reset and B0 recomputed for every agent</li>
 *   <li>stage 1 direct losses for every agent</li>
 *   <li>network-routed redemption demand for every agent</li>
 *   <li>stage 2 reactions for every agent</li>
 *   <li>sales and repo demand registered with the market</li>
 *   <li>dealer absorption across banks</li>
 *   <li>repo tightening by reacting banks</li>
 *   <li>N feedback iterations, each an endogenous market update then stage 3</li>
 *   <li>snapshots and events</li>
 *   <li>realized sales reduce holdings</li>
 * </ol>
 * Every phase completes for all agents before the next begins, so no agent
 * sees another agent's same-phase result.
 *
 * <p>Not thread-safe; one simulation runs on one thread.
 */
public class StressSimulation {

    private static final Logger log = LoggerFactory.getLogger(StressSimulation.class);

    private final Map<String, Agent> agents;
    private final RelationshipNetwork network;
    private final Scenario scenario;
    private final EngineConfig config;
    private final EventBus eventBus;
    private final MarketState market;
    private final MarketMakingAbsorber absorber;
    private final FeedbackEngine feedback;

    private final List<AgentSnapshot> agentSnapshots = new ArrayList<>();
    private final List<MarketSnapshot> marketHistory = new ArrayList<>();
    private int currentDay;

    /**
     * @throws InputValidator.InvalidInputException if the population, network or scenario is malformed
     */
    public StressSimulation(List<Agent> agents, RelationshipNetwork network, Scenario scenario,
                            EngineConfig config, EventBus eventBus) {
        InputValidator.requireValid(new InputValidator().validateRun(agents, network, scenario));
        this.agents = new LinkedHashMap<>();
        for (Agent agent : agents) {
            this.agents.put(agent.getId(), agent);
        }
        this.network = network;
        this.scenario = scenario;
        this.config = config;
        this.eventBus = eventBus;
        this.market = new MarketState(config.getVixBaseline());
        this.absorber = new MarketMakingAbsorber();
        this.feedback = new FeedbackEngine(config);
    }

    public StressSimulation(List<Agent> agents, RelationshipNetwork network, Scenario scenario,
                            EngineConfig config) {
        this(agents, network, scenario, config, new EventBus());
    }

    // ========================================================================
    // Execution
    // ========================================================================

    public boolean isComplete() {
        return currentDay >= scenario.getHorizonDays();
    }

    /**
     * Simulate the next day.
     *
     * @return the market snapshot at the end of the day
     * @throws IllegalStateException if the horizon has been reached
     */
    public MarketSnapshot advance() {
        if (isComplete()) {
            throw new IllegalStateException("Simulation of " + scenario.getName() + " already finished after "
                + scenario.getHorizonDays() + " days");
        }
        int day = currentDay;

        // Exogenous shock
        market.applyExogenous(day, scenario.levels(day));
        publish(new SimulationEvent.DayStarted(day, scenario.getName(), market.getVix()));
        StepContext ctx = new StepContext(day, market, scenario.delta(day), network,
            Collections.unmodifiableMap(agents), config);

        for (Agent agent : agents.values()) {
            agent.resetDay();
            LiquidityMechanics.computeInitialBuffer(agent);
        }

        // Stage 1: direct losses for everyone before any redemption is routed
        for (Agent agent : agents.values()) {
            LiquidityMechanics.computeDirectLosses(agent, ctx);
        }
        for (Agent agent : agents.values()) {
            LiquidityMechanics.addRoutedRedemptions(agent, ctx);
        }

        // Stage 2
        for (Agent agent : agents.values()) {
            LiquidityMechanics.computeStage2(agent, ctx);
            if (agent.hasReacted() && log.isDebugEnabled()) {
                log.debug("Day {}: {} reacted at stress {} with {}", day, agent.getId(),
                    String.format("%.3f", agent.getLiquidity().stressRatio()), agent.getReactions());
            }
        }
        for (Agent agent : agents.values()) {
            LiquidityMechanics.registerActionsToMarket(agent, market);
        }

        Map<AssetClass, Double> absorbed = absorber.absorb(agents.values(), market);
        for (Map.Entry<AssetClass, Double> e : absorbed.entrySet()) {
            publish(new SimulationEvent.SellingAbsorbed(day, e.getKey(),
                market.getSellingPressure(e.getKey()), e.getValue()));
        }

        for (Agent agent : agents.values()) {
            if (agent.isBank() && agent.hasReacted()) {
                agent.asBank().tightenRepo();
            }
        }

        // Stage 3
        for (int i = 0; i < config.getFeedbackIterations(); i++) {
            market.applyEndogenousFeedback();
            feedback.applyIteration(agents, market, network);
        }

        MarketSnapshot snapshot = market.snapshot();
        marketHistory.add(snapshot);
        recordDay(day);

        for (Agent agent : agents.values()) {
            LiquidityMechanics.realizeSales(agent);
        }
        currentDay++;
        return snapshot;
    }

    /**
     * Run every remaining day and collect the result.
     */
    public SimulationResult run() {
        log.info("Running scenario {} over {} days with {} agents, {} feedback iterations",
            scenario.getName(), scenario.getHorizonDays(), agents.size(), config.getFeedbackIterations());
        while (!isComplete()) {
            advance();
        }
        SimulationResult result = getResult();
        log.info("Finished {}: {}", scenario.getName(), result.getSummary());
        return result;
    }

    /**
     * Result over the days simulated so far.
     */
    public SimulationResult getResult() {
        AmplificationReport amplification = AmplificationReport.from(agentSnapshots, config.getAmplificationEpsilon());
        RunSummary summary = RunSummary.of(scenario.getName(), agents.values(), agentSnapshots,
            marketHistory, amplification);
        return new SimulationResult(scenario.getName(), agentSnapshots, marketHistory, amplification, summary);
    }

    // ========================================================================
    // Snapshots and Events
    // ========================================================================

    private void recordDay(int day) {
        int reacting = 0;
        double direct = 0.0;
        double secondRound = 0.0;
        for (Agent agent : agents.values()) {
            AgentSnapshot s = AgentSnapshot.of(day, agent);
            agentSnapshots.add(s);
            direct += s.directLoss();
            secondRound += s.e2();
            if (s.reacted()) {
                reacting++;
                publish(new SimulationEvent.AgentReacted(day, s.id(), s.type(), s.stressRatio(), s.reactions()));
            }
            Optional<RepoFunding> funding = agent.getBehavior().repoFunding();
            if (funding.isPresent() && funding.get().wasRefusedOn(day)) {
                log.debug("Day {}: every bank refused repo to {} (ask {})", day, agent.getId(),
                    String.format("%.1f", funding.get().getLastAsk()));
                publish(new SimulationEvent.RepoRefused(day, agent.getId(), funding.get().getLastAsk()));
            }
        }
        log.info("Day {}: vix={} reacting={}/{} direct={} secondRound={} gilt10y={}",
            day, String.format("%.1f", market.getVix()), reacting, agents.size(),
            String.format("%.1f", direct), String.format("%.1f", secondRound),
            String.format("%.1f", market.level(MarketVariable.GILT_10Y_YIELD)));
        publish(new SimulationEvent.DayCompleted(day, reacting, direct, secondRound));
    }

    private void publish(SimulationEvent event) {
        eventBus.publish(event);
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int getCurrentDay() {
        return currentDay;
    }

    public MarketState getMarket() {
        return market;
    }

    public Map<String, Agent> getAgents() {
        return Collections.unmodifiableMap(agents);
    }

    public RelationshipNetwork getNetwork() {
        return network;
    }

    public Scenario getScenario() {
        return scenario;
    }

    public EventBus getEventBus() {
        return eventBus;
    }
}
