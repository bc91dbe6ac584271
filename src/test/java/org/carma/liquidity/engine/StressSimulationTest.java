package org.carma.liquidity.engine;

import org.carma.liquidity.Fixtures;
import org.carma.liquidity.agent.BankBehavior;
import org.carma.liquidity.agent.PopulationGenerator;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.config.EngineConfigLoader;
import org.carma.liquidity.config.PopulationRanges;
import org.carma.liquidity.config.ScenarioLoader;
import org.carma.liquidity.event.EventBus;
import org.carma.liquidity.event.SimulationEvent;
import org.carma.liquidity.market.Scenario;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.model.Reaction;
import org.carma.liquidity.network.EdgeKind;
import org.carma.liquidity.network.NetworkGenerator;
import org.carma.liquidity.network.RelationshipNetwork;
import org.carma.liquidity.validation.InputValidator.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StressSimulationTest {

    private static final long SEED = 42L;

    private EngineConfig config;
    private Scenario scenario;

    @BeforeEach
    void setUp() throws IOException {
        config = new EngineConfigLoader().loadResource("fixtures/small-engine.yaml");
        scenario = new ScenarioLoader().loadResource("fixtures/short-shock.yaml");
    }

    private StressSimulation simulation(EngineConfig cfg, EventBus bus) {
        List<Agent> agents = new PopulationGenerator(SEED, cfg.getPopulationRanges()).generate();
        RelationshipNetwork network = new NetworkGenerator(SEED, cfg.getNetworkRules()).generate(agents);
        return new StressSimulation(agents, network, scenario, cfg, bus);
    }

    @Test
    @DisplayName("Runs every day of the horizon and snapshots every agent daily")
    void runsHorizon() {
        SimulationResult result = simulation(config, new EventBus()).run();

        int agents = config.getPopulationRanges().getTotalCount();
        assertThat(result.getDays()).isEqualTo(3);
        assertThat(result.getMarketHistory()).hasSize(3);
        assertThat(result.getAgentSnapshots()).hasSize(3 * agents);
        assertThat(result.getSnapshotsForDay(2)).hasSize(agents);
        assertThat(result.getSummary().agentCount()).isEqualTo(agents);
    }

    @Test
    @DisplayName("Losses are non-negative and initial buffers strictly positive")
    void accountingInvariants() {
        SimulationResult result = simulation(config, new EventBus()).run();

        for (AgentSnapshot s : result.getAgentSnapshots()) {
            assertThat(s.b0()).as("B0 of %s day %d", s.id(), s.day()).isPositive();
            assertThat(s.e1()).as("E1 of %s day %d", s.id(), s.day()).isGreaterThanOrEqualTo(0.0);
            assertThat(s.e2()).as("E2 of %s day %d", s.id(), s.day()).isGreaterThanOrEqualTo(0.0);
            assertThat(s.e1()).isGreaterThanOrEqualTo(s.e1Direct());
            if (!s.reacted()) {
                assertThat(s.reactions()).isEmpty();
                assertThat(s.b2()).isEqualTo(s.b1());
            }
        }
    }

    @Test
    @DisplayName("Without feedback iterations amplification is exactly one")
    void noFeedback() {
        EngineConfig none = config.toBuilder().feedbackIterations(0).build();

        SimulationResult result = simulation(none, new EventBus()).run();

        assertThat(result.getAgentSnapshots()).allSatisfy(s -> assertThat(s.e2()).isZero());
        assertThat(result.getAmplification().getSystemRatio()).isEqualTo(1.0);
        for (AmplificationReport.Amplification a : result.getAmplification().getByAgent().values()) {
            assertThat(a.ratio()).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Feedback never reduces system losses")
    void feedbackAmplifies() {
        SimulationResult result = simulation(config, new EventBus()).run();

        assertThat(result.getAmplification().getSystemRatio()).isGreaterThanOrEqualTo(1.0);
    }

    @Test
    @DisplayName("Same seed and inputs give identical snapshots")
    void deterministic() {
        SimulationResult first = simulation(config, new EventBus()).run();
        SimulationResult second = simulation(config, new EventBus()).run();

        assertThat(second.getAgentSnapshots()).isEqualTo(first.getAgentSnapshots());
        assertThat(second.getMarketHistory()).isEqualTo(first.getMarketHistory());
        assertThat(second.getSummary()).isEqualTo(first.getSummary());
    }

    @Test
    @DisplayName("Raising every threshold never adds first-day reactors")
    void higherThresholdsReactLess() {
        PopulationRanges.Builder shifted = new PopulationRanges.Builder();
        for (AgentType type : AgentType.values()) {
            shifted.count(type, config.getPopulationRanges().getCount(type));
            shifted.theta(type, config.getPopulationRanges().getTheta(type).min() + 0.5,
                config.getPopulationRanges().getTheta(type).max() + 0.5);
        }
        EngineConfig cautious = config.toBuilder().populationRanges(shifted.build()).build();

        Set<String> baseline = reactedOnDay0(simulation(config, new EventBus()));
        Set<String> raised = reactedOnDay0(simulation(cautious, new EventBus()));

        assertThat(baseline).containsAll(raised);
    }

    @Test
    @DisplayName("Raising one agent's threshold never adds days on which it reacts")
    void singleAgentThresholdOverHorizon() throws IOException {
        EngineConfig defaults = new EngineConfigLoader().loadDefault();
        Scenario swes1 = new ScenarioLoader().loadResource("scenarios/swes1.yaml");
        SimulationResult baseline = run(population(defaults), defaults, swes1);

        for (Agent agent : population(defaults)) {
            String id = agent.getId();
            List<Agent> agents = withRaisedTheta(population(defaults), id, 0.05);

            SimulationResult raised = run(agents, defaults, swes1);

            assertThat(reactingDays(raised, id))
                .as("reacting days of %s with θ + 0.05", id)
                .isLessThanOrEqualTo(reactingDays(baseline, id));
        }
    }

    private static List<Agent> population(EngineConfig cfg) {
        return new PopulationGenerator(SEED, cfg.getPopulationRanges()).generate();
    }

    private static SimulationResult run(List<Agent> agents, EngineConfig cfg, Scenario scn) {
        RelationshipNetwork network = new NetworkGenerator(SEED, cfg.getNetworkRules()).generate(agents);
        return new StressSimulation(agents, network, scn, cfg).run();
    }

    private static List<Agent> withRaisedTheta(List<Agent> agents, String id, double bump) {
        List<Agent> result = new ArrayList<>();
        for (Agent a : agents) {
            if (a.getId().equals(id)) {
                result.add(new Agent(a.getId(), a.getTheta() + bump, a.getBufferUsability(),
                    a.getSizeFactor(), a.getBalanceSheet(), a.getBehavior()));
            } else {
                result.add(a);
            }
        }
        return result;
    }

    private static long reactingDays(SimulationResult result, String id) {
        return result.getAgentHistory(id).stream().filter(AgentSnapshot::reacted).count();
    }

    private static Set<String> reactedOnDay0(StressSimulation simulation) {
        simulation.advance();
        Set<String> ids = new HashSet<>();
        for (AgentSnapshot s : simulation.getResult().getSnapshotsForDay(0)) {
            if (s.reacted()) ids.add(s.id());
        }
        return ids;
    }

    @Test
    @DisplayName("Advancing past the horizon is rejected")
    void pastHorizon() {
        StressSimulation sim = simulation(config, new EventBus());
        sim.run();

        assertThat(sim.isComplete()).isTrue();
        assertThat(sim.getCurrentDay()).isEqualTo(3);
        assertThatThrownBy(sim::advance)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining(scenario.getName());
    }

    @Test
    @DisplayName("Publishes day, reaction and absorption events")
    void events() {
        EventBus bus = new EventBus();
        SimulationResult result = simulation(config, bus).run();

        assertThat(bus.getEventCount(SimulationEvent.DayStarted.class)).isEqualTo(3);
        assertThat(bus.getEventCount(SimulationEvent.DayCompleted.class)).isEqualTo(3);
        assertThat(bus.getEventCount(SimulationEvent.SellingAbsorbed.class)).isEqualTo(3 * MarketMakingAbsorber.DEALT_CLASSES.size());

        long reactions = result.getAgentSnapshots().stream().filter(AgentSnapshot::reacted).count();
        assertThat(bus.getEventCount(SimulationEvent.AgentReacted.class)).isEqualTo((int) reactions);

        List<SimulationEvent.DayCompleted> days = bus.getHistory(SimulationEvent.DayCompleted.class);
        for (SimulationEvent.DayCompleted day : days) {
            long reacting = result.getSnapshotsForDay(day.day()).stream().filter(AgentSnapshot::reacted).count();
            assertThat(day.reactingAgents()).isEqualTo((int) reacting);
        }
    }

    @Test
    @DisplayName("A failing subscriber does not abort the run")
    void failingSubscriber() {
        EventBus bus = new EventBus();
        AtomicInteger seen = new AtomicInteger();
        bus.subscribe(SimulationEvent.DayStarted.class, e -> {
            throw new IllegalStateException("boom");
        });
        bus.subscribe(SimulationEvent.DayStarted.class, e -> seen.incrementAndGet());

        SimulationResult result = simulation(config, bus).run();

        assertThat(result.getDays()).isEqualTo(3);
        assertThat(seen).hasValue(3);
    }

    @Test
    @DisplayName("Duplicate agent ids are rejected before the run starts")
    void duplicateIds() {
        Agent first = Fixtures.bank("Bank_01");
        Agent second = Fixtures.bank("Bank_01");
        RelationshipNetwork network = RelationshipNetwork.empty(List.of(first));

        assertThatThrownBy(() -> new StressSimulation(List.of(first, second), network, scenario, config))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("Duplicate");
    }

    /**
     * Three banks and three hedge funds: HF_1 and HF_2 borrow from Bank_A,
     * HF_3 only from Bank_B. Bank_C has no clients. Only Bank_A holds gilts,
     * so a 100bp move stresses it alone.
     */
    @Nested
    @DisplayName("Bank repo stress")
    class BankRepoStress {

        private final Scenario rateShock = new Scenario("rate-shock", 1, Map.of(
            MarketVariable.GILT_10Y_YIELD, new double[] {100.0},
            MarketVariable.VIX, new double[] {15.0}));

        private Agent bank(String id, double gilts) {
            return new BankBehavior.Builder(id)
                .totalBalanceSheet(200_000)
                .giltHoldings(gilts)
                .corporateBonds(5_000)
                .centralBankEligible(12_000)
                .wholesaleFunding(5_000)
                .cet1Buffer(6_000)
                .riskAppetite(0.5)
                .repoCapacity(5_000)
                .repoWillingness(0.8, 0.9)
                .marketMakingCapacity(2_000, 600)
                .build();
        }

        private StressSimulation simulation(double bankAGilts, EventBus bus) {
            List<Agent> agents = List.of(
                bank("Bank_A", bankAGilts), bank("Bank_B", 0), bank("Bank_C", 0),
                Fixtures.hedgeFund("HF_1"), Fixtures.hedgeFund("HF_2"), Fixtures.hedgeFund("HF_3"));
            RelationshipNetwork network = new RelationshipNetwork.Builder().addAgents(agents)
                .connect("Bank_A", "HF_1", EdgeKind.PRIME_BROKERAGE_REPO)
                .connect("Bank_A", "HF_2", EdgeKind.PRIME_BROKERAGE_REPO)
                .connect("Bank_B", "HF_3", EdgeKind.PRIME_BROKERAGE_REPO)
                .build();
            return new StressSimulation(agents, network, rateShock, EngineConfig.DEFAULT, bus);
        }

        private double repo(StressSimulation sim, String id) {
            return sim.getAgents().get(id).getReactionAmount(Reaction.SEEK_REPO);
        }

        @Test
        @DisplayName("A stressed bank cuts repo for its own clients only")
        void stressStaysWithClients() {
            StressSimulation calm = simulation(0, new EventBus());
            calm.run();
            StressSimulation stressed = simulation(100_000, new EventBus());
            stressed.run();

            // 100000 × 0.00045 × 100 = 4500 against B0 1780
            assertThat(stressed.getAgents().get("Bank_A").getLiquidity().stressRatio())
                .isGreaterThan(EngineConfig.DEFAULT.getBankRepoRefusalStressThreshold());
            assertThat(repo(calm, "HF_1")).isPositive();
            assertThat(repo(calm, "HF_2")).isPositive();
            assertThat(repo(stressed, "HF_1")).isLessThan(repo(calm, "HF_1"));
            assertThat(repo(stressed, "HF_2")).isLessThan(repo(calm, "HF_2"));
            assertThat(repo(stressed, "HF_3")).isPositive().isEqualTo(repo(calm, "HF_3"));
        }

        @Test
        @DisplayName("Refused clients are reported and the reacting bank tightens")
        void refusalAndTightening() {
            EventBus bus = new EventBus();
            StressSimulation stressed = simulation(100_000, bus);

            SimulationResult result = stressed.run();

            assertThat(bus.getHistory(SimulationEvent.RepoRefused.class))
                .extracting(SimulationEvent.RepoRefused::agentId)
                .containsExactlyInAnyOrder("HF_1", "HF_2");
            assertThat(result.getSummary().hedgeFundsRefusedByAll()).isEqualTo(2);
            assertThat(stressed.getAgents().get("Bank_A").hasReacted()).isTrue();
            assertThat(stressed.getAgents().get("Bank_A").asBank().getWillingnessToExtendNew())
                .isCloseTo(0.65, within(1e-12));
            assertThat(stressed.getAgents().get("Bank_B").asBank().getWillingnessToExtendNew())
                .isEqualTo(0.8);
        }
    }
}
