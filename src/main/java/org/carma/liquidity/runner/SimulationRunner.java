package org.carma.liquidity.runner;

import org.carma.liquidity.agent.PopulationGenerator;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.config.EngineConfigLoader;
import org.carma.liquidity.config.ScenarioLoader;
import org.carma.liquidity.engine.AmplificationReport;
import org.carma.liquidity.engine.RunSummary;
import org.carma.liquidity.engine.SimulationResult;
import org.carma.liquidity.engine.StressSimulation;
import org.carma.liquidity.event.EventBus;
import org.carma.liquidity.market.Scenario;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.network.NetworkGenerator;
import org.carma.liquidity.network.RelationshipNetwork;
import org.carma.liquidity.validation.InputValidator;
import org.carma.liquidity.validation.InputValidator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Wires configuration loading, population and network generation and a
 * simulation run together.
 *
 * Usage:
 * <pre>
 * SimulationRunner runner = new SimulationRunner();
 * SimulationResult result = runner.run(null, Paths.get("scenarios/swes1.yaml"), 42L);
 * System.out.println(result.getSummary());
 * </pre>
 */
public class SimulationRunner {

    private static final Logger log = LoggerFactory.getLogger(SimulationRunner.class);

    private final EngineConfigLoader configLoader;
    private final ScenarioLoader scenarioLoader;
    private final InputValidator validator;
    private EventBus eventBus = new EventBus();

    public SimulationRunner() {
        this.configLoader = new EngineConfigLoader();
        this.scenarioLoader = new ScenarioLoader();
        this.validator = new InputValidator();
    }

    /**
     * Use the given bus for subsequent runs, e.g. to subscribe before running.
     */
    public SimulationRunner eventBus(EventBus eventBus) {
        this.eventBus = eventBus;
        return this;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    // ========================================================================
    // MAIN EXECUTION
    // ========================================================================

    /**
     * Run a scenario file.
     *
     * @param engineConfigPath engine configuration YAML, or null for the bundled defaults
     * @param scenarioPath     scenario YAML
     * @param seed             seed for population and network generation
     */
    public SimulationResult run(Path engineConfigPath, Path scenarioPath, long seed) throws IOException {
        EngineConfig config = engineConfigPath == null
            ? configLoader.loadDefault()
            : configLoader.load(engineConfigPath);
        Scenario scenario = scenarioLoader.load(scenarioPath);
        return run(config, scenario, seed);
    }

    /**
     * Run a scenario bundled on the classpath with the bundled engine defaults.
     */
    public SimulationResult runResource(String scenarioResource, long seed) throws IOException {
        return run(configLoader.loadDefault(), scenarioLoader.loadResource(scenarioResource), seed);
    }

    public SimulationResult run(EngineConfig config, Scenario scenario, long seed) {
        // 1. Population
        List<Agent> agents = new PopulationGenerator(seed, config.getPopulationRanges()).generate();
        warnIfAny("population", validator.validatePopulation(agents));

        // 2. Network
        RelationshipNetwork network = new NetworkGenerator(seed, config.getNetworkRules()).generate(agents);
        log.info("Network: {}", network.summary());
        warnIfAny("network", validator.validateNetwork(network, agents));

        // 3. Run
        StressSimulation simulation = new StressSimulation(agents, network, scenario, config, eventBus);
        SimulationResult result = simulation.run();

        report(result);
        return result;
    }

    // ========================================================================
    // REPORTING
    // ========================================================================

    private void warnIfAny(String what, ValidationResult result) {
        if (result.hasWarnings()) {
            log.warn("{} warnings: {}", what, result.getWarnings());
        }
    }

    private void report(SimulationResult result) {
        RunSummary summary = result.getSummary();
        log.info("=== SUMMARY: {} ===", summary.scenario());
        log.info("Agents reacting at least once: {}/{}", summary.agentsEverReacted(), summary.agentCount());
        for (Map.Entry<AgentType, Integer> e : summary.reactedByType().entrySet()) {
            log.info("  {}: {}", e.getKey(), e.getValue());
        }
        log.info("Margin calls {}, asset sales {}, non-bank gilt sales {}, repo demand {}, redemptions {}",
            String.format("%.1f", summary.totalMarginCalls()),
            String.format("%.1f", summary.totalAssetSales()),
            String.format("%.1f", summary.nonBankGiltSales()),
            String.format("%.1f", summary.totalRepoDemand()),
            String.format("%.1f", summary.totalRedemptions()));
        log.info("Hedge funds seeking repo: {}, refused by every bank: {}",
            summary.hedgeFundsSeekingRepo(), summary.hedgeFundsRefusedByAll());

        AmplificationReport amplification = result.getAmplification();
        for (Map.Entry<AgentType, AmplificationReport.Amplification> e : amplification.getByType().entrySet()) {
            log.info("Amplification {}: {}", e.getKey(), String.format("%.3f", e.getValue().ratio()));
        }
        log.info("System amplification: {}", String.format("%.3f", amplification.getSystemRatio()));
    }
}
