package org.carma.liquidity.config;

import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.Reaction;
import org.carma.liquidity.validation.InputValidator.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigLoaderTest {

    private EngineConfigLoader loader;

    @BeforeEach
    void setUp() {
        loader = new EngineConfigLoader();
    }

    @Test
    @DisplayName("Bundled defaults match the built-in defaults")
    void bundledDefaults() throws IOException {
        EngineConfig bundled = loader.loadDefault();
        EngineConfig builtIn = EngineConfig.DEFAULT;

        assertThat(bundled.getFeedbackIterations()).isEqualTo(builtIn.getFeedbackIterations());
        assertThat(bundled.getBankRepoRefusalStressThreshold()).isEqualTo(builtIn.getBankRepoRefusalStressThreshold());
        assertThat(bundled.getBankCounterpartyLossCoefficient()).isEqualTo(builtIn.getBankCounterpartyLossCoefficient());
        assertThat(bundled.getHedgeFundFundingStressCoefficient()).isEqualTo(builtIn.getHedgeFundFundingStressCoefficient());
        assertThat(bundled.getRedemptionPressureCoefficient()).isEqualTo(builtIn.getRedemptionPressureCoefficient());
        assertThat(bundled.getBroadcastCoefficient()).isEqualTo(builtIn.getBroadcastCoefficient());
        assertThat(bundled.getReputationCoefficient()).isEqualTo(builtIn.getReputationCoefficient());
        assertThat(bundled.getCrowdingCoefficient()).isEqualTo(builtIn.getCrowdingCoefficient());
        assertThat(bundled.getCentralBankEfficiency()).isEqualTo(builtIn.getCentralBankEfficiency());
        assertThat(bundled.getGateThreshold()).isEqualTo(builtIn.getGateThreshold());
        assertThat(bundled.getAmplificationEpsilon()).isEqualTo(builtIn.getAmplificationEpsilon());
        assertThat(bundled.getReactionCaps()).isEqualTo(builtIn.getReactionCaps());
        assertThat(bundled.getMultiStrategyCap()).isEqualTo(builtIn.getMultiStrategyCap());
        assertThat(bundled.getPopulationRanges().getCounts()).isEqualTo(builtIn.getPopulationRanges().getCounts());
        assertThat(bundled.getNetworkRules().getHedgeFundBankDegree())
            .isEqualTo(builtIn.getNetworkRules().getHedgeFundBankDegree());
    }

    @Test
    @DisplayName("Overrides apply and everything else keeps its default")
    void overrides() {
        EngineConfig config = loader.loadFromString(String.join("\n",
            "feedback:",
            "  iterations: 5",
            "  crowdingExponent: 1.5",
            "market:",
            "  vixBaseline: 20",
            "reactionCaps:",
            "  bank:",
            "    sell_gilt: [0.2, 0.3]",
            "population:",
            "  counts: {BANK: 2, HEDGE_FUND: 4}",
            "  theta: {HEDGE_FUND: [0.5, 0.6]}",
            "network:",
            "  fundFundDegree: [0, 0]"));

        assertThat(config.getFeedbackIterations()).isEqualTo(5);
        assertThat(config.getCrowdingExponent()).isEqualTo(1.5);
        assertThat(config.getVixBaseline()).isEqualTo(20.0);
        assertThat(config.getReactionCap(AgentType.BANK, Reaction.SELL_GILT)).isEqualTo(ReactionCap.of(0.2, 0.3));
        assertThat(config.getReactionCap(AgentType.BANK, Reaction.SELL_CORP_BONDS)).isEqualTo(ReactionCap.of(0.08, 0.02));
        assertThat(config.getPopulationRanges().getCount(AgentType.BANK)).isEqualTo(2);
        assertThat(config.getPopulationRanges().getCount(AgentType.INSURER)).isEqualTo(6);
        assertThat(config.getPopulationRanges().getTheta(AgentType.HEDGE_FUND)).isEqualTo(ParameterRange.of(0.5, 0.6));
        assertThat(config.getNetworkRules().getFundFundDegree()).isEqualTo(ParameterRange.of(0, 0));
        assertThat(config.getReputationCoefficient()).isEqualTo(EngineConfig.DEFAULT.getReputationCoefficient());
    }

    @Test
    void emptyDocumentGivesDefaults() {
        assertThat(loader.loadFromString("").getFeedbackIterations()).isEqualTo(3);
    }

    @Test
    @DisplayName("Unknown keys are rejected at every level")
    void unknownKeys() {
        assertThatThrownBy(() -> loader.loadFromString("feedbak:\n  iterations: 2"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("feedbak");
        assertThatThrownBy(() -> loader.loadFromString("feedback:\n  iteratons: 2"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("feedback.iteratons");
        assertThatThrownBy(() -> loader.loadFromString("reactionCaps:\n  BANK:\n    SELL_GOLD: [0.1, 0.1]"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("SELL_GOLD");
    }

    @Test
    @DisplayName("Wrong value types are rejected")
    void wrongTypes() {
        assertThatThrownBy(() -> loader.loadFromString("feedback:\n  iterations: 2.5"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("integer");
        assertThatThrownBy(() -> loader.loadFromString("market:\n  vixBaseline: high"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("number");
        assertThatThrownBy(() -> loader.loadFromString("multiStrategyCap: [0.1]"))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> loader.loadFromString("feedback: 3"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("mapping");
    }

    @Test
    @DisplayName("Out-of-range values are rejected")
    void outOfRange() {
        assertThatThrownBy(() -> loader.loadFromString("efficiency:\n  centralBank: 1.5"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("centralBankEfficiency");
        assertThatThrownBy(() -> loader.loadFromString("population:\n  counts: {BANK: -1}"))
            .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> loader.loadFromString("network:\n  hedgeFundBankDegree: [-1, 2]"))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Duplicate keys and malformed YAML are rejected")
    void malformed() {
        assertThatThrownBy(() -> loader.loadFromString("feedback:\n  iterations: 2\n  iterations: 3"))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> loader.loadFromString("feedback: [unclosed"))
            .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Loads from a file and reports missing files as I/O errors")
    void files(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("engine.yaml");
        Files.writeString(file, "feedback:\n  iterations: 1\n");

        assertThat(loader.load(file).getFeedbackIterations()).isEqualTo(1);
        assertThatThrownBy(() -> loader.load(dir.resolve("missing.yaml"))).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> loader.loadResource("nope.yaml")).isInstanceOf(IOException.class);
    }
}
