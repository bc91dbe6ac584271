package org.carma.liquidity.validation;

import org.carma.liquidity.Fixtures;
import org.carma.liquidity.market.Scenario;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.network.EdgeKind;
import org.carma.liquidity.network.RelationshipNetwork;
import org.carma.liquidity.validation.InputValidator.InvalidInputException;
import org.carma.liquidity.validation.InputValidator.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputValidatorTest {

    private InputValidator validator;

    @BeforeEach
    void setUp() {
        validator = new InputValidator();
    }

    @Nested
    @DisplayName("Population")
    class Population {

        @Test
        void validPopulation() {
            ValidationResult result = validator.validatePopulation(
                List.of(Fixtures.bank("Bank_01"), Fixtures.hedgeFund("HF_01")));

            assertThat(result.isValid()).isTrue();
        }

        @Test
        void emptyPopulation() {
            assertThat(validator.validatePopulation(List.of()).isValid()).isFalse();
        }

        @Test
        @DisplayName("Duplicate ids are errors")
        void duplicates() {
            ValidationResult result = validator.validatePopulation(
                List.of(Fixtures.bank("Bank_01"), Fixtures.bank("Bank_01")));

            assertThat(result.isValid()).isFalse();
            assertThat(result.getErrors()).extracting(InputValidator.ValidationError::getField).contains("Bank_01");
        }

        @Test
        @DisplayName("Zero buffers and a missing banking sector are warnings")
        void warnings() {
            ValidationResult result = validator.validatePopulation(List.of(Fixtures.fund("Fund_01", 0, 500)));

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).hasSize(2);
        }
    }

    @Nested
    @DisplayName("Network")
    class Network {

        @Test
        @DisplayName("Network must cover exactly the population")
        void coverage() {
            Agent bank = Fixtures.bank("Bank_01");
            Agent hf = Fixtures.hedgeFund("HF_01");
            RelationshipNetwork onlyBank = RelationshipNetwork.empty(List.of(bank));

            ValidationResult missing = validator.validateNetwork(onlyBank, List.of(bank, hf));
            ValidationResult extra = validator.validateNetwork(
                RelationshipNetwork.empty(List.of(bank, hf)), List.of(bank));

            assertThat(missing.isValid()).isFalse();
            assertThat(extra.isValid()).isFalse();
        }

        @Test
        @DisplayName("Type mismatches between network and population are errors")
        void typeMismatch() {
            Agent bank = Fixtures.bank("Bank_01");
            RelationshipNetwork network = new RelationshipNetwork.Builder()
                .addAgent("Bank_01", AgentType.INSURER)
                .build();

            assertThat(validator.validateNetwork(network, List.of(bank)).isValid()).isFalse();
        }

        @Test
        @DisplayName("Non-banks without a bank are warned about")
        void unbanked() {
            Agent bank = Fixtures.bank("Bank_01");
            Agent hf = Fixtures.hedgeFund("HF_01");
            Agent lonely = Fixtures.hedgeFund("HF_02");
            RelationshipNetwork network = new RelationshipNetwork.Builder()
                .addAgents(List.of(bank, hf, lonely))
                .connect("Bank_01", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO)
                .build();

            ValidationResult result = validator.validateNetwork(network, List.of(bank, hf, lonely));

            assertThat(result.isValid()).isTrue();
            assertThat(result.getWarnings()).hasSize(1);
            assertThat(result.getWarnings().get(0).getMessage()).contains("HF_02");
        }
    }

    @Nested
    @DisplayName("Scenario")
    class ScenarioChecks {

        @Test
        void rawDefinition() {
            ValidationResult ok = validator.validateScenarioDefinition("s", 2, Map.of("vix", List.of(20, 25)));
            ValidationResult bad = validator.validateScenarioDefinition(null, 2,
                Map.of("vix", List.of(20), "gold", List.of(1, 2), "equity", "down"));

            assertThat(ok.isValid()).isTrue();
            assertThat(bad.getErrors()).extracting(InputValidator.ValidationError::getField)
                .contains("name", "vix", "gold", "equity");
        }

        @Test
        @DisplayName("Scenario without paths is valid but warned about")
        void noPaths() {
            ValidationResult result = validator.validateScenarioDefinition("s", 1, Map.of());

            assertThat(result.isValid()).isTrue();
            assertThat(result.hasWarnings()).isTrue();
        }

        @Test
        void vixMustBePositive() {
            Scenario scenario = new Scenario("s", 2, Map.of(MarketVariable.VIX, new double[] {20, -1}));

            assertThat(validator.validateScenario(scenario).isValid()).isFalse();
        }
    }

    @Test
    @DisplayName("requireValid throws with the detailed result")
    void requireValid() {
        ValidationResult result = validator.validatePopulation(List.of());

        assertThatThrownBy(() -> InputValidator.requireValid(result))
            .isInstanceOf(InvalidInputException.class)
            .hasMessageContaining("Population is empty")
            .satisfies(e -> assertThat(((InvalidInputException) e).getResult()).isSameAs(result));
    }

    @Test
    @DisplayName("Merged results keep every error and warning")
    void merge() {
        ValidationResult merged = ValidationResult.merge(
            validator.validatePopulation(List.of()),
            validator.validateScenarioDefinition("s", 1, Map.of()));

        assertThat(merged.isValid()).isFalse();
        assertThat(merged.getErrors()).hasSize(1);
        assertThat(merged.getWarnings()).hasSize(1);
    }
}
