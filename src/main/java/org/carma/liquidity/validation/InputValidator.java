package org.carma.liquidity.validation;

import org.carma.liquidity.market.Scenario;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.BalanceSheetItem;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.network.RelationshipNetwork;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validation of run inputs before day 0.
 *
 * Validates:
 * - Population: unique ids, θ > 0, u in [0, 1], finite non-negative sizes and amounts
 * - Network: every network id belongs to the population and has the same type
 * - Scenario: horizon ≥ 1, known variables, paths of horizon length, finite values
 *
 * Problems are collected into a {@link ValidationResult}; {@link #requireValid}
 * turns an invalid result into an {@link InvalidInputException}.
 */
public class InputValidator {

    /**
     * Result of input validation.
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(boolean valid, List<ValidationError> errors,
                                List<ValidationWarning> warnings) {
            this.valid = valid;
            this.errors = Collections.unmodifiableList(errors);
            this.warnings = Collections.unmodifiableList(warnings);
        }

        public static ValidationResult success() {
            return new ValidationResult(true, Collections.emptyList(), Collections.emptyList());
        }

        static ValidationResult of(List<ValidationError> errors, List<ValidationWarning> warnings) {
            return new ValidationResult(errors.isEmpty(), new ArrayList<>(errors), new ArrayList<>(warnings));
        }

        /**
         * Combine several results; valid only if all are.
         */
        public static ValidationResult merge(ValidationResult... results) {
            List<ValidationError> errors = new ArrayList<>();
            List<ValidationWarning> warnings = new ArrayList<>();
            for (ValidationResult r : results) {
                errors.addAll(r.errors);
                warnings.addAll(r.warnings);
            }
            return of(errors, warnings);
        }

        public boolean isValid() { return valid; }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(valid ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(valid ? "VALID" : "INVALID").append("\n");
            if (!errors.isEmpty()) {
                sb.append("Errors:\n");
                for (ValidationError error : errors) {
                    sb.append("  ").append(error).append("\n");
                }
            }
            if (!warnings.isEmpty()) {
                sb.append("Warnings:\n");
                for (ValidationWarning warning : warnings) {
                    sb.append("  ").append(warning).append("\n");
                }
            }
            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String category;
        private final String field;
        private final String message;

        public ValidationError(String category, String field, String message) {
            this.category = category;
            this.field = field;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s: %s", category, field, message);
        }
    }

    public static class ValidationWarning {
        private final String category;
        private final String message;

        public ValidationWarning(String category, String message) {
            this.category = category;
            this.message = message;
        }

        public String getCategory() { return category; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("[%s] %s", category, message);
        }
    }

    /**
     * Raised when run inputs fail validation.
     */
    public static class InvalidInputException extends RuntimeException {
        private final transient ValidationResult result;

        public InvalidInputException(ValidationResult result) {
            super("Invalid input: " + result.toDetailedString());
            this.result = result;
        }

        public InvalidInputException(String message) {
            super(message);
            this.result = null;
        }

        public ValidationResult getResult() {
            return result;
        }
    }

    // ========================================================================
    // POPULATION
    // ========================================================================

    public ValidationResult validatePopulation(List<Agent> agents) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (agents == null || agents.isEmpty()) {
            errors.add(new ValidationError("Population", "agents", "Population is empty"));
            return ValidationResult.of(errors, warnings);
        }

        Set<String> ids = new HashSet<>();
        Set<AgentType> present = EnumSet.noneOf(AgentType.class);
        for (Agent agent : agents) {
            String id = agent.getId();
            if (!ids.add(id)) {
                errors.add(new ValidationError("Population", id, "Duplicate agent id"));
            }
            present.add(agent.getType());
            if (!Double.isFinite(agent.getTheta()) || agent.getTheta() <= 0) {
                errors.add(new ValidationError("Population", id + ".theta", "Theta must be > 0: " + agent.getTheta()));
            }
            double u = agent.getBufferUsability();
            if (!Double.isFinite(u) || u < 0 || u > 1) {
                errors.add(new ValidationError("Population", id + ".bufferUsability", "Must be in [0, 1]: " + u));
            }
            if (!Double.isFinite(agent.getSizeFactor()) || agent.getSizeFactor() < 0) {
                errors.add(new ValidationError("Population", id + ".size", "Must be finite and >= 0: " + agent.getSizeFactor()));
            }
            for (BalanceSheetItem item : agent.getBalanceSheet()) {
                if (!Double.isFinite(item.getAmount()) || item.getAmount() < 0) {
                    errors.add(new ValidationError("Population", id + "." + item.getName(),
                        "Amount must be finite and >= 0: " + item.getAmount()));
                }
            }
            if (agent.getBehavior().weightedBuffer(agent) <= 0) {
                warnings.add(new ValidationWarning("Population",
                    "Agent " + id + " has no positive buffer; it will be floored and react to any loss"));
            }
        }

        if (!present.contains(AgentType.BANK) && present.stream().anyMatch(AgentType::isNonBank)) {
            warnings.add(new ValidationWarning("Population", "No banks: repo requests and dealer absorption will be zero"));
        }
        return ValidationResult.of(errors, warnings);
    }

    // ========================================================================
    // NETWORK
    // ========================================================================

    public ValidationResult validateNetwork(RelationshipNetwork network, List<Agent> agents) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (network == null) {
            errors.add(new ValidationError("Network", "network", "Network is missing"));
            return ValidationResult.of(errors, warnings);
        }

        Set<String> populationIds = new HashSet<>();
        for (Agent agent : agents) {
            populationIds.add(agent.getId());
            if (!network.contains(agent.getId())) {
                errors.add(new ValidationError("Network", agent.getId(), "Agent is not part of the network"));
            } else if (network.getType(agent.getId()) != agent.getType()) {
                errors.add(new ValidationError("Network", agent.getId(),
                    "Network type " + network.getType(agent.getId()) + " does not match agent type " + agent.getType()));
            }
        }
        for (String id : network.getAgentIds()) {
            if (!populationIds.contains(id)) {
                errors.add(new ValidationError("Network", id, "Network references unknown agent"));
            }
        }
        for (Agent agent : agents) {
            if (agent.getType() != AgentType.BANK && agent.getType() != AgentType.FUND_COMPLEX
                    && network.contains(agent.getId()) && network.banksOf(agent.getId()).isEmpty()) {
                warnings.add(new ValidationWarning("Network", "Agent " + agent.getId() + " has no bank counterparty"));
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    // ========================================================================
    // SCENARIO
    // ========================================================================

    /**
     * Validate a raw scenario definition as read from a file, before a
     * {@link Scenario} is constructed from it.
     */
    public ValidationResult validateScenarioDefinition(String name, Integer horizonDays, Map<String, ?> paths) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add(new ValidationError("Scenario", "name", "Scenario name is missing"));
        }
        if (horizonDays == null) {
            errors.add(new ValidationError("Scenario", "horizonDays", "Horizon is missing"));
        } else if (horizonDays < 1) {
            errors.add(new ValidationError("Scenario", "horizonDays", "Horizon must be >= 1: " + horizonDays));
        }
        if (paths == null || paths.isEmpty()) {
            warnings.add(new ValidationWarning("Scenario", "No variable paths: every variable stays at its neutral level"));
            return ValidationResult.of(errors, warnings);
        }

        for (Map.Entry<String, ?> e : paths.entrySet()) {
            String key = e.getKey();
            if (MarketVariable.fromId(key).isEmpty()) {
                errors.add(new ValidationError("Scenario", key, "Unknown market variable"));
                continue;
            }
            if (!(e.getValue() instanceof List)) {
                errors.add(new ValidationError("Scenario", key, "Path must be a list of numbers"));
                continue;
            }
            List<?> values = (List<?>) e.getValue();
            if (horizonDays != null && values.size() != horizonDays) {
                errors.add(new ValidationError("Scenario", key,
                    "Path has " + values.size() + " values, horizon is " + horizonDays));
            }
            for (int d = 0; d < values.size(); d++) {
                Object v = values.get(d);
                if (!(v instanceof Number) || !Double.isFinite(((Number) v).doubleValue())) {
                    errors.add(new ValidationError("Scenario", key + "[" + d + "]", "Not a finite number: " + v));
                }
            }
        }
        return ValidationResult.of(errors, warnings);
    }

    public ValidationResult validateScenario(Scenario scenario) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();
        if (scenario == null) {
            errors.add(new ValidationError("Scenario", "scenario", "Scenario is missing"));
            return ValidationResult.of(errors, warnings);
        }
        if (scenario.drives(MarketVariable.VIX)) {
            double[] vix = scenario.path(MarketVariable.VIX);
            for (int d = 0; d < vix.length; d++) {
                if (vix[d] <= 0) {
                    errors.add(new ValidationError("Scenario", "vix[" + d + "]", "VIX level must be > 0: " + vix[d]));
                }
            }
        } else {
            warnings.add(new ValidationWarning("Scenario", "VIX not driven: volatility stays at baseline"));
        }
        if (scenario.getDrivenVariables().isEmpty()) {
            warnings.add(new ValidationWarning("Scenario", "Scenario drives no market variable"));
        }
        return ValidationResult.of(errors, warnings);
    }

    // ========================================================================
    // BATCH VALIDATION
    // ========================================================================

    /**
     * Validate everything a run needs.
     */
    public ValidationResult validateRun(List<Agent> agents, RelationshipNetwork network, Scenario scenario) {
        ValidationResult population = validatePopulation(agents);
        if (agents == null || agents.isEmpty()) {
            return ValidationResult.merge(population, validateScenario(scenario));
        }
        return ValidationResult.merge(population, validateNetwork(network, agents), validateScenario(scenario));
    }

    /**
     * @throws InvalidInputException if the result has errors
     */
    public static ValidationResult requireValid(ValidationResult result) {
        if (!result.isValid()) {
            throw new InvalidInputException(result);
        }
        return result;
    }
}
