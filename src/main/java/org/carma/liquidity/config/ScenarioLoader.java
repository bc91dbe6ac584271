package org.carma.liquidity.config;

import org.carma.liquidity.market.Scenario;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.validation.InputValidator;
import org.carma.liquidity.validation.InputValidator.InvalidInputException;
import org.carma.liquidity.validation.InputValidator.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads scenario definitions from YAML.
 *
 * <pre>
 * name: swes1
 * horizonDays: 3
 * variablePaths:
 *   gilt_10y_yield: [40, 90, 130]
 *   vix: [22, 30, 35]
 * </pre>
 * Paths hold cumulative levels, one per day.
 */
public class ScenarioLoader {

    private static final Logger log = LoggerFactory.getLogger(ScenarioLoader.class);

    private static final Set<String> KEYS = Set.of("name", "description", "horizonDays", "variablePaths");

    private final Yaml yaml;
    private final InputValidator validator;

    public ScenarioLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
        this.validator = new InputValidator();
    }

    public Scenario load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Scenario file not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            log.info("Loading scenario from {}", file);
            return parse(read(is, file.toString()), file.toString());
        }
    }

    public Scenario loadFromString(String content) {
        Object loaded;
        try {
            loaded = yaml.load(content);
        } catch (YAMLException e) {
            throw new InvalidInputException("Malformed scenario: " + e.getMessage());
        }
        return parse(loaded, "<string>");
    }

    /**
     * Load a scenario bundled on the classpath, e.g. {@code scenarios/swes1.yaml}.
     */
    public Scenario loadResource(String resource) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Scenario resource not found: " + resource);
            }
            return parse(read(is, resource), resource);
        }
    }

    private Object read(InputStream is, String source) {
        try {
            return yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidInputException("Malformed scenario in " + source + ": " + e.getMessage());
        }
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private Scenario parse(Object loaded, String source) {
        if (loaded == null) {
            throw new InvalidInputException("Scenario " + source + " is empty");
        }
        Map<String, Object> raw = EngineConfigLoader.asMap(loaded, "root");
        for (String key : raw.keySet()) {
            if (!KEYS.contains(key)) {
                throw new InvalidInputException("Unknown scenario key '" + key + "' in " + source);
            }
        }

        Object nameValue = raw.get("name");
        Object horizonValue = raw.get("horizonDays");
        if (nameValue != null && !(nameValue instanceof String)) {
            throw new InvalidInputException("Scenario name must be a string: " + nameValue);
        }
        if (horizonValue != null && !(horizonValue instanceof Integer)) {
            throw new InvalidInputException("Scenario horizonDays must be an integer: " + horizonValue);
        }
        Object pathsValue = raw.get("variablePaths");
        Map<String, Object> paths = pathsValue == null ? Map.of() : EngineConfigLoader.asMap(pathsValue, "variablePaths");

        ValidationResult result = validator.validateScenarioDefinition(
            (String) nameValue, (Integer) horizonValue, paths);
        InputValidator.requireValid(result);
        if (!result.getWarnings().isEmpty()) {
            log.warn("Scenario {}: {}", source, result.getWarnings());
        }

        int horizon = (Integer) horizonValue;
        Map<MarketVariable, double[]> levels = new EnumMap<>(MarketVariable.class);
        for (Map.Entry<String, Object> e : paths.entrySet()) {
            MarketVariable variable = MarketVariable.fromId(e.getKey()).orElseThrow();
            List<?> values = (List<?>) e.getValue();
            double[] path = new double[horizon];
            for (int d = 0; d < horizon; d++) {
                path[d] = ((Number) values.get(d)).doubleValue();
            }
            if (levels.put(variable, path) != null) {
                throw new InvalidInputException("Market variable " + variable + " given twice in " + source);
            }
        }

        Scenario scenario = new Scenario((String) nameValue, horizon, levels);
        InputValidator.requireValid(validator.validateScenario(scenario));
        log.debug("Loaded {}", scenario);
        return scenario;
    }
}
