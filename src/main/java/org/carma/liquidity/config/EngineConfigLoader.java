package org.carma.liquidity.config;

import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.Reaction;
import org.carma.liquidity.validation.InputValidator.InvalidInputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads an {@link EngineConfig} from YAML.
 *
 * Keys that are not present keep their builder defaults. Layout:
 * <pre>
 * feedback:
 *   iterations: 3
 *   reputation: 0.15
 *   reputationExponent: 0.5
 * market:
 *   vixBaseline: 15
 * reactionCaps:
 *   BANK:
 *     SELL_GILT: [0.10, 0.20]      # [share, ceiling]
 * population:
 *   counts: {BANK: 12}
 *   theta: {BANK: [0.35, 0.45]}
 * network:
 *   hedgeFundBankDegree: [2, 3]
 * </pre>
 * Unknown keys, wrong types and out-of-range values raise
 * {@link InvalidInputException}; unreadable files raise {@link IOException}.
 */
public class EngineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    /** Classpath resource loaded by {@link #loadDefault()} */
    public static final String DEFAULT_RESOURCE = "liquidity-engine.yaml";

    private static final Set<String> TOP_LEVEL_KEYS = Set.of(
        "feedback", "market", "bank", "efficiency", "fundComplex", "amplificationEpsilon",
        "reactionCaps", "multiStrategyCap", "population", "network");

    private final Yaml yaml;

    public EngineConfigLoader() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        this.yaml = new Yaml(options);
    }

    // ========================================================================
    // LOADING
    // ========================================================================

    public EngineConfig load(Path file) throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("Engine configuration not found: " + file);
        }
        try (InputStream is = Files.newInputStream(file)) {
            log.info("Loading engine configuration from {}", file);
            return parse(loadYaml(is), file.toString());
        }
    }

    public EngineConfig loadFromString(String content) {
        return parse(loadYaml(content), "<string>");
    }

    /**
     * Load {@value #DEFAULT_RESOURCE} from the classpath.
     */
    public EngineConfig loadDefault() throws IOException {
        return loadResource(DEFAULT_RESOURCE);
    }

    public EngineConfig loadResource(String resource) throws IOException {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Engine configuration resource not found: " + resource);
            }
            return parse(loadYaml(is), resource);
        }
    }

    private Object loadYaml(InputStream is) {
        try {
            return yaml.load(is);
        } catch (YAMLException e) {
            throw new InvalidInputException("Malformed engine configuration: " + e.getMessage());
        }
    }

    private Object loadYaml(String content) {
        try {
            return yaml.load(content);
        } catch (YAMLException e) {
            throw new InvalidInputException("Malformed engine configuration: " + e.getMessage());
        }
    }

    // ========================================================================
    // PARSING
    // ========================================================================

    private EngineConfig parse(Object loaded, String source) {
        EngineConfig.Builder builder = new EngineConfig.Builder();
        if (loaded == null) {
            return builder.build();
        }
        Map<String, Object> raw = asMap(loaded, "root");
        for (String key : raw.keySet()) {
            if (!TOP_LEVEL_KEYS.contains(key)) {
                throw new InvalidInputException("Unknown engine configuration key '" + key + "' in " + source);
            }
        }
        try {
            parseFeedback(section(raw, "feedback"), builder);
            parseMarket(section(raw, "market"), builder);
            parseBank(section(raw, "bank"), builder);
            parseEfficiency(section(raw, "efficiency"), builder);
            parseFundComplex(section(raw, "fundComplex"), builder);
            if (raw.containsKey("amplificationEpsilon")) {
                builder.amplificationEpsilon(getDouble(raw, "amplificationEpsilon"));
            }
            parseReactionCaps(section(raw, "reactionCaps"), builder);
            if (raw.containsKey("multiStrategyCap")) {
                builder.multiStrategyCap(cap(raw.get("multiStrategyCap"), "multiStrategyCap"));
            }
            if (raw.containsKey("population")) {
                builder.populationRanges(parsePopulation(section(raw, "population")));
            }
            if (raw.containsKey("network")) {
                builder.networkRules(parseNetwork(section(raw, "network")));
            }
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Invalid engine configuration in " + source + ": " + e.getMessage());
        }
        EngineConfig config = builder.build();
        log.debug("Loaded {} from {}", config, source);
        return config;
    }

    private void parseFeedback(Map<String, Object> map, EngineConfig.Builder b) {
        requireKeys(map, "feedback", "iterations", "bankCounterpartyLoss", "hedgeFundFundingStress",
            "redemptionPressure", "broadcast", "reputation", "reputationExponent", "crowding", "crowdingExponent");
        if (map.containsKey("iterations")) b.feedbackIterations(getInt(map, "iterations"));
        if (map.containsKey("bankCounterpartyLoss")) b.bankCounterpartyLossCoefficient(getDouble(map, "bankCounterpartyLoss"));
        if (map.containsKey("hedgeFundFundingStress")) b.hedgeFundFundingStressCoefficient(getDouble(map, "hedgeFundFundingStress"));
        if (map.containsKey("redemptionPressure")) b.redemptionPressureCoefficient(getDouble(map, "redemptionPressure"));
        if (map.containsKey("broadcast")) b.broadcastCoefficient(getDouble(map, "broadcast"));
        if (map.containsKey("reputation")) b.reputationCoefficient(getDouble(map, "reputation"));
        if (map.containsKey("reputationExponent")) b.reputationExponent(getDouble(map, "reputationExponent"));
        if (map.containsKey("crowding")) b.crowdingCoefficient(getDouble(map, "crowding"));
        if (map.containsKey("crowdingExponent")) b.crowdingExponent(getDouble(map, "crowdingExponent"));
    }

    private void parseMarket(Map<String, Object> map, EngineConfig.Builder b) {
        requireKeys(map, "market", "vixBaseline");
        if (map.containsKey("vixBaseline")) b.vixBaseline(getDouble(map, "vixBaseline"));
    }

    private void parseBank(Map<String, Object> map, EngineConfig.Builder b) {
        requireKeys(map, "bank", "repoRefusalStressThreshold");
        if (map.containsKey("repoRefusalStressThreshold")) {
            b.bankRepoRefusalStressThreshold(getDouble(map, "repoRefusalStressThreshold"));
        }
    }

    private void parseEfficiency(Map<String, Object> map, EngineConfig.Builder b) {
        requireKeys(map, "efficiency", "saleRealisationFloor", "centralBank", "redemption", "other");
        if (map.containsKey("saleRealisationFloor")) b.saleRealisationFloor(getDouble(map, "saleRealisationFloor"));
        if (map.containsKey("centralBank")) b.centralBankEfficiency(getDouble(map, "centralBank"));
        if (map.containsKey("redemption")) b.redemptionEfficiency(getDouble(map, "redemption"));
        if (map.containsKey("other")) b.otherEfficiency(getDouble(map, "other"));
    }

    private void parseFundComplex(Map<String, Object> map, EngineConfig.Builder b) {
        requireKeys(map, "fundComplex", "gateThreshold", "gateThrottle");
        if (map.containsKey("gateThreshold")) b.gateThreshold(getDouble(map, "gateThreshold"));
        if (map.containsKey("gateThrottle")) b.gateThrottle(getDouble(map, "gateThrottle"));
    }

    private void parseReactionCaps(Map<String, Object> map, EngineConfig.Builder b) {
        for (Map.Entry<String, Object> typeEntry : map.entrySet()) {
            AgentType type = enumValue(AgentType.class, typeEntry.getKey(), "reactionCaps");
            Map<String, Object> caps = asMap(typeEntry.getValue(), "reactionCaps." + typeEntry.getKey());
            for (Map.Entry<String, Object> capEntry : caps.entrySet()) {
                Reaction reaction = enumValue(Reaction.class, capEntry.getKey(), "reactionCaps." + typeEntry.getKey());
                b.reactionCap(type, reaction, cap(capEntry.getValue(), "reactionCaps." + type + "." + reaction.name()));
            }
        }
    }

    private PopulationRanges parsePopulation(Map<String, Object> map) {
        requireKeys(map, "population", "counts", "theta", "bufferUsability", "size", "parameters");
        PopulationRanges.Builder b = new PopulationRanges.Builder();
        for (Map.Entry<String, Object> e : section(map, "counts").entrySet()) {
            b.count(enumValue(AgentType.class, e.getKey(), "population.counts"), toInt(e.getValue(), "population.counts." + e.getKey()));
        }
        for (Map.Entry<String, Object> e : section(map, "theta").entrySet()) {
            double[] r = pair(e.getValue(), "population.theta." + e.getKey());
            b.theta(enumValue(AgentType.class, e.getKey(), "population.theta"), r[0], r[1]);
        }
        for (Map.Entry<String, Object> e : section(map, "bufferUsability").entrySet()) {
            double[] r = pair(e.getValue(), "population.bufferUsability." + e.getKey());
            b.bufferUsability(enumValue(AgentType.class, e.getKey(), "population.bufferUsability"), r[0], r[1]);
        }
        for (Map.Entry<String, Object> e : section(map, "size").entrySet()) {
            double[] r = pair(e.getValue(), "population.size." + e.getKey());
            b.size(enumValue(AgentType.class, e.getKey(), "population.size"), r[0], r[1]);
        }
        for (Map.Entry<String, Object> e : section(map, "parameters").entrySet()) {
            double[] r = pair(e.getValue(), "population.parameters." + e.getKey());
            b.parameter(enumValue(PopulationRanges.Parameter.class, e.getKey(), "population.parameters"), r[0], r[1]);
        }
        return b.build();
    }

    private NetworkRules parseNetwork(Map<String, Object> map) {
        requireKeys(map, "network", "hedgeFundBankDegree", "ldiBankDegree", "insurerBankDegree",
            "nonBankFundDegree", "fundFundDegree");
        NetworkRules.Builder b = new NetworkRules.Builder();
        if (map.containsKey("hedgeFundBankDegree")) {
            int[] r = intPair(map.get("hedgeFundBankDegree"), "network.hedgeFundBankDegree");
            b.hedgeFundBankDegree(r[0], r[1]);
        }
        if (map.containsKey("ldiBankDegree")) {
            int[] r = intPair(map.get("ldiBankDegree"), "network.ldiBankDegree");
            b.ldiBankDegree(r[0], r[1]);
        }
        if (map.containsKey("insurerBankDegree")) {
            int[] r = intPair(map.get("insurerBankDegree"), "network.insurerBankDegree");
            b.insurerBankDegree(r[0], r[1]);
        }
        if (map.containsKey("nonBankFundDegree")) {
            int[] r = intPair(map.get("nonBankFundDegree"), "network.nonBankFundDegree");
            b.nonBankFundDegree(r[0], r[1]);
        }
        if (map.containsKey("fundFundDegree")) {
            int[] r = intPair(map.get("fundFundDegree"), "network.fundFundDegree");
            b.fundFundDegree(r[0], r[1]);
        }
        return b.build();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    @SuppressWarnings("unchecked")
    static Map<String, Object> asMap(Object value, String path) {
        if (!(value instanceof Map)) {
            throw new InvalidInputException("Expected a mapping at '" + path + "', got " + describe(value));
        }
        return (Map<String, Object>) value;
    }

    private static Map<String, Object> section(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value == null ? Map.of() : asMap(value, key);
    }

    private static void requireKeys(Map<String, Object> map, String section, String... allowed) {
        Set<String> known = Set.of(allowed);
        for (String key : map.keySet()) {
            if (!known.contains(key)) {
                throw new InvalidInputException("Unknown key '" + section + "." + key + "'");
            }
        }
    }

    private static double getDouble(Map<String, Object> map, String key) {
        return toDouble(map.get(key), key);
    }

    private static int getInt(Map<String, Object> map, String key) {
        return toInt(map.get(key), key);
    }

    static double toDouble(Object value, String path) {
        if (!(value instanceof Number)) {
            throw new InvalidInputException("Expected a number at '" + path + "', got " + describe(value));
        }
        return ((Number) value).doubleValue();
    }

    private static int toInt(Object value, String path) {
        if (!(value instanceof Integer)) {
            throw new InvalidInputException("Expected an integer at '" + path + "', got " + describe(value));
        }
        return (Integer) value;
    }

    private static double[] pair(Object value, String path) {
        if (!(value instanceof List) || ((List<?>) value).size() != 2) {
            throw new InvalidInputException("Expected a [min, max] pair at '" + path + "', got " + describe(value));
        }
        List<?> list = (List<?>) value;
        return new double[] {toDouble(list.get(0), path + "[0]"), toDouble(list.get(1), path + "[1]")};
    }

    private static int[] intPair(Object value, String path) {
        if (!(value instanceof List) || ((List<?>) value).size() != 2) {
            throw new InvalidInputException("Expected a [min, max] pair at '" + path + "', got " + describe(value));
        }
        List<?> list = (List<?>) value;
        return new int[] {toInt(list.get(0), path + "[0]"), toInt(list.get(1), path + "[1]")};
    }

    private static ReactionCap cap(Object value, String path) {
        if (!(value instanceof List) || ((List<?>) value).size() != 2) {
            throw new InvalidInputException("Expected a [share, ceiling] pair at '" + path + "', got " + describe(value));
        }
        List<?> list = (List<?>) value;
        return ReactionCap.of(toDouble(list.get(0), path + "[0]"), toDouble(list.get(1), path + "[1]"));
    }

    private static <E extends Enum<E>> E enumValue(Class<E> type, String name, String path) {
        try {
            return Enum.valueOf(type, name.toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Unknown " + type.getSimpleName() + " '" + name + "' at '" + path + "'");
        }
    }

    private static String describe(Object value) {
        return value == null ? "nothing" : value.getClass().getSimpleName() + " " + value;
    }
}
