package org.carma.liquidity.engine;

import org.carma.liquidity.model.AgentType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Amplification of first-round losses by second-round feedback over a run.
 *
 * <p>Per agent, summed over the horizon:
 * <pre>
 *   direct = max(Σ (B0 − B1), ε)
 *   total  = max(Σ ((B0 − B1) + E2), ε)
 *   ratio  = total / direct
 * </pre>
 * Per type and system ratios divide the sums of the floored agent terms.
 * Own-reaction mitigation is excluded, so a run without feedback gives exactly 1.0.
 */
public class AmplificationReport {

    /**
     * Direct and total loss of one agent or group.
     */
    public record Amplification(double direct, double total) {
        public double ratio() {
            return total / direct;
        }
    }

    private final Map<String, Amplification> byAgent;
    private final Map<AgentType, Amplification> byType;
    private final Amplification system;

    private AmplificationReport(Map<String, Amplification> byAgent,
                                Map<AgentType, Amplification> byType,
                                Amplification system) {
        this.byAgent = Collections.unmodifiableMap(byAgent);
        this.byType = Collections.unmodifiableMap(byType);
        this.system = system;
    }

    /**
     * Build the report from daily agent snapshots.
     *
     * @param epsilon floor applied to each agent's direct and total terms
     */
    public static AmplificationReport from(List<AgentSnapshot> snapshots, double epsilon) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        Map<String, AgentType> types = new LinkedHashMap<>();
        for (AgentSnapshot s : snapshots) {
            double[] acc = sums.computeIfAbsent(s.id(), id -> new double[2]);
            double direct = s.b0() - s.b1();
            acc[0] += direct;
            acc[1] += direct + s.e2();
            types.put(s.id(), s.type());
        }

        Map<String, Amplification> byAgent = new LinkedHashMap<>();
        Map<AgentType, double[]> typeSums = new EnumMap<>(AgentType.class);
        double systemDirect = 0.0;
        double systemTotal = 0.0;
        for (Map.Entry<String, double[]> e : sums.entrySet()) {
            double direct = Math.max(e.getValue()[0], epsilon);
            double total = Math.max(e.getValue()[1], epsilon);
            byAgent.put(e.getKey(), new Amplification(direct, total));

            double[] t = typeSums.computeIfAbsent(types.get(e.getKey()), k -> new double[2]);
            t[0] += direct;
            t[1] += total;
            systemDirect += direct;
            systemTotal += total;
        }

        Map<AgentType, Amplification> byType = new EnumMap<>(AgentType.class);
        typeSums.forEach((type, t) -> byType.put(type, new Amplification(t[0], t[1])));

        Amplification system = byAgent.isEmpty()
            ? new Amplification(epsilon, epsilon)
            : new Amplification(systemDirect, systemTotal);
        return new AmplificationReport(byAgent, byType, system);
    }

    public Amplification getAgent(String id) {
        Amplification a = byAgent.get(id);
        if (a == null) {
            throw new IllegalArgumentException("No amplification for agent: " + id);
        }
        return a;
    }

    public Map<String, Amplification> getByAgent() {
        return byAgent;
    }

    public Map<AgentType, Amplification> getByType() {
        return byType;
    }

    public Amplification getSystem() {
        return system;
    }

    public double getSystemRatio() {
        return system.ratio();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("AmplificationReport[system=%.3f", system.ratio()));
        byType.forEach((type, a) -> sb.append(String.format(", %s=%.3f", type.name(), a.ratio())));
        return sb.append(']').toString();
    }
}
