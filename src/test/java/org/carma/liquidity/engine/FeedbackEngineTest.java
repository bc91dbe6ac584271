package org.carma.liquidity.engine;

import org.carma.liquidity.Fixtures;
import org.carma.liquidity.agent.BankBehavior;
import org.carma.liquidity.agent.HedgeFundBehavior;
import org.carma.liquidity.config.EngineConfig;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.ExecutedAction;
import org.carma.liquidity.model.MarketVariable;
import org.carma.liquidity.model.Reaction;
import org.carma.liquidity.network.EdgeKind;
import org.carma.liquidity.network.RelationshipNetwork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FeedbackEngineTest {

    private FeedbackEngine engine;
    private MarketState calm;
    private Agent bank;
    private Agent hf;
    private Agent fund;
    private Map<String, Agent> agents;
    private RelationshipNetwork network;

    @BeforeEach
    void setUp() {
        engine = new FeedbackEngine(EngineConfig.DEFAULT);
        calm = new MarketState();
        bank = Fixtures.bank("Bank_01");
        hf = Fixtures.hedgeFund("HF_01");
        fund = Fixtures.fund("Fund_01", 100, 1_000);
        agents = Fixtures.byId(List.of(bank, hf, fund));
        network = new RelationshipNetwork.Builder()
            .addAgents(agents.values())
            .connect("Bank_01", "HF_01", EdgeKind.PRIME_BROKERAGE_REPO)
            .connect("HF_01", "Fund_01", EdgeKind.REDEMPTION)
            .build();
        for (Agent a : agents.values()) {
            LiquidityMechanics.computeInitialBuffer(a);
        }
    }

    private static void react(Agent agent, Reaction reaction, String item, double amount) {
        agent.setReacted(true);
        agent.setActions(List.of(new ExecutedAction(reaction, amount, item)));
    }

    @Test
    @DisplayName("Nobody reacting gives zero second-round loss to everyone")
    void nobodyReacting() {
        MarketState stressed = new MarketState();
        stressed.applyExogenous(0, Map.of(MarketVariable.VIX, 45.0));

        Map<String, Double> e2 = engine.computeIteration(agents, stressed, network);

        assertThat(e2).containsOnlyKeys("Bank_01", "HF_01", "Fund_01");
        assertThat(e2.values()).containsOnly(0.0);
    }

    @Test
    @DisplayName("Hedge fund is hit by a reacting prime broker")
    void hedgeFundFundingStress() {
        react(bank, Reaction.DRAW_CENTRAL_BANK_FACILITY, BankBehavior.CENTRAL_BANK_ELIGIBLE, 890);

        // repo borrowing 1440 × (890 / 1780) × s 1 × 0.05
        assertThat(engine.bilateral(hf, agents, network, 1.0)).isCloseTo(36.0, within(1e-9));
        assertThat(engine.bilateral(hf, agents, network, 2.0)).isCloseTo(72.0, within(1e-9));
    }

    @Test
    @DisplayName("Bank takes counterparty losses from a reacting hedge fund client")
    void bankCounterpartyLoss() {
        react(hf, Reaction.SELL_GILT, HedgeFundBehavior.GILT_POSITIONS, 50);
        hf.getLiquidity().setE1(100);

        // stress 100 / 200 × exposure 1440 × 0.005
        assertThat(engine.bilateral(bank, agents, network, 1.0)).isCloseTo(3.6, within(1e-9));
    }

    @Test
    @DisplayName("Fund complex feels redemption pressure from reacting investors")
    void redemptionPressure() {
        react(hf, Reaction.REDEEM_FUND, null, 500);

        assertThat(engine.bilateral(fund, agents, network, 1.0)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    @DisplayName("Unconnected or calm counterparties contribute nothing")
    void noChannel() {
        assertThat(engine.bilateral(hf, agents, network, 1.0)).isZero();
        assertThat(engine.bilateral(bank, agents, network, 1.0)).isZero();
        RelationshipNetwork none = RelationshipNetwork.empty(agents.values());
        react(bank, Reaction.DRAW_CENTRAL_BANK_FACILITY, BankBehavior.CENTRAL_BANK_ELIGIBLE, 890);
        assertThat(engine.bilateral(hf, agents, none, 1.0)).isZero();
    }

    @Test
    @DisplayName("Reputation cost vanishes in calm markets and grows with stress")
    void reputation() {
        react(hf, Reaction.SELL_GILT, HedgeFundBehavior.GILT_POSITIONS, 100);

        assertThat(engine.reputation(hf, 1.0)).isZero();
        // 100 × (√4 − 1) × 0.15
        assertThat(engine.reputation(hf, 4.0)).isCloseTo(15.0, within(1e-9));
    }

    @Test
    @DisplayName("Crowding grows with the fraction of peers reacting")
    void crowding() {
        react(hf, Reaction.SELL_GILT, HedgeFundBehavior.GILT_POSITIONS, 100);

        // 100 × (1/2)² × 2 × 0.03
        assertThat(engine.crowding(hf, 2.0, 1, 2)).isCloseTo(1.5, within(1e-9));
        assertThat(engine.crowding(hf, 2.0, 2, 2)).isCloseTo(6.0, within(1e-9));
        assertThat(engine.crowding(hf, 2.0, 0, 0)).isZero();
    }

    @Test
    @DisplayName("Broadcast scales with the reacting fraction and liquid holdings")
    void broadcast() {
        assertThat(engine.broadcast(fund, 2.0, 0.0)).isZero();
        double half = engine.broadcast(fund, 2.0, 0.5);
        assertThat(half).isGreaterThanOrEqualTo(0.0);
        assertThat(engine.broadcast(fund, 2.0, 1.0)).isCloseTo(2 * half, within(1e-12));
    }

    @Test
    @DisplayName("Second-round losses are non-negative and accumulate into E2")
    void appliesNonNegative() {
        react(bank, Reaction.DRAW_CENTRAL_BANK_FACILITY, BankBehavior.CENTRAL_BANK_ELIGIBLE, 890);
        react(hf, Reaction.REDEEM_FUND, null, 500);
        hf.getLiquidity().setE1(300);
        MarketState stressed = new MarketState();
        stressed.applyExogenous(0, Map.of(MarketVariable.VIX, 30.0));

        Map<String, Double> first = engine.applyIteration(agents, stressed, network);
        Map<String, Double> second = engine.applyIteration(agents, stressed, network);

        for (String id : agents.keySet()) {
            assertThat(first.get(id)).isGreaterThanOrEqualTo(0.0);
            assertThat(agents.get(id).getLiquidity().getE2())
                .isCloseTo(first.get(id) + second.get(id), within(1e-9));
        }
        assertThat(first.get("HF_01")).isPositive();
        assertThat(first.get("Fund_01")).isPositive();
    }

    @Test
    @DisplayName("Result does not depend on agent iteration order")
    void orderIndependent() {
        react(bank, Reaction.DRAW_CENTRAL_BANK_FACILITY, BankBehavior.CENTRAL_BANK_ELIGIBLE, 890);
        react(hf, Reaction.REDEEM_FUND, null, 500);
        hf.getLiquidity().setE1(300);

        List<String> ids = new ArrayList<>(agents.keySet());
        Collections.reverse(ids);
        Map<String, Agent> reversed = new LinkedHashMap<>();
        for (String id : ids) {
            reversed.put(id, agents.get(id));
        }

        Map<String, Double> forward = engine.computeIteration(agents, calm, network);
        Map<String, Double> backward = engine.computeIteration(reversed, calm, network);

        for (String id : agents.keySet()) {
            assertThat(backward.get(id)).isCloseTo(forward.get(id), within(1e-12));
        }
        assertThat(fund.getLiquidity().getE2()).isZero();
    }
}
