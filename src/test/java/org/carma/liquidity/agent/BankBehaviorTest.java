package org.carma.liquidity.agent;

import org.carma.liquidity.Fixtures;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.ExecutedAction;
import org.carma.liquidity.model.Reaction;
import org.carma.liquidity.network.RelationshipNetwork;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class BankBehaviorTest {

    @Test
    @DisplayName("Buffer weights eligible collateral and CET1, net of wholesale run-off")
    void buffer() {
        Agent bank = Fixtures.bank("Bank_01");
        BankBehavior behavior = bank.asBank();

        assertThat(behavior.weightedBuffer(bank)).isCloseTo(1_780.0, within(1e-9));
        assertThat(behavior.bufferFloor(bank)).isCloseTo(200.0, within(1e-9));
    }

    @Test
    @DisplayName("Waterfall: facility, repo lending, gilts, corporate bonds")
    void waterfall() {
        Agent bank = Fixtures.bank("Bank_01");
        StepContext ctx = Fixtures.context(List.of(bank), RelationshipNetwork.empty(List.of(bank)));

        Waterfall waterfall = new Waterfall(5_000);
        bank.getBehavior().buildWaterfall(bank, ctx, waterfall);

        assertThat(waterfall.getActions())
            .extracting(ExecutedAction::reaction)
            .containsExactly(
                Reaction.DRAW_CENTRAL_BANK_FACILITY,
                Reaction.REDUCE_REPO_LENDING,
                Reaction.SELL_GILT,
                Reaction.SELL_CORP_BONDS);
        assertThat(waterfall.getActions())
            .extracting(ExecutedAction::amount)
            .satisfiesExactly(
                a -> assertThat(a).isCloseTo(1_500.0, within(1e-9)),
                a -> assertThat(a).isCloseTo(1_050.0, within(1e-9)),
                a -> assertThat(a).isCloseTo(245.0, within(1e-9)),
                // ceiling 2% of 5000
                a -> assertThat(a).isCloseTo(100.0, within(1e-9)));
    }

    @Test
    @DisplayName("Reacting tightens repo willingness down to its floors")
    void tightening() {
        BankBehavior behavior = Fixtures.bank("Bank_01").asBank();

        behavior.tightenRepo();
        assertThat(behavior.getWillingnessToExtendNew()).isCloseTo(0.65, within(1e-12));
        assertThat(behavior.getWillingnessToRoll()).isCloseTo(0.825, within(1e-12));

        for (int i = 0; i < 20; i++) {
            behavior.tightenRepo();
        }
        assertThat(behavior.getWillingnessToExtendNew()).isZero();
        assertThat(behavior.getWillingnessToRoll()).isEqualTo(0.5);
    }

    @Test
    void rejectsRiskAppetiteOutsideUnitInterval() {
        assertThatThrownBy(() -> new BankBehavior.Builder("Bank_01").riskAppetite(1.2))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsNegativeBalanceSheet() {
        assertThatThrownBy(() -> new BankBehavior.Builder("Bank_01").totalBalanceSheet(-1).build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
