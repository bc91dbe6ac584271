package org.carma.liquidity.engine;

import org.carma.liquidity.Fixtures;
import org.carma.liquidity.agent.BankBehavior;
import org.carma.liquidity.market.MarketState;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AssetClass;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MarketMakingAbsorberTest {

    private MarketMakingAbsorber absorber;
    private MarketState market;

    @BeforeEach
    void setUp() {
        absorber = new MarketMakingAbsorber();
        market = new MarketState();
    }

    private static Agent smallDealer(String id) {
        return new BankBehavior.Builder(id)
            .totalBalanceSheet(50_000)
            .riskAppetite(0.8)
            .marketMakingCapacity(400, 100)
            .build();
    }

    @Test
    @DisplayName("Selling is offered to banks in proportion to remaining capacity")
    void proportionalOffers() {
        Agent a = Fixtures.bank("Bank_01");
        Agent b = Fixtures.bank("Bank_02");
        market.registerSelling(AssetClass.GILT, 1_000);

        Map<AssetClass, Double> absorbed = absorber.absorb(List.of(a, b), market);

        assertThat(absorbed.get(AssetClass.GILT)).isCloseTo(1_000.0, within(1e-9));
        assertThat(a.asBank().getMarketMaking().getAbsorbed(AssetClass.GILT)).isCloseTo(500.0, within(1e-9));
        assertThat(b.asBank().getMarketMaking().getAbsorbed(AssetClass.GILT)).isCloseTo(500.0, within(1e-9));
        assertThat(market.getAbsorbed(AssetClass.GILT)).isCloseTo(1_000.0, within(1e-9));
        assertThat(market.getUnabsorbedSelling(AssetClass.GILT)).isZero();
        assertThat(market.getRemainingDealerCapacity(AssetClass.GILT)).isCloseTo(3_000.0, within(1e-9));
        assertThat(absorbed.get(AssetClass.CORPORATE_BOND)).isZero();
    }

    @Test
    @DisplayName("Absorption does not depend on bank order")
    void orderIndependent() {
        List<Agent> forward = new ArrayList<>(List.of(Fixtures.bank("Bank_01"), smallDealer("Bank_02"),
            Fixtures.bank("Bank_03")));
        List<Agent> reversed = new ArrayList<>(List.of(Fixtures.bank("Bank_01"), smallDealer("Bank_02"),
            Fixtures.bank("Bank_03")));
        Collections.reverse(reversed);
        MarketState other = new MarketState();
        market.registerSelling(AssetClass.GILT, 3_500);
        other.registerSelling(AssetClass.GILT, 3_500);

        double first = absorber.absorb(forward, market).get(AssetClass.GILT);
        double second = absorber.absorb(reversed, other).get(AssetClass.GILT);

        assertThat(second).isCloseTo(first, within(1e-9));
        for (int i = 0; i < forward.size(); i++) {
            Agent f = forward.get(i);
            Agent r = reversed.get(forward.size() - 1 - i);
            assertThat(r.getId()).isEqualTo(f.getId());
            assertThat(r.asBank().getMarketMaking().getRemaining(AssetClass.GILT))
                .isCloseTo(f.asBank().getMarketMaking().getRemaining(AssetClass.GILT), within(1e-9));
        }
    }

    @Test
    @DisplayName("Without banks nothing is absorbed")
    void noBanks() {
        Agent fund = Fixtures.fund("Fund_01", 100, 1_000);
        market.registerSelling(AssetClass.GILT, 500);

        Map<AssetClass, Double> absorbed = absorber.absorb(List.of(fund), market);

        assertThat(absorbed.get(AssetClass.GILT)).isZero();
        assertThat(market.getUnabsorbedSelling(AssetClass.GILT)).isEqualTo(500.0);
        assertThat(market.getRemainingDealerCapacity(AssetClass.GILT)).isZero();
    }

    @Test
    @DisplayName("Cumulative absorption over several days never exceeds capacity")
    void capacityIsNotReplenished() {
        Agent a = Fixtures.bank("Bank_01");
        Agent b = Fixtures.bank("Bank_02");
        List<Agent> banks = List.of(a, b);

        market.registerSelling(AssetClass.GILT, 3_000);
        double day0 = absorber.absorb(banks, market).get(AssetClass.GILT);
        market.applyExogenous(1, Map.of());
        market.registerSelling(AssetClass.GILT, 3_000);
        double day1 = absorber.absorb(banks, market).get(AssetClass.GILT);

        // risk appetite 0.5: 1000 each on day 0, half the remainder on day 1
        assertThat(day0).isCloseTo(2_000.0, within(1e-9));
        assertThat(day1).isCloseTo(1_000.0, within(1e-9));
        for (Agent bank : banks) {
            assertThat(bank.asBank().getMarketMaking().getAbsorbed(AssetClass.GILT))
                .isLessThanOrEqualTo(bank.asBank().getMarketMaking().getCapacity(AssetClass.GILT));
        }
    }
}
