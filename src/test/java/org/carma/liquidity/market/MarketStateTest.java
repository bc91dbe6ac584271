package org.carma.liquidity.market;

import org.carma.liquidity.model.AssetClass;
import org.carma.liquidity.model.MarketVariable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class MarketStateTest {

    private MarketState market;

    @BeforeEach
    void setUp() {
        market = new MarketState();
    }

    @Test
    @DisplayName("Calm market sits at neutral levels")
    void neutral() {
        assertThat(market.getVix()).isEqualTo(15.0);
        assertThat(market.level(MarketVariable.GILT_10Y_YIELD)).isZero();
        assertThat(market.stressIndex()).isEqualTo(1.0);
        assertThat(market.getRepoAvailability()).isEqualTo(1.0);
        assertThat(market.getGiltBidAskBps()).isEqualTo(MarketState.NORMAL_GILT_BID_ASK_BPS);
    }

    @Test
    @DisplayName("Exogenous levels drive functioning indicators through VIX")
    void exogenous() {
        market.applyExogenous(2, Map.of(MarketVariable.VIX, 30.0, MarketVariable.GILT_10Y_YIELD, 90.0));

        assertThat(market.getDay()).isEqualTo(2);
        assertThat(market.level(MarketVariable.GILT_10Y_YIELD)).isEqualTo(90.0);
        assertThat(market.level(MarketVariable.EQUITY)).isZero();
        assertThat(market.stressIndex()).isEqualTo(2.0);
        assertThat(market.getGiltBidAskBps()).isEqualTo(4.0);
        assertThat(market.getCorpBidAskBps()).isEqualTo(10.0);
        assertThat(market.getRepoAvailability()).isCloseTo(0.85, within(1e-12));
    }

    @Test
    @DisplayName("Stress index never drops below one but the volatility ratio may")
    void calmerThanBaseline() {
        market.applyExogenous(0, Map.of(MarketVariable.VIX, 12.0));

        assertThat(market.volatilityRatio()).isCloseTo(0.8, within(1e-12));
        assertThat(market.stressIndex()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Repo availability is floored")
    void repoFloor() {
        market.applyExogenous(0, Map.of(MarketVariable.VIX, 150.0));

        assertThat(market.getRepoAvailability()).isEqualTo(MarketState.MIN_REPO_AVAILABILITY);
    }

    @Test
    @DisplayName("Unabsorbed selling moves yields, and repeated iterations add up")
    void endogenousFeedback() {
        market.registerSelling(AssetClass.GILT, 5_000);
        market.registerRepoDemand(10_000);

        market.applyEndogenousFeedback();

        // 5000 / depth 5000 × 20bp
        assertThat(market.getEndogenousGiltYieldAddBps()).isCloseTo(20.0, within(1e-9));
        assertThat(market.level(MarketVariable.GILT_10Y_YIELD)).isCloseTo(10.0, within(1e-9));
        assertThat(market.level(MarketVariable.GILT_30Y_YIELD)).isCloseTo(14.0, within(1e-9));
        assertThat(market.getRepoAvailability()).isCloseTo(0.95, within(1e-12));
        assertThat(market.getGiltBidAskBps()).isCloseTo(7.0, within(1e-9));

        market.applyEndogenousFeedback();

        assertThat(market.getEndogenousGiltYieldAddBps()).isCloseTo(40.0, within(1e-9));
        assertThat(market.level(MarketVariable.GILT_10Y_YIELD)).isCloseTo(20.0, within(1e-9));
    }

    @Test
    @DisplayName("Absorbed selling has no price impact")
    void absorbedSelling() {
        market.registerSelling(AssetClass.CORPORATE_BOND, 800);
        market.recordAbsorbed(AssetClass.CORPORATE_BOND, 800);

        market.applyEndogenousFeedback();

        assertThat(market.getUnabsorbedSelling(AssetClass.CORPORATE_BOND)).isZero();
        assertThat(market.level(MarketVariable.IG_CORP_SPREAD)).isZero();
    }

    @Test
    @DisplayName("A new day resets the accumulators")
    void newDayResets() {
        market.registerSelling(AssetClass.GILT, 100);
        market.registerRepoDemand(50);

        market.applyExogenous(1, Map.of());

        assertThat(market.getSellingPressure(AssetClass.GILT)).isZero();
        assertThat(market.getRepoDemand()).isZero();
        assertThat(market.getEndogenousGiltYieldAddBps()).isZero();
    }

    @Test
    @DisplayName("Snapshots are detached from later changes")
    void snapshot() {
        market.registerSelling(AssetClass.GILT, 100);
        MarketSnapshot before = market.snapshot();

        market.registerSelling(AssetClass.GILT, 200);

        assertThat(before.sellingPressure().get(AssetClass.GILT)).isEqualTo(100.0);
        assertThat(before.level(MarketVariable.VIX)).isEqualTo(15.0);
    }

    @Test
    void rejectsInvalidAmounts() {
        assertThatThrownBy(() -> market.registerSelling(AssetClass.GILT, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> market.registerRepoDemand(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MarketState(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
