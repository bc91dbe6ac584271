package org.carma.liquidity.agent;

import org.carma.liquidity.config.ParameterRange;
import org.carma.liquidity.config.PopulationRanges;
import org.carma.liquidity.config.PopulationRanges.Parameter;
import org.carma.liquidity.model.Agent;
import org.carma.liquidity.model.AgentType;
import org.carma.liquidity.model.HedgeFundStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Seeded generation of a heterogeneous population.
 *
 * Agents are drawn from the configured ranges in type order (banks, hedge
 * funds, LDI/pension funds, insurers, fund complexes) with ids such as
 * {@code Bank_01} or {@code HF_12}. The same seed and ranges always give the
 * same population.
 *
 * Balance sheet composition shares (fractions of size) are fixed here; the
 * behavioural parameters come from {@link PopulationRanges}.
 */
public class PopulationGenerator {

    private static final Logger log = LoggerFactory.getLogger(PopulationGenerator.class);

    private final long seed;
    private final PopulationRanges ranges;
    private final Random random;

    public PopulationGenerator(long seed, PopulationRanges ranges) {
        this.seed = seed;
        this.ranges = ranges;
        this.random = new Random(seed);
    }

    /**
     * Create a generator with default ranges.
     */
    public PopulationGenerator(long seed) {
        this(seed, PopulationRanges.DEFAULT);
    }

    /**
     * Reset the random generator to its initial seed.
     */
    public PopulationGenerator reset() {
        random.setSeed(seed);
        return this;
    }

    /**
     * Generate the full population.
     */
    public List<Agent> generate() {
        List<Agent> agents = new ArrayList<>();
        agents.addAll(generateBanks());
        agents.addAll(generateHedgeFunds());
        agents.addAll(generateLdiPensions());
        agents.addAll(generateInsurers());
        agents.addAll(generateFundComplexes());
        log.info("Generated population of {} agents (seed {}): {}", agents.size(), seed, ranges.getCounts());
        return agents;
    }

    // ========================================================================
    // Banks
    // ========================================================================

    public List<Agent> generateBanks() {
        List<Agent> banks = new ArrayList<>();
        for (int i = 1; i <= ranges.getCount(AgentType.BANK); i++) {
            double bs = sample(ranges.getSize(AgentType.BANK));
            double giltMarketMaking = sample(Parameter.BANK_GILT_MARKET_MAKING_MM);
            banks.add(new BankBehavior.Builder(id(AgentType.BANK, i))
                .theta(sample(ranges.getTheta(AgentType.BANK)))
                .bufferUsability(sample(ranges.getBufferUsability(AgentType.BANK)))
                .riskAppetite(sample(Parameter.BANK_RISK_APPETITE))
                .totalBalanceSheet(bs)
                .giltHoldings(bs * uniform(0.05, 0.12))
                .corporateBonds(bs * uniform(0.02, 0.06))
                .equityPortfolio(bs * 0.005)
                .repoLending(bs * uniform(0.05, 0.15))
                .derivativeAssets(bs * uniform(0.05, 0.10))
                .centralBankEligible(bs * uniform(0.10, 0.20))
                .wholesaleFunding(bs * uniform(0.05, 0.15))
                .cet1Buffer(bs * 0.5 * uniform(0.12, 0.18))
                .marketMakingCapacity(giltMarketMaking, giltMarketMaking * 0.3)
                .repoCapacity(bs * sample(Parameter.BANK_REPO_CAPACITY_PCT_OF_BS))
                .repoWillingness(sample(Parameter.BANK_REPO_WILLINGNESS_NEW), sample(Parameter.BANK_REPO_WILLINGNESS_ROLL))
                .build());
        }
        return banks;
    }

    // ========================================================================
    // Hedge Funds
    // ========================================================================

    public List<Agent> generateHedgeFunds() {
        int count = ranges.getCount(AgentType.HEDGE_FUND);
        List<HedgeFundStrategy> strategies = strategyMix(count);
        List<Agent> funds = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            HedgeFundStrategy strategy = strategies.get(i - 1);
            funds.add(new HedgeFundBehavior.Builder(id(AgentType.HEDGE_FUND, i), strategy)
                .theta(sample(ranges.getTheta(AgentType.HEDGE_FUND)))
                .bufferUsability(sample(ranges.getBufferUsability(AgentType.HEDGE_FUND)))
                .aum(sample(ranges.getSize(AgentType.HEDGE_FUND)))
                .leverage(uniform(strategy.getMinLeverage(), strategy.getMaxLeverage()))
                .varUtilisation(sample(Parameter.HEDGE_FUND_VAR_UTILISATION))
                .build());
        }
        return funds;
    }

    /**
     * Strategies in proportion to their population weights, shuffled.
     */
    private List<HedgeFundStrategy> strategyMix(int count) {
        List<HedgeFundStrategy> weighted = new ArrayList<>();
        for (HedgeFundStrategy s : HedgeFundStrategy.values()) {
            weighted.addAll(Collections.nCopies(s.getPopulationWeight(), s));
        }
        List<HedgeFundStrategy> mix = new ArrayList<>();
        while (mix.size() < count) {
            mix.addAll(weighted);
        }
        Collections.shuffle(mix, random);
        return mix.subList(0, count);
    }

    // ========================================================================
    // LDI / Pension Funds
    // ========================================================================

    public List<Agent> generateLdiPensions() {
        List<Agent> funds = new ArrayList<>();
        for (int i = 1; i <= ranges.getCount(AgentType.LDI_PENSION); i++) {
            double aum = sample(ranges.getSize(AgentType.LDI_PENSION));
            boolean pooled = random.nextDouble() < sample(Parameter.LDI_POOLED_SHARE);
            funds.add(new LdiPensionBehavior.Builder(id(AgentType.LDI_PENSION, i))
                .theta(sample(ranges.getTheta(AgentType.LDI_PENSION)))
                .bufferUsability(sample(ranges.getBufferUsability(AgentType.LDI_PENSION)))
                .giltHoldings(aum * uniform(0.40, 0.60))
                .ilGiltHoldings(aum * uniform(0.15, 0.30))
                .corporateBonds(aum * uniform(0.05, 0.15))
                .cash(aum * uniform(0.03, 0.08))
                .derivativesExposure(aum * uniform(1.5, 3.0))
                .unencumberedCollateral(aum * uniform(0.05, 0.15))
                .leverage(sample(Parameter.LDI_LEVERAGE))
                .yieldBufferBps(sample(Parameter.LDI_YIELD_BUFFER_BPS))
                .pooled(pooled)
                .recapitalisation(
                    aum * sample(Parameter.LDI_RECAP_AVAILABLE_PCT_OF_AUM),
                    ranges.get(Parameter.LDI_RECAP_SPEED_DAYS).sampleInt(random),
                    ranges.get(Parameter.LDI_TRUSTEE_LAG_DAYS).sampleInt(random))
                .build());
        }
        return funds;
    }

    // ========================================================================
    // Insurers
    // ========================================================================

    public List<Agent> generateInsurers() {
        List<Agent> insurers = new ArrayList<>();
        for (int i = 1; i <= ranges.getCount(AgentType.INSURER); i++) {
            double total = sample(ranges.getSize(AgentType.INSURER));
            insurers.add(new InsurerBehavior.Builder(id(AgentType.INSURER, i))
                .theta(sample(ranges.getTheta(AgentType.INSURER)))
                .bufferUsability(sample(ranges.getBufferUsability(AgentType.INSURER)))
                .giltHoldings(total * uniform(0.15, 0.30))
                .corporateBonds(total * uniform(0.30, 0.50))
                .equityPortfolio(total * uniform(0.05, 0.15))
                .derivativeHedges(total * uniform(0.3, 0.8))
                .cash(total * uniform(0.03, 0.08))
                .committedRepoLines(total * uniform(0.02, 0.05))
                .rcfAvailable(total * uniform(0.01, 0.03))
                .hedgeRatio(sample(Parameter.INSURER_HEDGE_RATIO))
                .dirtyCsaShare(sample(Parameter.INSURER_DIRTY_CSA))
                .build());
        }
        return insurers;
    }

    // ========================================================================
    // Fund Complexes
    // ========================================================================

    public List<Agent> generateFundComplexes() {
        List<Agent> funds = new ArrayList<>();
        for (int i = 1; i <= ranges.getCount(AgentType.FUND_COMPLEX); i++) {
            double aum = sample(ranges.getSize(AgentType.FUND_COMPLEX));
            double cash = aum * sample(Parameter.FUND_CASH_BUFFER_PCT);
            double invested = aum - cash;
            double giltShare = uniform(0.20, 0.50);
            double corpShare = uniform(0.30, 0.50);
            funds.add(new FundComplexBehavior.Builder(id(AgentType.FUND_COMPLEX, i))
                .theta(sample(ranges.getTheta(AgentType.FUND_COMPLEX)))
                .bufferUsability(sample(ranges.getBufferUsability(AgentType.FUND_COMPLEX)))
                .cash(cash)
                .giltHoldings(invested * giltShare)
                .corporateBonds(invested * corpShare)
                .absHoldings(invested * Math.max(0.0, 1.0 - giltShare - corpShare))
                .investorShares(sample(Parameter.FUND_PENSION_INVESTOR_SHARE),
                    sample(Parameter.FUND_INSURER_INVESTOR_SHARE))
                .build());
        }
        return funds;
    }

    // ========================================================================
    // Sampling
    // ========================================================================

    private static String id(AgentType type, int index) {
        return String.format("%s_%02d", type.getIdPrefix(), index);
    }

    private double sample(ParameterRange range) {
        return range.sample(random);
    }

    private double sample(Parameter parameter) {
        return ranges.get(parameter).sample(random);
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }
}
