package org.carma.liquidity.model;

/**
 * Per-day liquidity buffers and loss magnitudes of one agent.
 *
 * <ul>
 *   <li>B0: buffer at day start</li>
 *   <li>B1: after the exogenous shock (B0 - E1)</li>
 *   <li>B2: after the agent's own reactions</li>
 *   <li>B3: after systemic feedback (B2 - E2)</li>
 * </ul>
 *
 * E1 is kept split into the direct part (mark-to-market, margin, own outflows)
 * and the part routed to the agent through the network (redemptions received).
 */
public class LiquidityPosition {

    private double b0;
    private double b1;
    private double b2;
    private double b3;
    private double e1;
    private double e1Direct;
    private double e2;

    /**
     * Start a new day from a freshly computed B0. Everything else is cleared.
     */
    public void startDay(double initialBuffer) {
        this.b0 = initialBuffer;
        this.b1 = initialBuffer;
        this.b2 = initialBuffer;
        this.b3 = initialBuffer;
        this.e1 = 0.0;
        this.e1Direct = 0.0;
        this.e2 = 0.0;
    }

    /**
     * Direct stress ratio E1(direct) / B0.
     */
    public double directStressRatio() {
        return b0 > 0 ? e1Direct / b0 : 0.0;
    }

    /**
     * Stress ratio E1 / B0.
     */
    public double stressRatio() {
        return b0 > 0 ? e1 / b0 : 0.0;
    }

    public double getB0() { return b0; }
    public double getB1() { return b1; }
    public double getB2() { return b2; }
    public double getB3() { return b3; }
    public double getE1() { return e1; }
    public double getE1Direct() { return e1Direct; }
    public double getE2() { return e2; }

    public void setB0(double b0) { this.b0 = b0; }
    public void setB1(double b1) { this.b1 = b1; }
    public void setB2(double b2) { this.b2 = b2; }
    public void setB3(double b3) { this.b3 = b3; }
    public void setE1(double e1) { this.e1 = e1; }
    public void setE1Direct(double e1Direct) { this.e1Direct = e1Direct; }
    public void setE2(double e2) { this.e2 = e2; }

    @Override
    public String toString() {
        return String.format("Liquidity[B0=%.2f, B1=%.2f, B2=%.2f, B3=%.2f, E1=%.2f, E2=%.2f]",
            b0, b1, b2, b3, e1, e2);
    }
}
