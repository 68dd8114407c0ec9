package com.trade.paper.risk;

import com.trade.paper.core.PositionSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RiskCalculator 单元测试
 */
class RiskCalculatorTest {

    private static final BigDecimal BUFFER = new BigDecimal("0.9");

    @Test
    void testMarginRequired() {
        BigDecimal margin = RiskCalculator.marginRequired(new BigDecimal("0.5"), new BigDecimal("95000"), 20);
        assertEquals(0, new BigDecimal("2375").compareTo(margin));
        assertEquals(8, margin.scale());
    }

    @Test
    void testMarginRequired_nonTerminatingDivision() {
        BigDecimal margin = RiskCalculator.marginRequired(BigDecimal.ONE, new BigDecimal("100"), 3);
        assertEquals(new BigDecimal("33.33333333"), margin);
    }

    @Test
    void testMarginRequired_customScale() {
        BigDecimal margin = RiskCalculator.marginRequired(BigDecimal.ONE, new BigDecimal("100"), 3, 2);
        assertEquals(new BigDecimal("33.33"), margin);
    }

    @Test
    void testLiquidationPrice_customScale() {
        BigDecimal price = RiskCalculator.liquidationPrice(PositionSide.LONG, new BigDecimal("100"), 7, BUFFER, 2);
        // 100 - 100 * 0.9 / 7 = 87.142857...
        assertEquals(new BigDecimal("87.14"), price);
    }

    @Test
    void testLiquidationPrice_long() {
        BigDecimal price = RiskCalculator.liquidationPrice(PositionSide.LONG, new BigDecimal("95000"), 20, BUFFER);
        assertEquals(new BigDecimal("90725.00000000"), price);
    }

    @Test
    void testLiquidationPrice_short() {
        BigDecimal price = RiskCalculator.liquidationPrice(PositionSide.SHORT, new BigDecimal("95000"), 20, BUFFER);
        assertEquals(0, new BigDecimal("99275").compareTo(price));
    }

    @Test
    void testLiquidationPrice_invalidLeverage() {
        assertThrows(IllegalArgumentException.class,
                () -> RiskCalculator.liquidationPrice(PositionSide.LONG, new BigDecimal("95000"), 0, BUFFER));
    }

    @Test
    void testUnrealizedPnl() {
        BigDecimal qty = new BigDecimal("0.5");
        BigDecimal entry = new BigDecimal("95000");
        BigDecimal mark = new BigDecimal("96000");

        assertEquals(0, new BigDecimal("500").compareTo(
                RiskCalculator.unrealizedPnl(PositionSide.LONG, qty, entry, mark)));
        assertEquals(0, new BigDecimal("-500").compareTo(
                RiskCalculator.unrealizedPnl(PositionSide.SHORT, qty, entry, mark)));
    }

    @Test
    void testRoe() {
        assertEquals(new BigDecimal("20.24"), RiskCalculator.roe(new BigDecimal("480.8"), new BigDecimal("2375")));
        assertEquals(0, BigDecimal.ZERO.compareTo(RiskCalculator.roe(new BigDecimal("100"), BigDecimal.ZERO)));
    }

    @Test
    void testCommission_roundsDown() {
        BigDecimal fee = RiskCalculator.commission(new BigDecimal("0.001"), new BigDecimal("95123.45"),
                new BigDecimal("0.0004"), 2);
        assertEquals(new BigDecimal("0.03"), fee);

        BigDecimal taker = RiskCalculator.commission(new BigDecimal("0.5"), new BigDecimal("95000"),
                new BigDecimal("0.0004"));
        assertEquals(0, new BigDecimal("19").compareTo(taker));
    }

    @Test
    void testIsLiquidationRisk() {
        BigDecimal qty = BigDecimal.ONE;
        BigDecimal entry = new BigDecimal("50000");
        BigDecimal margin = new BigDecimal("5000");

        assertTrue(RiskCalculator.isLiquidationRisk(PositionSide.LONG, qty, entry, margin, new BigDecimal("44000")));
        assertFalse(RiskCalculator.isLiquidationRisk(PositionSide.LONG, qty, entry, margin, new BigDecimal("48000")));
        assertTrue(RiskCalculator.isLiquidationRisk(PositionSide.SHORT, qty, entry, margin, new BigDecimal("55000")));
    }

    @Test
    void testRiskLevel() {
        BigDecimal qty = BigDecimal.ONE;
        BigDecimal entry = new BigDecimal("50000");
        BigDecimal margin = new BigDecimal("5000");

        assertEquals(LiquidationRiskLevel.SAFE,
                RiskCalculator.riskLevel(PositionSide.LONG, qty, entry, margin, new BigDecimal("48000")));
        assertEquals(LiquidationRiskLevel.WARNING,
                RiskCalculator.riskLevel(PositionSide.LONG, qty, entry, margin, new BigDecimal("47000")));
        assertEquals(LiquidationRiskLevel.DANGER,
                RiskCalculator.riskLevel(PositionSide.LONG, qty, entry, margin, new BigDecimal("46000")));
        assertEquals(LiquidationRiskLevel.DANGER,
                RiskCalculator.riskLevel(PositionSide.LONG, qty, entry, BigDecimal.ZERO, entry));
    }

    @Test
    void testIsLiquidated() {
        BigDecimal liq = new BigDecimal("90725");

        assertTrue(RiskCalculator.isLiquidated(PositionSide.LONG, liq, new BigDecimal("90725")));
        assertFalse(RiskCalculator.isLiquidated(PositionSide.LONG, liq, new BigDecimal("90726")));
        assertTrue(RiskCalculator.isLiquidated(PositionSide.SHORT, new BigDecimal("99275"), new BigDecimal("99300")));
    }
}
