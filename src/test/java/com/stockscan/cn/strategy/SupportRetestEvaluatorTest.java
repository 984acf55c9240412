package com.stockscan.cn.strategy;

import com.stockscan.cn.model.BarDaily;
import com.stockscan.cn.model.BarFixtures;
import com.stockscan.cn.model.BarSeries;
import com.stockscan.cn.model.ExclusionReason;
import com.stockscan.cn.model.InstrumentIdentity;
import com.stockscan.cn.model.InstrumentScanResult;
import com.stockscan.cn.model.ProfileType;
import com.stockscan.cn.model.SignalTier;
import com.stockscan.cn.model.Verdict;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SupportRetestEvaluatorTest {

    private static final InstrumentIdentity ID = new InstrumentIdentity("600000", "浦发银行");

    private final InstrumentScreener screener = new InstrumentScreener(ProfileSupport.supportRetest());

    @Test
    void sampleScenario_shouldEmitVerdictAtLaunchDayOpen() {
        InstrumentScanResult result = screen(BarFixtures.supportRetest("600000"));

        assertTrue(result.isMatched());
        Verdict verdict = result.verdict;
        assertEquals(ProfileType.SUPPORT_RETEST, verdict.profile);
        assertEquals(10.00, verdict.referencePrice, 1e-9);
        assertEquals(100_000.0, verdict.referenceVolume, 1e-9);
        assertEquals(10.05, verdict.latestClose, 1e-9);
        assertEquals(0.005, (double) verdict.metrics.get("support_proximity"), 1e-9);
        assertEquals(0.4, (double) verdict.metrics.get("volume_ratio"), 1e-9);
        assertTrue(verdict.score >= 70);
        assertEquals("浦发银行", verdict.name);
    }

    @Test
    void closeAboveSmaWithoutReexpansion_shouldScoreNinety() {
        Verdict verdict = screen(BarFixtures.supportRetest("600000")).verdict;

        assertEquals(90, verdict.score);
        assertEquals(SignalTier.FOCUS, verdict.tier);
        assertEquals("重点关注 (半仓进攻)", verdict.adviceOrEmpty());
    }

    @Test
    void baseConditionsOnly_shouldScoreExactlySeventy() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        for (int i = 25; i < 29; i++) {
            BarFixtures.setClose(bars, i, 10.20);
        }

        Verdict verdict = screen(bars).verdict;

        assertNotNull(verdict);
        assertEquals(70, verdict.score);
        assertEquals(SignalTier.PROBE, verdict.tier);
    }

    @Test
    void smaAndReexpansionBonuses_shouldScoreOneHundred() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.setVolume(bars, 28, 30_000);

        Verdict verdict = screen(bars).verdict;

        assertEquals(100, verdict.score);
        assertEquals(SignalTier.CONVICTION, verdict.tier);
        assertEquals("一击必中 (核心重仓)", verdict.adviceOrEmpty());
    }

    @Test
    void reexpansionBelowSma_shouldAddOnlyTheVolumeBonus() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        for (int i = 25; i < 29; i++) {
            BarFixtures.setClose(bars, i, 10.20);
        }
        BarFixtures.setVolume(bars, 28, 30_000);

        Verdict verdict = screen(bars).verdict;

        assertEquals(80, verdict.score);
        assertEquals(SignalTier.CONVICTION, verdict.tier);
    }

    @Test
    void proximityAboveThreePercent_shouldNeverEmitRegardlessOfVolume() {
        for (double volume : new double[]{0.0, 1_000.0, 40_000.0, 49_999.0}) {
            List<BarDaily> bars = BarFixtures.supportRetest("600000");
            BarFixtures.set(bars, 29, 10.00, 10.31, volume);

            InstrumentScanResult result = screen(bars);

            assertFalse(result.isMatched());
            assertEquals(ExclusionReason.NOT_AT_SUPPORT, result.reason);
        }
    }

    @Test
    void volumeRatioAtHalf_shouldBeExcluded() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.setVolume(bars, 29, 50_000);

        InstrumentScanResult result = screen(bars);

        assertEquals(ExclusionReason.VOLUME_NOT_SHRUNK, result.reason);
        assertNull(result.verdict);
    }

    @Test
    void supportPrice_shouldBeRoundedToTwoDecimals() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.set(bars, 19, 10.0049, 9.95, 100_000);

        Verdict verdict = screen(bars).verdict;

        assertEquals(10.00, verdict.referencePrice, 1e-9);
    }

    @Test
    void supportPriceTie_shouldRoundToEvenDigit() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.set(bars, 19, 10.125, 9.95, 100_000);

        Verdict verdict = screen(bars).verdict;

        assertEquals(10.12, verdict.referencePrice, 1e-9);
        assertEquals(2.67, SupportRetestEvaluator.round2(2.675), 1e-9);
        assertEquals(10.04, SupportRetestEvaluator.round2(10.035), 1e-9);
    }

    @Test
    void missingValueBeforeTheWindow_shouldNotBlockVerdict() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.setVolume(bars, 0, Double.NaN);

        InstrumentScanResult result = screen(bars);

        assertTrue(result.isMatched());
        assertEquals(90, result.verdict.score);
    }

    @Test
    void missingValueInsideTheWindow_shouldExcludeInstrument() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.setVolume(bars, 15, Double.NaN);

        assertEquals(ExclusionReason.MISSING_FIELD, screen(bars).reason);
    }

    @Test
    void zeroSupportPrice_shouldFailInsteadOfThrowing() {
        List<BarDaily> bars = BarFixtures.supportRetest("600000");
        BarFixtures.set(bars, 19, 0.0, 9.95, 100_000);

        InstrumentScanResult result = screen(bars);

        assertEquals(InstrumentScanResult.Status.FAILED, result.status);
        assertEquals(ExclusionReason.MALFORMED_RECORD, result.reason);
        assertTrue(result.error.contains("support"));
    }

    @Test
    void screeningTwice_shouldYieldIdenticalVerdicts() {
        BarSeries series = new BarSeries("600000", BarFixtures.supportRetest("600000"));

        Verdict first = screener.screen(ID, series).verdict;
        Verdict second = screener.screen(ID, series).verdict;

        assertEquals(first, second);
    }

    @Test
    void growthBoardCode_shouldNeverProduceVerdict() {
        InstrumentScanResult result = screener.screen(
                new InstrumentIdentity("300001", "特锐德"),
                new BarSeries("300001", BarFixtures.supportRetest("300001"))
        );

        assertEquals(ExclusionReason.CODE_PREFIX_EXCLUDED, result.reason);
    }

    private InstrumentScanResult screen(List<BarDaily> bars) {
        return screener.screen(ID, new BarSeries("600000", bars));
    }
}
