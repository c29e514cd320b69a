package com.polkadot.analytics.engine.insight;

import com.polkadot.analytics.config.AnalyticsConfig;
import com.polkadot.analytics.model.MetricTable;
import com.polkadot.analytics.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

import static org.assertj.core.api.Assertions.assertThat;

class InsightRulesTest {

    private static final int DAYS = 30;

    private final AnalyticsConfig config = TestDataFactory.config();

    private static MetricTable table(String entityId, IntToDoubleFunction tvl,
                                     IntToDoubleFunction transactions, IntToDoubleFunction users) {
        Map<String, IntToDoubleFunction> columns = new LinkedHashMap<>();
        columns.put("tvl", tvl);
        columns.put("transactions", transactions);
        columns.put("users", users);
        return TestDataFactory.metricTable(entityId, DAYS, columns);
    }

    private static MetricTable tvlOnly(IntToDoubleFunction tvl) {
        return TestDataFactory.metricTable("2004", DAYS, Map.of("tvl", tvl));
    }

    private static DayOfWeek dayOf(int i) {
        return TestDataFactory.TODAY.minus(Duration.ofDays(DAYS - 1L - i)).atZone(ZoneOffset.UTC).getDayOfWeek();
    }

    @Test
    void trend_reportsHalfOverHalfChangeAboveFivePercent() {
        List<String> up = new TrendInsightRule(config).evaluate(tvlOnly(i -> i < 15 ? 100 : 120));
        List<String> down = new TrendInsightRule(config).evaluate(tvlOnly(i -> i < 15 ? 100 : 80));

        assertThat(up).containsExactly(
                "TVL has increased by 20.0% over the past 30 days, indicating growth momentum.");
        assertThat(down).containsExactly(
                "TVL has decreased by 20.0% over the past 30 days, indicating decline momentum.");
    }

    @Test
    void trend_ignoresSmallChangesAndShortColumns() {
        TrendInsightRule rule = new TrendInsightRule(config);
        assertThat(rule.evaluate(tvlOnly(i -> i < 15 ? 100 : 104))).isEmpty();

        MetricTable sparse = tvlOnly(i -> i < 25 ? Double.NaN : i * 10.0);
        assertThat(rule.evaluate(sparse)).isEmpty();
    }

    @Test
    void volatility_reportsHighAndLowCoefficientOfVariation() {
        VolatilityInsightRule rule = new VolatilityInsightRule(config);

        List<String> volatile_ = rule.evaluate(tvlOnly(i -> i % 2 == 0 ? 10 : 100));
        List<String> stable = rule.evaluate(tvlOnly(i -> i % 2 == 0 ? 99 : 101));

        assertThat(volatile_).singleElement().asString()
                .startsWith("TVL shows high volatility (")
                .endsWith("coefficient of variation), suggesting unstable market conditions.");
        assertThat(stable).singleElement().asString()
                .startsWith("TVL is relatively stable (1.0% coefficient of variation)");
    }

    @Test
    void volatility_skipsSeriesWithoutSpread() {
        assertThat(new VolatilityInsightRule(config).evaluate(tvlOnly(i -> 500))).isEmpty();
    }

    @Test
    void weeklyPattern_namesPeakWeekday() {
        MetricTable weekly = tvlOnly(i -> (dayOf(i) == DayOfWeek.SATURDAY ? 200 : 100) + i % 3);

        List<String> insights = new WeeklyPatternInsightRule(config).evaluate(weekly);

        assertThat(insights).containsExactly("TVL shows a weekly pattern with peak activity typically on Saturdays.");
    }

    @Test
    void weeklyPattern_silentForFlatOrPatternlessSeries() {
        WeeklyPatternInsightRule rule = new WeeklyPatternInsightRule(config);
        assertThat(rule.evaluate(tvlOnly(i -> 100))).isEmpty();
        // an alternating series lands on every weekday in roughly equal measure
        assertThat(rule.evaluate(tvlOnly(i -> 100 + i % 2))).isEmpty();
    }

    @Test
    void health_strongWhenAllIndicatorsPositive() {
        MetricTable healthy = table("2004", i -> 100 + 2 * i, i -> 1000 + i % 5, i -> 50 + i);

        assertThat(new HealthInsightRule(config).evaluate(healthy)).containsExactly(
                "Parachain 2004 shows strong overall health with 100% of indicators trending positively.");
    }

    @Test
    void health_attentionWhenIndicatorsNegative() {
        MetricTable ailing = table("2004", i -> 200 - i, i -> i % 2 == 0 ? 0 : 2000, i -> 100 - i);

        assertThat(new HealthInsightRule(config).evaluate(ailing)).containsExactly(
                "Parachain 2004 requires attention with only 0% of health indicators showing positive trends.");
    }

    @Test
    void health_skipsAggregateTables() {
        MetricTable aggregate = table(null, i -> 100 + 2 * i, i -> 1000, i -> 50 + i);
        assertThat(new HealthInsightRule(config).evaluate(aggregate)).isEmpty();
    }
}
