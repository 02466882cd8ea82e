package com.tartaritech.profit_dashboard.services;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.tartaritech.profit_dashboard.dtos.MonthlySummaryDTO;
import com.tartaritech.profit_dashboard.dtos.ProjectionRowDTO;
import com.tartaritech.profit_dashboard.dtos.ProjectionStateDTO;
import com.tartaritech.profit_dashboard.enums.MetricSource;

@DisplayName("ProjectionEngine Unit Tests")
class ProjectionEngineTest {

    private static final YearMonth CURRENT = YearMonth.of(2024, 3);
    private static final List<BigDecimal> PRESETS = List.of(
            BigDecimal.valueOf(2), BigDecimal.valueOf(3), BigDecimal.valueOf(6), BigDecimal.ONE, BigDecimal.ZERO);

    private ProjectionEngine engine;

    @BeforeEach
    void setup() {
        engine = new ProjectionEngine(PRESETS, 5);
    }

    private static MonthlySummaryDTO month(String month, String revenue, String adSpend, String cogs, String shippingCost) {
        MonthlySummaryDTO summary = new MonthlySummaryDTO();
        summary.setMonth(month);
        summary.setRevenue(new BigDecimal(revenue));
        summary.setAdSpend(new BigDecimal(adSpend));
        summary.setCogs(new BigDecimal(cogs));
        summary.setShippingCost(new BigDecimal(shippingCost));
        if (new BigDecimal(revenue).signum() > 0) {
            summary.getSources().add(MetricSource.SHOPIFY);
        }
        return summary;
    }

    private List<MonthlySummaryDTO> history() {
        return List.of(
                month("2024-01", "800.00", "100.00", "200.00", "50.00"),
                month("2024-02", "1000.00", "200.00", "300.00", "100.00"),
                month("2024-03", "500.00", "90.00", "120.00", "40.00"));
    }

    @Nested
    @DisplayName("initProjection")
    class InitTests {

        @Test
        @DisplayName("Should default the base to the last completed month with data")
        void shouldDefaultBaseMonth() {
            engine.initProjection(history(), CURRENT, 10);

            ProjectionStateDTO state = engine.getState();
            assertEquals(1, state.getBaseMonthIndex());
            assertEquals("2024-02", state.getBaseMonth());
        }

        @Test
        @DisplayName("Should build the current row and five preset rows")
        void shouldBuildRows() {
            List<ProjectionRowDTO> rows = engine.initProjection(history(), CURRENT, 10);

            assertEquals(6, rows.size());
            assertTrue(rows.get(0).isCurrentMonth());
            assertEquals(List.of("2024-03", "2024-04", "2024-05", "2024-06", "2024-07", "2024-08"),
                    rows.stream().map(ProjectionRowDTO::getMonth).collect(Collectors.toList()));
            assertEquals(0, rows.get(1).getMultiplier().compareTo(BigDecimal.valueOf(2)));
            assertEquals(0, rows.get(3).getMultiplier().compareTo(BigDecimal.valueOf(6)));
            assertEquals(0, rows.get(5).getMultiplier().signum());
        }

        @Test
        @DisplayName("Should extrapolate the current month against the base")
        void shouldExtrapolateCurrentMonth() {
            // 500 over 10 of 31 days -> 1550 against a 1000 base
            List<ProjectionRowDTO> rows = engine.initProjection(history(), CURRENT, 10);

            assertEquals(new BigDecimal("1.55"), rows.get(0).getMultiplier());
            assertEquals(new BigDecimal("1550.00"), rows.get(0).getProjectedRevenue());
        }

        @Test
        @DisplayName("Should use 1.00 for the current row when the base has no revenue")
        void shouldUseNeutralMultiplierWithoutBaseRevenue() {
            List<MonthlySummaryDTO> empty = List.of(
                    month("2024-02", "0.00", "0.00", "0.00", "0.00"),
                    month("2024-03", "0.00", "0.00", "0.00", "0.00"));

            List<ProjectionRowDTO> rows = engine.initProjection(empty, CURRENT, 10);

            assertEquals(0, engine.getBaseMonthIndex());
            assertEquals(new BigDecimal("1.00"), rows.get(0).getMultiplier());
        }
    }

    @Nested
    @DisplayName("Recompute")
    class RecomputeTests {

        @BeforeEach
        void init() {
            engine.initProjection(history(), CURRENT, 10);
        }

        @Test
        @DisplayName("Should scale revenue and expenses by the multiplier")
        void shouldScaleByMultiplier() {
            List<ProjectionRowDTO> rows = engine.setMultiplier(1, 2.0);

            ProjectionRowDTO row = rows.get(1);
            assertEquals(new BigDecimal("2000.00"), row.getProjectedRevenue());
            assertEquals(new BigDecimal("400.00"), row.getProjectedAdSpend());
            assertEquals(new BigDecimal("1200.00"), row.getProjectedExpenses());
            assertEquals(new BigDecimal("800.00"), row.getProjectedProfit());
        }

        @Test
        @DisplayName("A zero multiplier zeroes revenue, expenses and profit")
        void shouldZeroEverything() {
            ProjectionRowDTO row = engine.setMultiplier(1, 0.0).get(1);

            assertEquals(0, row.getProjectedRevenue().signum());
            assertEquals(0, row.getProjectedExpenses().signum());
            assertEquals(row.getProjectedExpenses().negate(), row.getProjectedProfit());
        }

        @Test
        @DisplayName("Changing the base month recomputes every row")
        void shouldRecomputeOnBaseChange() {
            List<ProjectionRowDTO> rows = engine.setBaseMonth(0);

            // preset 2 on a January base of 800
            assertEquals(new BigDecimal("1600.00"), rows.get(1).getProjectedRevenue());
            assertEquals(new BigDecimal("800.00"), engine.getState().getBaseRevenue());
        }

        @Test
        @DisplayName("State totals add up the rows")
        void shouldTotalRows() {
            ProjectionStateDTO state = engine.getState();

            BigDecimal revenue = state.getRows().stream()
                    .map(ProjectionRowDTO::getProjectedRevenue)
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(revenue, state.getTotalProjectedRevenue());
            assertEquals(List.of("2024-01", "2024-02", "2024-03"), state.getAvailableMonths());
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @BeforeEach
        void init() {
            engine.initProjection(history(), CURRENT, 10);
        }

        @Test
        @DisplayName("Should reject an out of range base month")
        void shouldRejectBadBaseIndex() {
            assertThrows(IllegalArgumentException.class, () -> engine.setBaseMonth(3));
            assertThrows(IllegalArgumentException.class, () -> engine.setBaseMonth(-1));
            assertEquals(1, engine.getBaseMonthIndex());
        }

        @Test
        @DisplayName("Should reject negative and non-finite multipliers")
        void shouldRejectBadMultipliers() {
            assertThrows(IllegalArgumentException.class, () -> engine.setMultiplier(1, -0.5));
            assertThrows(IllegalArgumentException.class, () -> engine.setMultiplier(1, Double.NaN));
            assertThrows(IllegalArgumentException.class, () -> engine.setMultiplier(1, Double.POSITIVE_INFINITY));
            assertThrows(IllegalArgumentException.class, () -> engine.setMultiplier(6, 1.0));
        }

        @Test
        @DisplayName("Should reject zero elapsed days")
        void shouldRejectZeroDaysElapsed() {
            assertThrows(IllegalArgumentException.class, () -> new ProjectionEngine(PRESETS, 5).initProjection(history(), CURRENT, 0));
        }
    }

    @Test
    @DisplayName("Should survive session serialization with its multipliers intact")
    void shouldSerializeForSessionStorage() throws Exception {
        engine.initProjection(history(), CURRENT, 10);
        engine.setMultiplier(1, 2.5);

        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(engine);
        }
        ProjectionEngine restored;
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            restored = (ProjectionEngine) in.readObject();
        }

        ProjectionStateDTO state = restored.getState();
        assertEquals(1, state.getBaseMonthIndex());
        assertEquals(new BigDecimal("2500.00"), state.getRows().get(1).getProjectedRevenue());
        restored.setBaseMonth(0);
        assertEquals(new BigDecimal("2000.00"), restored.getState().getRows().get(1).getProjectedRevenue());
    }
}
