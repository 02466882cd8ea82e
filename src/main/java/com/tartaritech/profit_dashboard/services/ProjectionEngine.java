package com.tartaritech.profit_dashboard.services;

import java.io.Serializable;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.tartaritech.profit_dashboard.dtos.MonthlySummaryDTO;
import com.tartaritech.profit_dashboard.dtos.ProjectionRowDTO;
import com.tartaritech.profit_dashboard.dtos.ProjectionStateDTO;

/**
 * What-if projection of the coming months. Every projected value is the base month's actual
 * value times the row multiplier, and every change recomputes all rows.
 *
 * <p>One instance per dashboard session; not thread-safe.
 */
public class ProjectionEngine implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final DateTimeFormatter OUTPUT_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM");

    private final List<BigDecimal> presetMultipliers;
    private final int futureMonths;

    private final List<MonthActuals> months = new ArrayList<>();
    private final List<Row> rows = new ArrayList<>();
    private int baseMonthIndex = -1;
    private List<ProjectionRowDTO> projected = new ArrayList<>();

    public ProjectionEngine(List<BigDecimal> presetMultipliers, int futureMonths) {
        if (futureMonths < 0) {
            throw new IllegalArgumentException("Future months cannot be negative");
        }
        this.presetMultipliers = new ArrayList<>(presetMultipliers);
        this.futureMonths = futureMonths;
    }

    /**
     * Loads the actuals and builds the current month row plus the future rows.
     *
     * @param allMonths   monthly summaries, oldest first
     * @param currentMonth the month in progress
     * @param daysElapsed days of the current month elapsed so far, at least 1
     */
    public List<ProjectionRowDTO> initProjection(List<MonthlySummaryDTO> allMonths, YearMonth currentMonth, int daysElapsed) {
        if (daysElapsed < 1) {
            throw new IllegalArgumentException("Days elapsed must be at least 1");
        }

        months.clear();
        rows.clear();
        allMonths.forEach(m -> months.add(new MonthActuals(m)));

        String current = currentMonth.format(OUTPUT_FORMATTER);
        baseMonthIndex = defaultBaseIndex(current);

        BigDecimal currentRevenue = months.stream()
                .filter(m -> m.month.equals(current))
                .map(m -> m.totalRevenue)
                .findFirst()
                .orElse(BigDecimal.ZERO);
        BigDecimal extrapolated = currentRevenue
                .multiply(BigDecimal.valueOf(currentMonth.lengthOfMonth()))
                .divide(BigDecimal.valueOf(daysElapsed), 4, RoundingMode.HALF_UP);

        BigDecimal baseRevenue = baseRevenue();
        BigDecimal currentMultiplier = baseRevenue.signum() == 0
                ? BigDecimal.ONE.setScale(2)
                : extrapolated.divide(baseRevenue, 2, RoundingMode.HALF_UP);

        rows.add(new Row(current, currentMultiplier, true));
        for (int i = 1; i <= futureMonths; i++) {
            BigDecimal preset = i - 1 < presetMultipliers.size() ? presetMultipliers.get(i - 1) : BigDecimal.ONE;
            rows.add(new Row(currentMonth.plusMonths(i).format(OUTPUT_FORMATTER), preset, false));
        }

        return recompute();
    }

    public List<ProjectionRowDTO> setBaseMonth(int index) {
        if (index < 0 || index >= months.size()) {
            throw new IllegalArgumentException("Base month index out of range: " + index
                    + " (available months: " + months.size() + ")");
        }
        baseMonthIndex = index;
        return recompute();
    }

    public List<ProjectionRowDTO> setMultiplier(int rowIndex, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Multiplier must be a finite number");
        }
        return setMultiplier(rowIndex, BigDecimal.valueOf(value));
    }

    public List<ProjectionRowDTO> setMultiplier(int rowIndex, BigDecimal value) {
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            throw new IllegalArgumentException("Projection row index out of range: " + rowIndex);
        }
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException("Multiplier cannot be negative");
        }
        rows.get(rowIndex).multiplier = value;
        return recompute();
    }

    public List<ProjectionRowDTO> recompute() {
        MonthActuals base = baseMonthIndex >= 0 ? months.get(baseMonthIndex) : MonthActuals.EMPTY;

        projected = rows.stream().map(row -> {
            BigDecimal revenue = scale(base.totalRevenue.multiply(row.multiplier));
            BigDecimal adSpend = scale(base.adSpend.multiply(row.multiplier));
            BigDecimal cogs = scale(base.cogs.multiply(row.multiplier));
            BigDecimal shippingCost = scale(base.shippingCost.multiply(row.multiplier));
            BigDecimal expenses = adSpend.add(cogs).add(shippingCost);
            return new ProjectionRowDTO(row.month, row.multiplier, row.currentMonth,
                    revenue, adSpend, cogs, shippingCost, expenses, revenue.subtract(expenses));
        }).collect(Collectors.toList());

        return projected;
    }

    public ProjectionStateDTO getState() {
        ProjectionStateDTO state = new ProjectionStateDTO();
        state.setBaseMonthIndex(baseMonthIndex);
        state.setBaseMonth(baseMonthIndex >= 0 ? months.get(baseMonthIndex).month : null);
        state.setBaseRevenue(baseRevenue());
        state.setAvailableMonths(months.stream().map(m -> m.month).collect(Collectors.toList()));
        state.setRows(new ArrayList<>(projected));
        for (ProjectionRowDTO row : projected) {
            state.setTotalProjectedRevenue(state.getTotalProjectedRevenue().add(row.getProjectedRevenue()));
            state.setTotalProjectedExpenses(state.getTotalProjectedExpenses().add(row.getProjectedExpenses()));
            state.setTotalProjectedProfit(state.getTotalProjectedProfit().add(row.getProjectedProfit()));
        }
        return state;
    }

    public int getBaseMonthIndex() {
        return baseMonthIndex;
    }

    // latest month before the current one with any data
    private int defaultBaseIndex(String currentMonth) {
        if (months.isEmpty()) {
            return -1;
        }
        for (int i = months.size() - 1; i >= 0; i--) {
            MonthActuals m = months.get(i);
            if (m.hasData && m.month.compareTo(currentMonth) < 0) {
                return i;
            }
        }
        return 0;
    }

    private BigDecimal baseRevenue() {
        return baseMonthIndex >= 0 ? months.get(baseMonthIndex).totalRevenue : BigDecimal.ZERO;
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }

    private static final class MonthActuals implements Serializable {
        private static final long serialVersionUID = 1L;
        private static final MonthActuals EMPTY = new MonthActuals(null, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, false);

        private final String month;
        private final BigDecimal totalRevenue;
        private final BigDecimal adSpend;
        private final BigDecimal cogs;
        private final BigDecimal shippingCost;
        private final boolean hasData;

        private MonthActuals(String month, BigDecimal totalRevenue, BigDecimal adSpend, BigDecimal cogs,
                             BigDecimal shippingCost, boolean hasData) {
            this.month = month;
            this.totalRevenue = totalRevenue;
            this.adSpend = adSpend;
            this.cogs = cogs;
            this.shippingCost = shippingCost;
            this.hasData = hasData;
        }

        private MonthActuals(MonthlySummaryDTO summary) {
            this(summary.getMonth(),
                    summary.getRevenue().add(summary.getShippingRevenue()),
                    summary.getAdSpend(),
                    summary.getCogs(),
                    summary.getShippingCost(),
                    summary.hasData());
        }
    }

    private static final class Row implements Serializable {
        private static final long serialVersionUID = 1L;

        private final String month;
        private BigDecimal multiplier;
        private final boolean currentMonth;

        private Row(String month, BigDecimal multiplier, boolean currentMonth) {
            this.month = month;
            this.multiplier = multiplier;
            this.currentMonth = currentMonth;
        }
    }
}
