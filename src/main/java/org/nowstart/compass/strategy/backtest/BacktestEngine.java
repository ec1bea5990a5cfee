package org.nowstart.compass.strategy.backtest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableSet;
import java.util.SplittableRandom;
import java.util.TreeMap;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import org.nowstart.compass.data.exception.DataInsufficientException;
import org.nowstart.compass.data.property.BacktestProperties;
import org.nowstart.compass.strategy.core.Allocation;
import org.nowstart.compass.strategy.core.BacktestMetrics;
import org.nowstart.compass.strategy.core.BacktestReport;
import org.nowstart.compass.strategy.core.ExplainabilityTrace;
import org.nowstart.compass.strategy.core.HypothesisBody;
import org.nowstart.compass.strategy.core.MarketSnapshot;
import org.nowstart.compass.strategy.core.PriceBar;
import org.nowstart.compass.strategy.core.ScoredSignal;
import org.nowstart.compass.strategy.core.TraceEntry;
import org.springframework.stereotype.Component;

/**
 * Deterministic backtest of a hypothesis against the price history in a market snapshot.
 *
 * <p>The portfolio is rebalanced to the target weights every bar; unallocated weight is cash and
 * earns nothing. Only bars at which every allocated symbol (and the benchmark, when present) has a
 * close are used, and only the most recent {@link #requiredBars} of them. The only stochastic step
 * is the bootstrap of the expected return interval, which is driven by the seed passed in and
 * recorded in the result.
 */
@Component
@RequiredArgsConstructor
public class BacktestEngine {

    private static final double MAX_CONFIDENCE = 0.95;
    private static final double DEFAULT_SIGNAL_CONFIDENCE = 0.5;
    private static final double LOW_PERCENTILE = 0.05;
    private static final double HIGH_PERCENTILE = 0.95;
    private static final int MAX_TRACED_CONTRIBUTIONS = 5;

    private final BacktestProperties backtestProperties;

    public int requiredBars(HypothesisBody hypothesis) {
        return Math.max(backtestProperties.minHistoryBars(), hypothesis.lookbackBars());
    }

    public BacktestReport run(HypothesisBody hypothesis, MarketSnapshot market, long seed) {
        if (hypothesis == null || market == null) {
            throw new IllegalArgumentException("hypothesis and market are required");
        }

        List<String> requiredSymbols = requiredSymbols(hypothesis, market);
        Map<String, TreeMap<Instant, Double>> closesBySymbol = indexHistory(market.history());
        int requiredBars = requiredBars(hypothesis);

        for (String symbol : requiredSymbols) {
            if (!closesBySymbol.containsKey(symbol)) {
                throw new DataInsufficientException(
                        market.contextId(),
                        market.asOf().toString(),
                        requiredBars,
                        0,
                        "No price history for " + symbol + " in market context " + market.recordKey()
                );
            }
        }

        List<Instant> aligned = requiredSymbols.isEmpty()
                ? allTimestamps(closesBySymbol)
                : alignedTimestamps(requiredSymbols, closesBySymbol);
        if (aligned.size() < requiredBars) {
            throw new DataInsufficientException(
                    market.contextId(),
                    market.asOf().toString(),
                    requiredBars,
                    aligned.size(),
                    "Backtest needs " + requiredBars + " aligned bars, market context " + market.recordKey()
                            + " has " + aligned.size()
            );
        }

        int windowSize = requiredBars;
        List<Instant> window = aligned.subList(aligned.size() - windowSize, aligned.size());
        Instant windowStart = window.get(0);
        Instant windowEnd = window.get(window.size() - 1);

        double[] dailyReturns = portfolioReturns(hypothesis, window, closesBySymbol);
        double meanDaily = mean(dailyReturns);
        int annualisation = backtestProperties.tradingDaysPerYear();
        double expectedReturn = meanDaily * annualisation;
        double maxDrawdown = maxDrawdown(dailyReturns);

        double completeness = completeness(requiredSymbols, closesBySymbol, windowStart, windowEnd, windowSize);
        double signalConfidence = signalConfidence(hypothesis, market);
        double confidence = Math.min(MAX_CONFIDENCE, completeness * signalConfidence);

        double[] interval = bootstrapInterval(dailyReturns, seed, annualisation, expectedReturn);

        BacktestMetrics metrics = new BacktestMetrics(
                expectedReturn,
                maxDrawdown,
                confidence,
                interval[0],
                interval[1],
                windowSize,
                windowStart,
                windowEnd,
                seed
        );
        ExplainabilityTrace trace = explain(hypothesis, market, metrics, closesBySymbol, completeness, signalConfidence);
        return new BacktestReport(metrics, trace);
    }

    private List<String> requiredSymbols(HypothesisBody hypothesis, MarketSnapshot market) {
        TreeSet<String> symbols = new TreeSet<>();
        for (Allocation allocation : hypothesis.allocations()) {
            if (allocation.weight() > 0.0) {
                symbols.add(allocation.symbol());
            }
        }
        if (market.benchmarkSymbol() != null && !market.benchmarkSymbol().isBlank()) {
            symbols.add(market.benchmarkSymbol());
        }
        return List.copyOf(symbols);
    }

    private Map<String, TreeMap<Instant, Double>> indexHistory(List<PriceBar> history) {
        Map<String, TreeMap<Instant, Double>> bySymbol = new HashMap<>();
        for (PriceBar bar : history) {
            if (bar == null || bar.symbol() == null || bar.timestamp() == null) {
                continue;
            }
            if (!Double.isFinite(bar.close()) || bar.close() <= 0.0) {
                continue;
            }
            bySymbol.computeIfAbsent(bar.symbol(), ignored -> new TreeMap<>()).put(bar.timestamp(), bar.close());
        }
        return bySymbol;
    }

    // all-cash hypothesis without a benchmark: any bar of the context counts
    private List<Instant> allTimestamps(Map<String, TreeMap<Instant, Double>> closesBySymbol) {
        TreeSet<Instant> union = new TreeSet<>();
        for (TreeMap<Instant, Double> closes : closesBySymbol.values()) {
            union.addAll(closes.keySet());
        }
        return new ArrayList<>(union);
    }

    private List<Instant> alignedTimestamps(List<String> symbols, Map<String, TreeMap<Instant, Double>> closesBySymbol) {
        NavigableSet<Instant> aligned = new TreeSet<>(closesBySymbol.get(symbols.get(0)).keySet());
        for (String symbol : symbols.subList(1, symbols.size())) {
            aligned.retainAll(closesBySymbol.get(symbol).keySet());
        }
        return new ArrayList<>(aligned);
    }

    private double[] portfolioReturns(
            HypothesisBody hypothesis,
            List<Instant> window,
            Map<String, TreeMap<Instant, Double>> closesBySymbol
    ) {
        double[] returns = new double[window.size() - 1];
        for (int i = 1; i < window.size(); i++) {
            double portfolioReturn = 0.0;
            for (Allocation allocation : hypothesis.allocations()) {
                if (allocation.weight() <= 0.0) {
                    continue;
                }
                TreeMap<Instant, Double> closes = closesBySymbol.get(allocation.symbol());
                double previous = closes.get(window.get(i - 1));
                double current = closes.get(window.get(i));
                portfolioReturn += allocation.weight() * (current / previous - 1.0);
            }
            returns[i - 1] = portfolioReturn;
        }
        return returns;
    }

    private double maxDrawdown(double[] returns) {
        double equity = 1.0;
        double peak = 1.0;
        double worst = 0.0;
        for (double dailyReturn : returns) {
            equity *= 1.0 + dailyReturn;
            peak = Math.max(peak, equity);
            worst = Math.max(worst, (peak - equity) / peak);
        }
        return worst;
    }

    private double completeness(
            List<String> symbols,
            Map<String, TreeMap<Instant, Double>> closesBySymbol,
            Instant windowStart,
            Instant windowEnd,
            int alignedInWindow
    ) {
        if (symbols.isEmpty()) {
            return 1.0;
        }
        TreeSet<Instant> union = new TreeSet<>();
        for (String symbol : symbols) {
            union.addAll(closesBySymbol.get(symbol).subMap(windowStart, true, windowEnd, true).keySet());
        }
        return union.isEmpty() ? 0.0 : alignedInWindow / (double) union.size();
    }

    private double signalConfidence(HypothesisBody hypothesis, MarketSnapshot market) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Allocation allocation : hypothesis.allocations()) {
            if (allocation.weight() <= 0.0) {
                continue;
            }
            List<ScoredSignal> signals = market.signalsFor(allocation.symbol());
            double symbolConfidence = signals.isEmpty()
                    ? DEFAULT_SIGNAL_CONFIDENCE
                    : signals.stream().mapToDouble(ScoredSignal::confidence).average().orElse(DEFAULT_SIGNAL_CONFIDENCE);
            weighted += allocation.weight() * symbolConfidence;
            totalWeight += allocation.weight();
        }
        return totalWeight <= 0.0 ? DEFAULT_SIGNAL_CONFIDENCE : weighted / totalWeight;
    }

    private double[] bootstrapInterval(double[] returns, long seed, int annualisation, double expectedReturn) {
        int samples = backtestProperties.bootstrapSamples();
        if (samples <= 0 || returns.length == 0) {
            return new double[] {expectedReturn, expectedReturn};
        }
        SplittableRandom random = new SplittableRandom(seed);
        double[] means = new double[samples];
        for (int s = 0; s < samples; s++) {
            double sum = 0.0;
            for (int i = 0; i < returns.length; i++) {
                sum += returns[random.nextInt(returns.length)];
            }
            means[s] = (sum / returns.length) * annualisation;
        }
        Arrays.sort(means);
        return new double[] {percentile(means, LOW_PERCENTILE), percentile(means, HIGH_PERCENTILE)};
    }

    private double percentile(double[] sorted, double p) {
        int index = (int) Math.ceil(p * sorted.length) - 1;
        return sorted[Math.max(0, Math.min(sorted.length - 1, index))];
    }

    private ExplainabilityTrace explain(
            HypothesisBody hypothesis,
            MarketSnapshot market,
            BacktestMetrics metrics,
            Map<String, TreeMap<Instant, Double>> closesBySymbol,
            double completeness,
            double signalConfidence
    ) {
        List<TraceEntry> entries = new ArrayList<>();
        entries.add(TraceEntry.text("window.start", "Window start", metrics.windowStart().toString()));
        entries.add(TraceEntry.text("window.end", "Window end", metrics.windowEnd().toString()));
        entries.add(TraceEntry.number("window.bars", "Bars used", "bars", metrics.barsUsed()));
        entries.add(TraceEntry.number("bootstrap.seed", "Bootstrap seed", "", metrics.seed()));
        entries.add(TraceEntry.number("confidence.completeness", "History completeness", "ratio", completeness));
        entries.add(TraceEntry.number("confidence.signals", "Signal confidence", "ratio", signalConfidence));

        String benchmark = market.benchmarkSymbol();
        if (benchmark != null && closesBySymbol.containsKey(benchmark)) {
            entries.add(TraceEntry.number(
                    "benchmark.return",
                    "Benchmark " + benchmark + " return",
                    "ratio",
                    periodReturn(closesBySymbol.get(benchmark), metrics.windowStart(), metrics.windowEnd())
            ));
        }

        List<Contribution> contributions = hypothesis.allocations().stream()
                .filter(allocation -> allocation.weight() > 0.0)
                .map(allocation -> new Contribution(
                        allocation.symbol(),
                        allocation.weight() * periodReturn(
                                closesBySymbol.get(allocation.symbol()),
                                metrics.windowStart(),
                                metrics.windowEnd()
                        )
                ))
                .sorted(Comparator.comparingDouble((Contribution c) -> -Math.abs(c.value()))
                        .thenComparing(Contribution::symbol))
                .limit(MAX_TRACED_CONTRIBUTIONS)
                .toList();
        for (Contribution contribution : contributions) {
            entries.add(TraceEntry.number(
                    "contribution." + contribution.symbol(),
                    contribution.symbol() + " contribution",
                    "ratio",
                    contribution.value()
            ));
        }

        for (Allocation allocation : hypothesis.allocations()) {
            List<ScoredSignal> signals = market.signalsFor(allocation.symbol());
            if (signals.isEmpty()) {
                continue;
            }
            String drivers = signals.stream()
                    .map(signal -> signal.type().name().toLowerCase(Locale.ROOT) + ":" + signal.label())
                    .sorted()
                    .reduce((left, right) -> left + ", " + right)
                    .orElse("");
            entries.add(TraceEntry.text("signal." + allocation.symbol(), allocation.symbol() + " signals", drivers));
        }

        String topContributor = contributions.isEmpty() ? "none" : contributions.get(0).symbol();
        String summary = String.format(
                Locale.ROOT,
                "%s backtest over %s..%s (%d bars, seed %d): expected return %.2f%% [%.2f%%, %.2f%%], "
                        + "max drawdown %.2f%%, confidence %.2f, top contributor %s",
                hypothesis.family(),
                metrics.windowStart(),
                metrics.windowEnd(),
                metrics.barsUsed(),
                metrics.seed(),
                metrics.expectedReturn() * 100.0,
                metrics.expectedReturnLow() * 100.0,
                metrics.expectedReturnHigh() * 100.0,
                metrics.maxDrawdown() * 100.0,
                metrics.confidence(),
                topContributor
        );
        return new ExplainabilityTrace(summary, entries);
    }

    private double periodReturn(TreeMap<Instant, Double> closes, Instant start, Instant end) {
        Double first = closes.get(start);
        Double last = closes.get(end);
        if (first == null || last == null || first <= 0.0) {
            return 0.0;
        }
        return last / first - 1.0;
    }

    private double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private record Contribution(
            String symbol,
            double value
    ) {
    }
}
