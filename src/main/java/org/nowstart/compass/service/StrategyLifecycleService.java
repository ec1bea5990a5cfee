package org.nowstart.compass.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.BacktestResultDto;
import org.nowstart.compass.data.dto.ProposeRequest;
import org.nowstart.compass.data.dto.StrategyDto;
import org.nowstart.compass.data.dto.StrategyLineageDto;
import org.nowstart.compass.data.dto.StrategyModification;
import org.nowstart.compass.data.entity.BacktestResultRecord;
import org.nowstart.compass.data.entity.Goal;
import org.nowstart.compass.data.entity.StrategyRecord;
import org.nowstart.compass.data.entity.UserProfile;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.DataInsufficientException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.data.property.BacktestProperties;
import org.nowstart.compass.data.type.StrategyStatus;
import org.nowstart.compass.repository.BacktestResultRecordRepository;
import org.nowstart.compass.repository.StrategyRecordRepository;
import org.nowstart.compass.strategy.backtest.BacktestEngine;
import org.nowstart.compass.strategy.core.Allocation;
import org.nowstart.compass.strategy.core.BacktestMetrics;
import org.nowstart.compass.strategy.core.BacktestReport;
import org.nowstart.compass.strategy.core.ExplainabilityTrace;
import org.nowstart.compass.strategy.core.HypothesisBody;
import org.nowstart.compass.strategy.core.HypothesisCandidate;
import org.nowstart.compass.strategy.core.HypothesisContext;
import org.nowstart.compass.strategy.core.MarketSnapshot;
import org.nowstart.compass.strategy.family.HypothesisGenerator;
import org.nowstart.compass.strategy.family.HypothesisGeneratorRegistry;
import org.nowstart.compass.strategy.ranking.LearningSnapshot;
import org.nowstart.compass.strategy.ranking.RankedCandidate;
import org.nowstart.compass.strategy.ranking.RankingCandidate;
import org.nowstart.compass.strategy.ranking.RankingPolicyRegistry;
import org.nowstart.compass.strategy.ranking.StrategyRankingPolicy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates and versions strategies.
 *
 * <p>Every version is backtested before it is stored. A version is written either as
 * {@code PROPOSABLE} together with its backtest result, or as {@code BACKTEST_FAILED} with the
 * failure; versions are never updated afterwards. The version chain of a strategy only grows at
 * its head: a fork of any other version is rejected as stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyLifecycleService {

    private static final int MAX_FAILURE_DETAIL = 1000;

    private final StrategyRecordRepository strategyRecordRepository;
    private final BacktestResultRecordRepository backtestResultRecordRepository;
    private final IntentRecordService intentRecordService;
    private final MarketContextService marketContextService;
    private final HypothesisGeneratorRegistry hypothesisGeneratorRegistry;
    private final RankingPolicyRegistry rankingPolicyRegistry;
    private final LearningSnapshotProvider learningSnapshotProvider;
    private final BacktestEngine backtestEngine;
    private final BacktestProperties backtestProperties;
    private final JsonPayloadMapper jsonPayloadMapper;
    private final Clock clock;

    /**
     * Generates one candidate per registered family, ranks them with the active policy against the
     * current learning snapshot and stores the winner as version 1 of a new strategy.
     */
    @Transactional
    public Proposal propose(String userId, ProposeRequest request) {
        UserProfile profile = intentRecordService.getProfile(userId);
        Goal goal = intentRecordService.getGoal(userId, request.goalId(), request.goalVersion());
        MarketSnapshot market = marketContextService.getSnapshot(request.marketContextId(), request.marketContextAsOf());
        LearningSnapshot learning = learningSnapshotProvider.current();
        StrategyRankingPolicy policy = rankingPolicyRegistry.active();

        HypothesisContext context = new HypothesisContext(
                userId,
                profile.getRiskTolerance(),
                profile.getLossAversionScore(),
                goal.getHorizonMonths(),
                drawdownTolerance(profile.getMaxDrawdownTolerance(), goal.getMaxDrawdownTolerance()),
                market
        );
        int lookbackBars = context.horizonBars(backtestProperties.maxLookbackBars());

        Map<String, HypothesisCandidate> candidates = new TreeMap<>();
        for (HypothesisGenerator generator : hypothesisGeneratorRegistry.all()) {
            candidates.put(generator.family(), generator.generate(context, lookbackBars));
        }
        if (profile.isExplainableOnly()) {
            candidates = signalBacked(candidates, market);
        }

        List<RankingCandidate> rankingCandidates = candidates.values().stream()
                .map(candidate -> new RankingCandidate(candidate.body().family(), candidate.body().family(), candidate.prior()))
                .toList();
        List<RankedCandidate> ranking = policy.rank(rankingCandidates, learning);
        HypothesisBody chosen = candidates.get(ranking.get(0).candidate().candidateKey()).body();

        NewVersion version = new NewVersion(
                UUID.randomUUID().toString(),
                1,
                null,
                userId,
                goal.getGoalId(),
                goal.getVersion(),
                market,
                chosen,
                request.seed() == null ? backtestProperties.defaultSeed() : request.seed(),
                learning.reference(),
                policy.name(),
                null
        );
        StrategyRecord strategy = writeVersion(version);
        log.info(
                "event=strategy_proposed user_id={} strategy_id={} version={} family={} status={} policy={} learning_ref={} candidates={}",
                userId,
                strategy.getStrategyId(),
                strategy.getVersion(),
                strategy.getFamily(),
                strategy.getStatus(),
                policy.name(),
                learning.reference(),
                ranking.size()
        );
        return new Proposal(strategy, ranking);
    }

    /**
     * Creates version N+1 of a strategy from version N. A failed backtest is recorded on the new
     * version rather than thrown.
     */
    @Transactional
    public StrategyRecord fork(String userId, String strategyId, int baseVersion, StrategyModification modification) {
        StrategyRecord base = get(userId, strategyId, baseVersion);
        int headVersion = strategyRecordRepository.findTopByStrategyIdOrderByVersionDesc(strategyId)
                .map(StrategyRecord::getVersion)
                .orElse(baseVersion);
        if (headVersion != baseVersion) {
            throw new ConcurrentRecordModificationException(
                    strategyId,
                    String.valueOf(baseVersion),
                    "Strategy " + strategyId + " is at version " + headVersion + "; fork of version " + baseVersion + " is stale"
            );
        }

        StrategyModification change = modification == null
                ? new StrategyModification(null, null, null, null, null)
                : modification;
        MarketSnapshot market = change.marketContextId() == null || change.marketContextId().isBlank()
                ? marketContextService.getSnapshot(base.getMarketContextKey())
                : marketContextService.getSnapshot(change.marketContextId(), change.marketContextAsOf());
        HypothesisBody body = applyModification(
                jsonPayloadMapper.read(base.getHypothesisBody(), HypothesisBody.class),
                change
        );
        long seed = backtestResultRecordRepository.findById(base.getRecordKey())
                .map(BacktestResultRecord::getSeed)
                .orElse(backtestProperties.defaultSeed());

        NewVersion version = new NewVersion(
                strategyId,
                baseVersion + 1,
                baseVersion,
                userId,
                base.getGoalId(),
                base.getGoalVersion(),
                market,
                body,
                seed,
                base.getLearningSnapshotRef(),
                base.getRankingPolicy(),
                change.note()
        );
        StrategyRecord forked = writeVersion(version);
        log.info(
                "event=strategy_forked user_id={} strategy_id={} version={} supersedes={} status={} market_context={}",
                userId,
                strategyId,
                forked.getVersion(),
                baseVersion,
                forked.getStatus(),
                forked.getMarketContextKey()
        );
        return forked;
    }

    public StrategyRecord get(String userId, String strategyId, int version) {
        return strategyRecordRepository.findById(StrategyRecord.key(strategyId, version))
                .filter(strategy -> strategy.getUserId().equals(userId))
                .orElseThrow(() -> new RecordNotFoundException("Strategy", strategyId, String.valueOf(version)));
    }

    public StrategyLineageDto lineage(String userId, String strategyId) {
        List<StrategyRecord> versions = strategyRecordRepository.findByStrategyIdOrderByVersionAsc(strategyId);
        if (versions.isEmpty() || !versions.get(0).getUserId().equals(userId)) {
            throw new RecordNotFoundException("Strategy", strategyId, null);
        }
        List<StrategyDto> dtos = versions.stream().map(this::toDto).toList();
        return new StrategyLineageDto(strategyId, versions.get(versions.size() - 1).getVersion(), dtos);
    }

    public BacktestResultRecord backtestOf(StrategyRecord strategy) {
        return backtestResultRecordRepository.findById(strategy.getRecordKey())
                .orElseThrow(() -> new RecordNotFoundException("BacktestResult", strategy.getStrategyId(), String.valueOf(strategy.getVersion())));
    }

    public StrategyDto toDto(StrategyRecord strategy) {
        BacktestResultDto backtest = strategy.getBacktestResultKey() == null
                ? null
                : backtestResultRecordRepository.findById(strategy.getBacktestResultKey()).map(BacktestResultDto::from).orElse(null);
        return new StrategyDto(
                strategy.getStrategyId(),
                strategy.getVersion(),
                strategy.getSupersedesVersion(),
                strategy.getGoalId(),
                strategy.getGoalVersion(),
                strategy.getMarketContextKey(),
                strategy.getFamily(),
                jsonPayloadMapper.read(strategy.getHypothesisBody(), HypothesisBody.class),
                jsonPayloadMapper.read(strategy.getExplainabilityTrace(), ExplainabilityTrace.class),
                backtest,
                strategy.getStatus(),
                strategy.getFailureCode(),
                strategy.getFailureDetail(),
                strategy.getLearningSnapshotRef(),
                strategy.getRankingPolicy(),
                strategy.getNote(),
                strategy.getCreatedAt()
        );
    }

    private StrategyRecord writeVersion(NewVersion version) {
        String key = StrategyRecord.key(version.strategyId(), version.version());
        BacktestReport report = null;
        DataInsufficientException failure = null;
        try {
            report = backtestEngine.run(version.body(), version.market(), version.seed());
        } catch (DataInsufficientException exception) {
            failure = exception;
        }

        StrategyRecord.StrategyRecordBuilder builder = StrategyRecord.builder()
                .recordKey(key)
                .strategyId(version.strategyId())
                .version(version.version())
                .supersedesVersion(version.supersedesVersion())
                .userId(version.userId())
                .goalId(version.goalId())
                .goalVersion(version.goalVersion())
                .marketContextKey(version.market().recordKey())
                .family(version.body().family())
                .hypothesisBody(jsonPayloadMapper.write(version.body()))
                .learningSnapshotRef(version.learningSnapshotRef())
                .rankingPolicy(version.rankingPolicy())
                .note(version.note());

        BacktestResultRecord result = null;
        if (report != null) {
            builder.status(StrategyStatus.PROPOSABLE)
                    .explainabilityTrace(jsonPayloadMapper.write(report.trace()))
                    .backtestResultKey(key);
            result = toResultRecord(key, version, report.metrics());
        } else {
            builder.status(StrategyStatus.BACKTEST_FAILED)
                    .failureCode(failure.getCode())
                    .failureDetail(failureDetail(failure));
        }

        StrategyRecord strategy = builder.build();
        try {
            strategyRecordRepository.saveAndFlush(strategy);
            if (result != null) {
                backtestResultRecordRepository.saveAndFlush(result);
            }
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(
                    version.strategyId(),
                    String.valueOf(version.version()),
                    "Strategy " + key + " was written concurrently"
            );
        }

        if (failure != null) {
            log.warn(
                    "event=strategy_backtest_failed strategy_id={} version={} market_context={} required_bars={} available_bars={}",
                    version.strategyId(),
                    version.version(),
                    version.market().recordKey(),
                    failure.getRequiredBars(),
                    failure.getAvailableBars()
            );
        }
        return strategy;
    }

    private BacktestResultRecord toResultRecord(String key, NewVersion version, BacktestMetrics metrics) {
        return BacktestResultRecord.builder()
                .strategyKey(key)
                .strategyId(version.strategyId())
                .strategyVersion(version.version())
                .expectedReturn(metrics.expectedReturn())
                .maxDrawdown(metrics.maxDrawdown())
                .confidence(metrics.confidence())
                .expectedReturnLow(metrics.expectedReturnLow())
                .expectedReturnHigh(metrics.expectedReturnHigh())
                .barsUsed(metrics.barsUsed())
                .windowStart(metrics.windowStart())
                .windowEnd(metrics.windowEnd())
                .seed(metrics.seed())
                .computedAt(clock.instant())
                .build();
    }

    HypothesisBody applyModification(HypothesisBody base, StrategyModification modification) {
        Map<String, Double> weights = new TreeMap<>();
        for (Allocation allocation : base.allocations()) {
            weights.put(allocation.symbol(), allocation.weight());
        }
        List<String> rationale = new ArrayList<>(base.rationale());
        if (modification.allocations() != null && !modification.allocations().isEmpty()) {
            weights.putAll(modification.allocations());
            rationale.add("allocation overridden for " + String.join(", ", new TreeMap<>(modification.allocations()).keySet()));
        }

        double total = weights.values().stream().mapToDouble(Double::doubleValue).sum();
        if (total > 1.0) {
            weights.replaceAll((symbol, weight) -> weight / total);
            rationale.add(String.format(Locale.ROOT, "weights renormalised from %.3f to 1.0", total));
        }

        int lookbackBars = base.lookbackBars();
        if (modification.lookbackBars() != null) {
            lookbackBars = Math.min(modification.lookbackBars(), backtestProperties.maxLookbackBars());
            rationale.add("lookback set to " + lookbackBars + " bars");
        }
        return HypothesisBody.of(base.family(), weights, lookbackBars, rationale);
    }

    private Map<String, HypothesisCandidate> signalBacked(Map<String, HypothesisCandidate> candidates, MarketSnapshot market) {
        Map<String, HypothesisCandidate> backed = new TreeMap<>();
        candidates.forEach((family, candidate) -> {
            boolean explained = candidate.body().allocations().stream()
                    .allMatch(allocation -> !market.signalsFor(allocation.symbol()).isEmpty());
            if (explained) {
                backed.put(family, candidate);
            }
        });
        return backed.isEmpty() ? candidates : backed;
    }

    private double drawdownTolerance(double profileTolerance, double goalTolerance) {
        if (profileTolerance > 0.0 && goalTolerance > 0.0) {
            return Math.min(profileTolerance, goalTolerance);
        }
        return Math.max(profileTolerance, goalTolerance);
    }

    private String failureDetail(DataInsufficientException failure) {
        String detail = failure.getMessage() + " (required=" + failure.getRequiredBars() + ", available=" + failure.getAvailableBars() + ")";
        return detail.length() <= MAX_FAILURE_DETAIL ? detail : detail.substring(0, MAX_FAILURE_DETAIL);
    }

    public record Proposal(
            StrategyRecord strategy,
            List<RankedCandidate> ranking
    ) {
    }

    private record NewVersion(
            String strategyId,
            int version,
            Integer supersedesVersion,
            String userId,
            String goalId,
            int goalVersion,
            MarketSnapshot market,
            HypothesisBody body,
            long seed,
            String learningSnapshotRef,
            String rankingPolicy,
            String note
    ) {
    }
}
