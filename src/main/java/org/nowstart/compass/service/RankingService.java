package org.nowstart.compass.service;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.RankedCandidateDto;
import org.nowstart.compass.data.dto.RankingDto;
import org.nowstart.compass.data.dto.RankingRequest;
import org.nowstart.compass.data.entity.BacktestResultRecord;
import org.nowstart.compass.data.entity.StrategyRecord;
import org.nowstart.compass.strategy.ranking.LearningSnapshot;
import org.nowstart.compass.strategy.ranking.RankedCandidate;
import org.nowstart.compass.strategy.ranking.RankingCandidate;
import org.nowstart.compass.strategy.ranking.RankingPolicyRegistry;
import org.nowstart.compass.strategy.ranking.StrategyRankingPolicy;
import org.springframework.stereotype.Service;

/**
 * Ranks stored strategy versions of one user with the active policy and the cached learning
 * snapshot. Versions without a backtest are left out.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RankingService {

    private final StrategyLifecycleService strategyLifecycleService;
    private final RankingPolicyRegistry rankingPolicyRegistry;
    private final LearningSnapshotProvider learningSnapshotProvider;

    public RankingDto rank(String userId, RankingRequest request) {
        List<RankingCandidate> candidates = new ArrayList<>();
        for (RankingRequest.StrategyRef ref : request.strategies()) {
            StrategyRecord strategy = strategyLifecycleService.get(userId, ref.strategyId(), ref.version());
            if (!strategy.isProposable()) {
                continue;
            }
            BacktestResultRecord backtest = strategyLifecycleService.backtestOf(strategy);
            candidates.add(new RankingCandidate(
                    strategy.getRecordKey(),
                    strategy.getFamily(),
                    backtest.getExpectedReturn() * backtest.getConfidence()
            ));
        }

        StrategyRankingPolicy policy = rankingPolicyRegistry.active();
        LearningSnapshot snapshot = learningSnapshotProvider.current();
        List<RankedCandidate> ranked = policy.rank(candidates, snapshot);
        log.info(
                "event=strategies_ranked user_id={} policy={} learning_ref={} requested={} ranked={}",
                userId,
                policy.name(),
                snapshot.reference(),
                request.strategies().size(),
                ranked.size()
        );
        return new RankingDto(
                policy.name(),
                snapshot.reference(),
                snapshot.refreshedAt(),
                ranked.stream().map(RankedCandidateDto::from).toList()
        );
    }
}
