package org.nowstart.compass.service;

import java.util.Objects;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.GoalDto;
import org.nowstart.compass.data.dto.GoalRequest;
import org.nowstart.compass.data.dto.UserProfileDto;
import org.nowstart.compass.data.dto.UserProfileRequest;
import org.nowstart.compass.data.entity.Goal;
import org.nowstart.compass.data.entity.UserProfile;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.InvalidTransitionException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.repository.GoalRepository;
import org.nowstart.compass.repository.UserProfileRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Stores the user profiles and goals produced by intent extraction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentRecordService {

    private final UserProfileRepository userProfileRepository;
    private final GoalRepository goalRepository;

    /**
     * Registers a profile. Registering the same content again is a no-op; different content
     * under an existing user id is rejected since profiles are immutable snapshots.
     */
    @Transactional
    public UserProfileDto registerProfile(String userId, UserProfileRequest request) {
        UserProfile existing = userProfileRepository.findById(userId).orElse(null);
        if (existing != null) {
            if (!sameProfile(existing, request)) {
                throw new InvalidTransitionException(userId, null, "Profile of user " + userId + " is already registered with different content");
            }
            return UserProfileDto.from(existing);
        }

        UserProfile profile = UserProfile.builder()
                .userId(userId)
                .cohort(request.cohort())
                .riskTolerance(request.riskTolerance())
                .maxDrawdownTolerance(request.maxDrawdownTolerance())
                .lossAversionScore(request.lossAversionScore())
                .explainableOnly(request.explainableOnly())
                .build();
        try {
            userProfileRepository.saveAndFlush(profile);
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(userId, null, "Profile of user " + userId + " was registered concurrently");
        }
        log.info("event=profile_registered user_id={} cohort={} risk_tolerance={}", userId, profile.getCohort(), profile.getRiskTolerance());
        return UserProfileDto.from(profile);
    }

    /**
     * Appends a goal version: version 1 for a new goal, head + 1 for an existing one.
     */
    @Transactional
    public GoalDto registerGoal(String userId, GoalRequest request) {
        String goalId = request.goalId() == null || request.goalId().isBlank()
                ? UUID.randomUUID().toString()
                : request.goalId();

        int nextVersion = goalRepository.findTopByGoalIdOrderByVersionDesc(goalId)
                .map(head -> {
                    if (!head.getUserId().equals(userId)) {
                        throw new RecordNotFoundException("Goal", goalId, null);
                    }
                    return head.getVersion() + 1;
                })
                .orElse(1);

        Goal goal = Goal.builder()
                .recordKey(Goal.key(goalId, nextVersion))
                .goalId(goalId)
                .version(nextVersion)
                .userId(userId)
                .description(request.description())
                .targetAmount(request.targetAmount())
                .horizonMonths(request.horizonMonths())
                .maxDrawdownTolerance(request.maxDrawdownTolerance())
                .build();
        try {
            goalRepository.saveAndFlush(goal);
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(goalId, String.valueOf(nextVersion), "Goal " + goalId + " version " + nextVersion + " was written concurrently");
        }
        log.info("event=goal_registered user_id={} goal_id={} version={} horizon_months={}", userId, goalId, nextVersion, goal.getHorizonMonths());
        return GoalDto.from(goal);
    }

    public UserProfile getProfile(String userId) {
        return userProfileRepository.findById(userId)
                .orElseThrow(() -> new RecordNotFoundException("UserProfile", userId, null));
    }

    /**
     * Returns the given goal version, or its latest version when {@code version} is null.
     */
    public Goal getGoal(String userId, String goalId, Integer version) {
        Goal goal = (version == null
                ? goalRepository.findTopByGoalIdOrderByVersionDesc(goalId)
                : goalRepository.findByGoalIdAndVersion(goalId, version))
                .orElseThrow(() -> new RecordNotFoundException("Goal", goalId, version == null ? null : String.valueOf(version)));
        if (!goal.getUserId().equals(userId)) {
            throw new RecordNotFoundException("Goal", goalId, version == null ? null : String.valueOf(version));
        }
        return goal;
    }

    private boolean sameProfile(UserProfile existing, UserProfileRequest request) {
        return Objects.equals(existing.getCohort(), request.cohort())
                && existing.getRiskTolerance() == request.riskTolerance()
                && Double.compare(existing.getMaxDrawdownTolerance(), request.maxDrawdownTolerance()) == 0
                && Double.compare(existing.getLossAversionScore(), request.lossAversionScore()) == 0
                && existing.isExplainableOnly() == request.explainableOnly();
    }
}
