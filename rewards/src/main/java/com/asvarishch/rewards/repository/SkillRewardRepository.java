package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.enums.SkillRewardSource;
import com.asvarishch.rewards.model.SkillReward;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

/**
 * Append-only ledger: only inserts and reads.
 */
@Repository
public interface SkillRewardRepository extends JpaRepository<SkillReward, Long> {

    List<SkillReward> findByUserIdAndSourceTypeAndSourceIdOrderBySkillRewardIdAsc(Long userId,
                                                                                  SkillRewardSource sourceType,
                                                                                  Long sourceId);

    // Net points per skill that one source has awarded to the user so far.
    @Query("""
             SELECT s.skillName AS skillName, SUM(s.pointsAwarded) AS points
             FROM SkillReward s
             WHERE s.userId = :userId
               AND s.sourceType = :sourceType
               AND s.sourceId = :sourceId
             GROUP BY s.skillName
            """)
    List<SkillPointsTotal> sumBySource(@Param("userId") Long userId,
                                       @Param("sourceType") SkillRewardSource sourceType,
                                       @Param("sourceId") Long sourceId);

    // Net points per skill over every source.
    @Query("""
             SELECT s.skillName AS skillName, SUM(s.pointsAwarded) AS points
             FROM SkillReward s
             WHERE s.userId = :userId
             GROUP BY s.skillName
            """)
    List<SkillPointsTotal> sumByUser(@Param("userId") Long userId);

    // Number of other sources of the given type that touched each skill.
    @Query("""
             SELECT s.skillName AS skillName, COUNT(DISTINCT s.sourceId) AS sources
             FROM SkillReward s
             WHERE s.userId = :userId
               AND s.sourceType = :sourceType
               AND s.sourceId <> :excludedSourceId
             GROUP BY s.skillName
            """)
    List<SkillSourceCount> countSourcesPerSkill(@Param("userId") Long userId,
                                                @Param("sourceType") SkillRewardSource sourceType,
                                                @Param("excludedSourceId") Long excludedSourceId);

    interface SkillPointsTotal {
        String getSkillName();

        BigDecimal getPoints();
    }

    interface SkillSourceCount {
        String getSkillName();

        Long getSources();
    }
}
