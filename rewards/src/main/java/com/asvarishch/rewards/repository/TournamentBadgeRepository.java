package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.model.TournamentBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface TournamentBadgeRepository extends JpaRepository<TournamentBadge, Long> {

    List<TournamentBadge> findByUserIdAndTournamentIdOrderByBadgeIdAsc(Long userId, Long tournamentId);

    List<TournamentBadge> findByUserIdOrderByCreatedAtDescBadgeIdDesc(Long userId);

    long countByTournamentId(Long tournamentId);

    // Which of the given badge types the user holds in any tournament.
    @Query("""
             SELECT DISTINCT b.badgeType
             FROM TournamentBadge b
             WHERE b.userId = :userId
               AND b.badgeType IN :badgeTypes
            """)
    List<String> findHeldBadgeTypes(@Param("userId") Long userId,
                                    @Param("badgeTypes") Collection<String> badgeTypes);
}
