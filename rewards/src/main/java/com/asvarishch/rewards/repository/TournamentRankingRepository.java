package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.model.TournamentRanking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TournamentRankingRepository extends JpaRepository<TournamentRanking, Long> {

    List<TournamentRanking> findByTournament_TournamentIdOrderByPlacementAsc(Long tournamentId);

    // Bulk delete so that re-inserting the same (tournament, user) keys does not hit the unique constraint.
    @Modifying(flushAutomatically = true)
    @Query("""
             DELETE FROM TournamentRanking r
             WHERE r.tournament.tournamentId = :tournamentId
            """)
    int deleteByTournamentId(@Param("tournamentId") Long tournamentId);
}
