package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.model.TournamentParticipation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TournamentParticipationRepository extends JpaRepository<TournamentParticipation, Long> {

    Optional<TournamentParticipation> findByTournament_TournamentIdAndUserId(Long tournamentId, Long userId);

    List<TournamentParticipation> findByTournament_TournamentId(Long tournamentId);

    // Oldest first, the order skill progression is replayed in.
    List<TournamentParticipation> findByUserIdOrderByDistributedAtAscParticipationIdAsc(Long userId);

    long countByUserIdAndTournament_TournamentIdNot(Long userId, Long tournamentId);
}
