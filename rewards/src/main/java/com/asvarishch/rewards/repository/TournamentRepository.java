package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.model.Tournament;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface TournamentRepository extends JpaRepository<Tournament, Long> {

    // Serializes distribution and ranking submission for one tournament.
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
             SELECT t
             FROM Tournament t
             WHERE t.tournamentId = :tournamentId
            """)
    Optional<Tournament> findByIdForUpdate(@Param("tournamentId") Long tournamentId);
}
