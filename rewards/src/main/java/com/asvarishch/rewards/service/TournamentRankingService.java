package com.asvarishch.rewards.service;

import com.asvarishch.rewards.dto.RankingEntryDTO;
import com.asvarishch.rewards.dto.RankingsResponse;
import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.exception.RewardValidationException;
import com.asvarishch.rewards.exception.TournamentNotFoundException;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentRanking;
import com.asvarishch.rewards.repository.TournamentRankingRepository;
import com.asvarishch.rewards.repository.TournamentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Stores the final placements handed over by the bracket service.
 * <p>
 * Rankings can be replaced while the tournament is {@code COMPLETED}. Once rewards are distributed
 * they are frozen; re-sending the identical list is accepted as a no-op so that redelivered
 * messages do not fail.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TournamentRankingService {

    private final TournamentRepository tournamentRepository;
    private final TournamentRankingRepository rankingRepository;

    @Transactional
    public RankingsResponse submitRankings(Long tournamentId, List<RankingEntryDTO> entries) {
        // --- 1) Validate input ---
        final List<RankingEntryDTO> sorted = validateEntries(entries);

        // --- 2) Lock tournament ---
        final Tournament tournament = tournamentRepository.findByIdForUpdate(tournamentId)
                .orElseThrow(() -> new TournamentNotFoundException(tournamentId));

        // --- 3) State ---
        if (tournament.getStatus() == TournamentStatus.REWARDS_DISTRIBUTED) {
            final List<RankingEntryDTO> stored = toDtos(
                    rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(tournamentId));
            if (stored.equals(sorted)) {
                log.info("Rankings of tournamentId={} re-submitted unchanged after distribution; ignoring", tournamentId);
                return new RankingsResponse(tournamentId, stored.size(), stored);
            }
            throw new RewardValidationException("Rankings of tournament " + tournamentId
                    + " are frozen once rewards are distributed");
        }
        if (tournament.getStatus() != TournamentStatus.COMPLETED) {
            throw new RewardValidationException("Tournament " + tournamentId
                    + " must be COMPLETED to accept rankings, current status: " + tournament.getStatus());
        }

        // --- 4) Replace ---
        final int removed = rankingRepository.deleteByTournamentId(tournamentId);
        final List<TournamentRanking> saved = rankingRepository.saveAll(sorted.stream()
                .map(e -> TournamentRanking.builder()
                        .tournament(tournament)
                        .userId(e.userId())
                        .placement(e.rank())
                        .points(e.points())
                        .build())
                .toList());

        log.info("Rankings stored for tournamentId={}: participants={}, replaced={}", tournamentId, saved.size(), removed);
        return new RankingsResponse(tournamentId, saved.size(), toDtos(saved));
    }

    @Transactional(readOnly = true)
    public RankingsResponse getRankings(Long tournamentId) {
        if (!tournamentRepository.existsById(tournamentId)) {
            throw new TournamentNotFoundException(tournamentId);
        }
        final List<RankingEntryDTO> rankings =
                toDtos(rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(tournamentId));
        return new RankingsResponse(tournamentId, rankings.size(), rankings);
    }

    /**
     * Non-empty, no user twice, ranks exactly {@code 1..n}. Returns the entries ordered by rank.
     */
    static List<RankingEntryDTO> validateEntries(List<RankingEntryDTO> entries) {
        if (entries == null || entries.isEmpty()) {
            throw new RewardValidationException("rankings must not be empty");
        }
        final Set<Long> users = new HashSet<>();
        for (RankingEntryDTO e : entries) {
            if (e == null || e.userId() == null || e.userId() <= 0) {
                throw new RewardValidationException("userId must be positive");
            }
            if (e.rank() == null || e.rank() <= 0) {
                throw new RewardValidationException("rank of userId=" + e.userId() + " must be positive");
            }
            if (e.points() != null && e.points() < 0) {
                throw new RewardValidationException("points of userId=" + e.userId() + " must not be negative");
            }
            if (!users.add(e.userId())) {
                throw new RewardValidationException("Duplicate userId=" + e.userId() + " in rankings");
            }
        }

        final List<RankingEntryDTO> sorted = entries.stream()
                .sorted(Comparator.comparing(RankingEntryDTO::rank))
                .toList();
        for (int i = 0; i < sorted.size(); i++) {
            if (!Objects.equals(sorted.get(i).rank(), i + 1)) {
                throw new RewardValidationException("Ranks must be unique and sequential from 1, expected rank "
                        + (i + 1) + " but found " + sorted.get(i).rank());
            }
        }
        return sorted;
    }

    private static List<RankingEntryDTO> toDtos(List<TournamentRanking> rankings) {
        return rankings.stream()
                .sorted(Comparator.comparingInt(TournamentRanking::getPlacement))
                .map(r -> new RankingEntryDTO(r.getUserId(), r.getPlacement(), r.getPoints()))
                .toList();
    }
}
