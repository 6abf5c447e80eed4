package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.model.Tournament;
import com.asvarishch.rewards.model.TournamentRanking;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;


@DataJpaTest(properties = {
        "spring.sql.init.mode=never",
})
class TournamentRankingRepositoryTest {

    @Autowired
    private TestEntityManager em;

    @Autowired
    private TournamentRankingRepository rankingRepository;

    @Autowired
    private TournamentRepository tournamentRepository;

    private Tournament persistTournament(String name) {
        Tournament t = Tournament.builder().name(name).status(TournamentStatus.COMPLETED).build();
        em.persist(t);
        return t;
    }

    private TournamentRanking ranking(Tournament t, long userId, int placement) {
        return TournamentRanking.builder().tournament(t).userId(userId).placement(placement).build();
    }

    @Test
    @DisplayName("Rankings come back ordered by placement")
    void orderedByPlacement() {
        Tournament t = persistTournament("Cup");
        em.persist(ranking(t, 30L, 3));
        em.persist(ranking(t, 10L, 1));
        em.persist(ranking(t, 20L, 2));
        em.flush();

        List<TournamentRanking> rankings = rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(t.getTournamentId());

        assertThat(rankings).extracting(TournamentRanking::getUserId).containsExactly(10L, 20L, 30L);
    }

    @Test
    @DisplayName("Two users on the same placement violate the unique key")
    void uniquePlacement() {
        Tournament t = persistTournament("Cup");
        rankingRepository.saveAndFlush(ranking(t, 10L, 1));

        assertThatThrownBy(() -> rankingRepository.saveAndFlush(ranking(t, 20L, 1)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("deleteByTournamentId() clears only that tournament so the same keys can be inserted again")
    void deleteThenReinsert() {
        Tournament t = persistTournament("Cup");
        Tournament other = persistTournament("Other");
        rankingRepository.saveAll(List.of(ranking(t, 10L, 1), ranking(t, 20L, 2), ranking(other, 10L, 1)));
        em.flush();

        int removed = rankingRepository.deleteByTournamentId(t.getTournamentId());
        em.clear();
        Tournament reloaded = em.find(Tournament.class, t.getTournamentId());
        rankingRepository.saveAllAndFlush(List.of(ranking(reloaded, 20L, 1), ranking(reloaded, 10L, 2)));

        assertThat(removed).isEqualTo(2);
        assertThat(rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(t.getTournamentId()))
                .extracting(TournamentRanking::getUserId).containsExactly(20L, 10L);
        assertThat(rankingRepository.findByTournament_TournamentIdOrderByPlacementAsc(other.getTournamentId())).hasSize(1);
    }

    @Test
    @DisplayName("findByIdForUpdate() returns the row for the locked section")
    void findByIdForUpdate() {
        Tournament t = persistTournament("Locked Cup");
        em.flush();
        em.clear();

        Optional<Tournament> found = tournamentRepository.findByIdForUpdate(t.getTournamentId());

        assertThat(found).isPresent();
        assertThat(found.get().getName()).isEqualTo("Locked Cup");
        assertThat(tournamentRepository.findByIdForUpdate(-1L)).isEmpty();
    }
}
