package com.asvarishch.rewards.model;

import com.asvarishch.rewards.model.base.CreatedAtEntity;
import jakarta.persistence.*;
import lombok.*;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"tournament"})
@EqualsAndHashCode(of = "rankingId", callSuper = false)
@Entity
@Table(
        name = "tournament_rankings",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_ranking_tournament_user", columnNames = {"tournament_id", "user_id"}),
                @UniqueConstraint(name = "uk_ranking_tournament_placement", columnNames = {"tournament_id", "placement"})
        }
)
public class TournamentRanking extends CreatedAtEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "ranking_id")
    private Long rankingId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tournament_id", nullable = false)
    private Tournament tournament;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    /** Final placement, 1 is best. */
    @Column(name = "placement", nullable = false)
    private int placement;

    /** Score reached in the tournament, if the format keeps one. */
    @Column(name = "points")
    private Integer points;
}
