package com.asvarishch.rewards.model;

import com.asvarishch.rewards.model.base.AuditableEntity;
import com.asvarishch.rewards.model.converter.SkillPointsConverter;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reward record of one user in one tournament. Created by the first distribution and
 * replaced in place by a forced redistribution.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"tournament"})
@EqualsAndHashCode(of = "participationId", callSuper = false)
@Entity
@Table(
        name = "tournament_participations",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_participation_user_tournament", columnNames = {"user_id", "tournament_id"})
        },
        indexes = {
                @Index(name = "ix_participation_tournament_id", columnList = "tournament_id"),
                @Index(name = "ix_participation_user_id", columnList = "user_id")
        }
)
public class TournamentParticipation extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "participation_id")
    private Long participationId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "tournament_id", nullable = false)
    private Tournament tournament;

    @Column(name = "placement", nullable = false)
    private int placement;

    /** Field size the placement was achieved in; needed to replay skill progression. */
    @Column(name = "total_participants", nullable = false)
    private int totalParticipants;

    @Builder.Default
    @Convert(converter = SkillPointsConverter.class)
    @Column(name = "skill_points", length = 4000)
    private Map<String, BigDecimal> skillPoints = new LinkedHashMap<>();

    @Builder.Default
    @Convert(converter = SkillPointsConverter.class)
    @Column(name = "skill_rating_deltas", length = 4000)
    private Map<String, BigDecimal> skillRatingDeltas = new LinkedHashMap<>();

    @Column(name = "base_xp", nullable = false)
    private int baseXp;

    @Column(name = "bonus_xp", nullable = false)
    private int bonusXp;

    @Column(name = "total_xp", nullable = false)
    private int totalXp;

    @Column(name = "credits", nullable = false)
    private int credits;

    @Column(name = "distributed_at", nullable = false)
    private Instant distributedAt;

    @Column(name = "distributed_by", length = 120)
    private String distributedBy;

    /** Number of forced redistributions applied on top of the first one. */
    @Column(name = "redistribution_count", nullable = false)
    private int redistributionCount;
}
