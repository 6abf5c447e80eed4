package com.asvarishch.rewards.model;

import com.asvarishch.rewards.enums.SkillRewardSource;
import com.asvarishch.rewards.model.base.CreatedAtEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * Append-only ledger row: points of one skill awarded (or taken back) by one source.
 * Rows are never updated; a correction is written as a new row with the signed difference.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "skillRewardId", callSuper = false)
@Immutable
@Entity
@Table(
        name = "skill_rewards",
        indexes = {
                @Index(name = "ix_skill_reward_user_skill", columnList = "user_id, skill_name"),
                @Index(name = "ix_skill_reward_source", columnList = "source_type, source_id")
        }
)
public class SkillReward extends CreatedAtEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "skill_reward_id")
    private Long skillRewardId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type", length = 32, nullable = false, updatable = false)
    private SkillRewardSource sourceType;

    @Column(name = "source_id", nullable = false, updatable = false)
    private Long sourceId;

    @Column(name = "skill_name", length = 64, nullable = false, updatable = false)
    private String skillName;

    @Column(name = "points_awarded", precision = 10, scale = 1, nullable = false, updatable = false)
    private BigDecimal pointsAwarded;
}
