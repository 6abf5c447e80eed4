package com.asvarishch.rewards.model;

import com.asvarishch.rewards.enums.TournamentStatus;
import com.asvarishch.rewards.model.base.AuditableEntity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Tournament as seen by the reward engine. The lifecycle up to {@link TournamentStatus#COMPLETED}
 * is owned elsewhere; this service only moves it to {@link TournamentStatus#REWARDS_DISTRIBUTED}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"rewardConfig", "rewardPolicySnapshot"})
@EqualsAndHashCode(of = "tournamentId", callSuper = false)
@Entity
@Table(
        name = "tournaments",
        indexes = {
                @Index(name = "ix_tournament_status", columnList = "status")
        }
)
public class Tournament extends AuditableEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "tournament_id")
    private Long tournamentId;

    @Column(name = "name", length = 200, nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32, nullable = false)
    private TournamentStatus status;

    /** Reward policy JSON authored by the organizer; null means the default policy. */
    @Lob
    @Column(name = "reward_config")
    private String rewardConfig;

    /** Optional named template (STANDARD, CHAMPIONSHIP, FRIENDLY) the policy starts from. */
    @Column(name = "reward_template", length = 32)
    private String rewardTemplate;

    /** Effective policy at the moment rewards were distributed. */
    @Lob
    @Column(name = "reward_policy_snapshot")
    private String rewardPolicySnapshot;

    @Column(name = "rewards_distributed_at")
    private Instant rewardsDistributedAt;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    public void markRewardsDistributed(String policySnapshot, Instant at) {
        this.status = TournamentStatus.REWARDS_DISTRIBUTED;
        this.rewardPolicySnapshot = policySnapshot;
        this.rewardsDistributedAt = at;
    }
}
