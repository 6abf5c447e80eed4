package com.asvarishch.rewards.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;

/**
 * Onboarding assessment value of a skill. Written by the onboarding flow, read-only here.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@EqualsAndHashCode(of = "baselineId")
@Immutable
@Entity
@Table(
        name = "user_skill_baselines",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_baseline_user_skill", columnNames = {"user_id", "skill_name"})
        }
)
public class UserSkillBaseline {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "baseline_id")
    private Long baselineId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "skill_name", length = 64, nullable = false)
    private String skillName;

    @Column(name = "baseline_value", precision = 5, scale = 1, nullable = false)
    private BigDecimal baselineValue;
}
