package com.asvarishch.rewards.model;

import com.asvarishch.rewards.enums.BadgeCategory;
import com.asvarishch.rewards.enums.BadgeRarity;
import com.asvarishch.rewards.model.base.CreatedAtEntity;
import com.asvarishch.rewards.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.*;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = {"metadata"})
@EqualsAndHashCode(of = "badgeId", callSuper = false)
@Entity
@Table(
        name = "tournament_badges",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_badge_user_tournament_type", columnNames = {"user_id", "tournament_id", "badge_type"})
        },
        indexes = {
                @Index(name = "ix_badge_user_id", columnList = "user_id"),
                @Index(name = "ix_badge_tournament_id", columnList = "tournament_id")
        }
)
public class TournamentBadge extends CreatedAtEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "badge_id")
    private Long badgeId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "tournament_id", nullable = false)
    private Long tournamentId;

    @Column(name = "badge_type", length = 64, nullable = false)
    private String badgeType;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", length = 32, nullable = false)
    private BadgeCategory category;

    @Column(name = "title", length = 120, nullable = false)
    private String title;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "icon", length = 16)
    private String icon;

    @Enumerated(EnumType.STRING)
    @Column(name = "rarity", length = 16, nullable = false)
    private BadgeRarity rarity;

    @Builder.Default
    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", length = 2000)
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
