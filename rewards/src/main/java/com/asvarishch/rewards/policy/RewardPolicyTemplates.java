package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.enums.BadgeRarity;
import com.asvarishch.rewards.enums.SkillCategory;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Built-in reward policies an organizer can start from.
 * <p>
 * Skill mappings of every template ship disabled; organizers enable the skills a tournament trains.
 */
public final class RewardPolicyTemplates {

    public static final String STANDARD = "STANDARD";
    public static final String CHAMPIONSHIP = "CHAMPIONSHIP";
    public static final String FRIENDLY = "FRIENDLY";

    public static final int FIRST_PLACE_BASE_XP = 500;
    public static final int SECOND_PLACE_BASE_XP = 300;
    public static final int THIRD_PLACE_BASE_XP = 200;
    public static final int PARTICIPATION_BASE_XP = 50;

    public static final BigDecimal FIRST_PLACE_POINTS = new BigDecimal("10");
    public static final BigDecimal SECOND_PLACE_POINTS = new BigDecimal("7");
    public static final BigDecimal THIRD_PLACE_POINTS = new BigDecimal("5");
    public static final BigDecimal PARTICIPATION_POINTS = BigDecimal.ONE;

    private RewardPolicyTemplates() {
    }

    public static Optional<RewardPolicy> byName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return switch (name.trim().toUpperCase(Locale.ROOT)) {
            case STANDARD -> Optional.of(standard());
            case CHAMPIONSHIP -> Optional.of(championship());
            case FRIENDLY -> Optional.of(friendly());
            default -> Optional.empty();
        };
    }

    /** Default base XP of a placement bracket when a configured tier leaves it out. */
    public static int defaultBaseXp(int placement) {
        return switch (placement) {
            case 1 -> FIRST_PLACE_BASE_XP;
            case 2 -> SECOND_PLACE_BASE_XP;
            case 3 -> THIRD_PLACE_BASE_XP;
            default -> PARTICIPATION_BASE_XP;
        };
    }

    /** Default skill point pool of a placement bracket when a configured tier leaves it out. */
    public static BigDecimal defaultPointPool(int placement) {
        return switch (placement) {
            case 1 -> FIRST_PLACE_POINTS;
            case 2 -> SECOND_PLACE_POINTS;
            case 3 -> THIRD_PLACE_POINTS;
            default -> PARTICIPATION_POINTS;
        };
    }

    public static RewardPolicy standard() {
        return RewardPolicy.builder()
                .templateName(STANDARD)
                .customConfig(false)
                .skillMappings(List.of(
                        SkillMapping.disabled("speed", "1.5", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("agility", "1.2", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("stamina", "1.0", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("strength", "1.3", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("jumping", "1.0", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("ball_control", "1.2", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("passing", "1.0", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("shooting", "1.1", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("dribbling", "1.2", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("positioning", "1.0", SkillCategory.TACTICAL),
                        SkillMapping.disabled("decision_making", "1.0", SkillCategory.MENTAL),
                        SkillMapping.disabled("composure", "1.0", SkillCategory.MENTAL)))
                .firstPlace(tier(1, "1.5", 500,
                        badge("CHAMPION", "🥇", "Champion", "Won 1st place in {tournament_name}", BadgeRarity.EPIC)))
                .secondPlace(tier(2, "1.3", 300,
                        badge("RUNNER_UP", "🥈", "Runner-Up", "Finished 2nd in {tournament_name}", BadgeRarity.RARE)))
                .thirdPlace(tier(3, "1.2", 200,
                        badge("THIRD_PLACE", "🥉", "Third Place", "Secured 3rd place in {tournament_name}", BadgeRarity.UNCOMMON)))
                .participation(tier(0, "1.0", 50,
                        conditional(badge("TOURNAMENT_DEBUT", "⚽", "Tournament Debut",
                                "Completed first tournament: {tournament_name}", BadgeRarity.COMMON),
                                BadgeCondition.of(BadgeConditionType.FIRST_TOURNAMENT))))
                .build();
    }

    public static RewardPolicy championship() {
        return RewardPolicy.builder()
                .templateName(CHAMPIONSHIP)
                .customConfig(false)
                .skillMappings(List.of(
                        SkillMapping.disabled("speed", "2.0", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("agility", "1.8", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("stamina", "1.5", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("strength", "1.7", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("ball_control", "1.5", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("passing", "1.3", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("shooting", "1.4", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("decision_making", "1.2", SkillCategory.MENTAL)))
                .firstPlace(tier(1, "2.0", 1000,
                        badge("CHAMPION", "🥇", "Champion", "Won {tournament_name}", BadgeRarity.LEGENDARY),
                        conditional(badge("PERFECT_SCORE", "💯", "Perfect Score",
                                "Achieved perfect score in {tournament_name}", BadgeRarity.LEGENDARY),
                                BadgeCondition.of(BadgeConditionType.PERFECT_SCORE))))
                .secondPlace(tier(2, "1.5", 600,
                        badge("RUNNER_UP", "🥈", "Runner-Up", "Finished 2nd in {tournament_name}", BadgeRarity.EPIC)))
                .thirdPlace(tier(3, "1.3", 400,
                        badge("THIRD_PLACE", "🥉", "Third Place", "Secured 3rd place in {tournament_name}", BadgeRarity.RARE)))
                .participation(tier(0, "1.0", 100,
                        badge("PARTICIPANT", "⚽", "Championship Participant", "Participated in {tournament_name}", BadgeRarity.COMMON)))
                .build();
    }

    public static RewardPolicy friendly() {
        return RewardPolicy.builder()
                .templateName(FRIENDLY)
                .customConfig(false)
                .skillMappings(List.of(
                        SkillMapping.disabled("speed", "1.0", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("agility", "1.0", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("stamina", "1.0", SkillCategory.PHYSICAL),
                        SkillMapping.disabled("ball_control", "1.0", SkillCategory.TECHNICAL),
                        SkillMapping.disabled("passing", "1.0", SkillCategory.TECHNICAL)))
                .firstPlace(tier(1, "1.2", 200,
                        badge("WINNER", "🏆", "Winner", "Won {tournament_name}", BadgeRarity.RARE)))
                .secondPlace(tier(2, "1.1", 100,
                        badge("RUNNER_UP", "🥈", "Runner-Up", "Finished 2nd in {tournament_name}", BadgeRarity.UNCOMMON)))
                .thirdPlace(tier(3, "1.0", 50,
                        badge("THIRD_PLACE", "🥉", "Third Place", "Secured 3rd place in {tournament_name}", BadgeRarity.UNCOMMON)))
                .participation(tier(0, "1.0", 25,
                        badge("PARTICIPANT", "⚽", "Participant", "Participated in {tournament_name}", BadgeRarity.COMMON)))
                .build();
    }

    private static PlacementTier tier(int placement, String multiplier, int credits, BadgeSpec... badges) {
        return PlacementTier.builder()
                .baseXp(defaultBaseXp(placement))
                .xpMultiplier(new BigDecimal(multiplier))
                .credits(credits)
                .skillPointPool(defaultPointPool(placement))
                .badges(List.of(badges))
                .build();
    }

    private static BadgeSpec badge(String type, String icon, String title, String description, BadgeRarity rarity) {
        return BadgeSpec.builder()
                .badgeType(type)
                .icon(icon)
                .title(title)
                .description(description)
                .rarity(rarity)
                .enabled(true)
                .build();
    }

    private static BadgeSpec conditional(BadgeSpec spec, BadgeCondition condition) {
        return new BadgeSpec(spec.badgeType(), spec.icon(), spec.title(), spec.description(),
                spec.rarity(), spec.enabled(), condition);
    }
}
