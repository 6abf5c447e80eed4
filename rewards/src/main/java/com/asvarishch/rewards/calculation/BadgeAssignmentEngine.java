package com.asvarishch.rewards.calculation;

import com.asvarishch.rewards.enums.BadgeCategory;
import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.enums.BadgeRarity;
import com.asvarishch.rewards.policy.BadgeSpec;
import com.asvarishch.rewards.policy.PlacementTier;
import com.asvarishch.rewards.policy.RewardPolicy;
import com.asvarishch.rewards.strategy.BadgeConditionResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the badges a participant earns in one tournament.
 * <ol>
 *   <li>Participation tier badges whose condition holds (debut, score threshold, ...).</li>
 *   <li>A PARTICIPANT badge for everyone; the participation tier may restyle it.</li>
 *   <li>For placements 1-3 the tier's badges, or the built-in placement badge when the tier configures none.</li>
 *   <li>Milestones at 5 and 10 rewarded tournaments, once per user. Held milestones are read under the lock of
 *   the tournament being distributed only, so two tournaments distributed at the same moment may both grant one.</li>
 * </ol>
 * Types the user already holds for the tournament are dropped, so re-running is a no-op.
 */
@Component
@RequiredArgsConstructor
public class BadgeAssignmentEngine {

    public static final String PARTICIPANT = "PARTICIPANT";
    public static final String CHAMPION = "CHAMPION";
    public static final String RUNNER_UP = "RUNNER_UP";
    public static final String THIRD_PLACE = "THIRD_PLACE";
    public static final String TOURNAMENT_VETERAN = "TOURNAMENT_VETERAN";
    public static final String TOURNAMENT_LEGEND = "TOURNAMENT_LEGEND";

    public static final int VETERAN_THRESHOLD = 5;
    public static final int LEGEND_THRESHOLD = 10;

    // tournament_badges.description
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final BadgeSpec DEFAULT_PARTICIPANT = defaultSpec(PARTICIPANT, "⚽", "Tournament Participant",
            "Participated in {tournament_name}", BadgeRarity.COMMON);
    private static final BadgeSpec DEFAULT_CHAMPION = defaultSpec(CHAMPION, "🥇", "Champion",
            "Won 1st place in {tournament_name}", BadgeRarity.EPIC);
    private static final BadgeSpec DEFAULT_RUNNER_UP = defaultSpec(RUNNER_UP, "🥈", "Runner-Up",
            "Finished 2nd in {tournament_name}", BadgeRarity.RARE);
    private static final BadgeSpec DEFAULT_THIRD_PLACE = defaultSpec(THIRD_PLACE, "🥉", "Third Place",
            "Secured 3rd place in {tournament_name}", BadgeRarity.RARE);
    private static final BadgeSpec VETERAN = defaultSpec(TOURNAMENT_VETERAN, "🎖️", "Tournament Veteran",
            "Completed {count} tournaments", BadgeRarity.RARE);
    private static final BadgeSpec LEGEND = defaultSpec(TOURNAMENT_LEGEND, "👑", "Tournament Legend",
            "Completed {count} tournaments", BadgeRarity.EPIC);

    private final BadgeConditionResolver conditionResolver;

    public List<BadgeAward> assign(ParticipantContext context, RewardPolicy policy) {
        final Map<String, BadgeAward> awards = new LinkedHashMap<>();

        // --- 1) participation tier, PARTICIPANT kept aside so it can lead the list ---
        final List<BadgeAward> participationAwards = new ArrayList<>();
        BadgeAward participant = toAward(DEFAULT_PARTICIPANT, BadgeCategory.PARTICIPATION, context);
        for (BadgeSpec spec : eligible(policy.participation(), context)) {
            final BadgeAward award = toAward(spec, categoryFor(spec, BadgeCategory.PARTICIPATION), context);
            if (PARTICIPANT.equals(spec.badgeType())) {
                participant = award;
            } else {
                participationAwards.add(award);
            }
        }

        // --- 2) PARTICIPANT for everyone ---
        awards.put(participant.badgeType(), participant);
        participationAwards.forEach(a -> awards.putIfAbsent(a.badgeType(), a));

        // --- 3) placement tier ---
        if (policy.hasPlacementTier(context.placement())) {
            final PlacementTier tier = policy.tierFor(context.placement());
            if (tier.badges().isEmpty()) {
                final BadgeAward fallback = toAward(defaultPlacementSpec(context.placement()), BadgeCategory.PLACEMENT, context);
                awards.putIfAbsent(fallback.badgeType(), fallback);
            } else {
                for (BadgeSpec spec : eligible(tier, context)) {
                    awards.putIfAbsent(spec.badgeType(), toAward(spec, categoryFor(spec, BadgeCategory.PLACEMENT), context));
                }
            }
        }

        // --- 4) milestones ---
        addMilestone(awards, context, VETERAN, VETERAN_THRESHOLD);
        addMilestone(awards, context, LEGEND, LEGEND_THRESHOLD);

        // --- 5) idempotency: skip what the user already holds for this tournament ---
        context.presentBadgeTypes().forEach(awards::remove);
        return List.copyOf(awards.values());
    }

    static BadgeSpec defaultPlacementSpec(int placement) {
        return switch (placement) {
            case 1 -> DEFAULT_CHAMPION;
            case 2 -> DEFAULT_RUNNER_UP;
            case 3 -> DEFAULT_THIRD_PLACE;
            default -> throw new IllegalArgumentException("No placement badge for placement " + placement);
        };
    }

    private List<BadgeSpec> eligible(PlacementTier tier, ParticipantContext context) {
        return tier.enabledBadges().stream()
                .filter(spec -> conditionResolver.resolve(spec.condition()).isSatisfied(spec.condition(), context))
                .toList();
    }

    private static void addMilestone(Map<String, BadgeAward> awards, ParticipantContext context,
                                     BadgeSpec milestone, int threshold) {
        if (context.tournamentsCompleted() >= threshold
                && !context.heldMilestoneTypes().contains(milestone.badgeType())) {
            final BadgeAward award = toAward(milestone, BadgeCategory.MILESTONE, context);
            awards.putIfAbsent(award.badgeType(), award);
        }
    }

    private static BadgeCategory categoryFor(BadgeSpec spec, BadgeCategory tierCategory) {
        final BadgeConditionType type = spec.condition().type();
        return type == BadgeConditionType.ALWAYS || type == BadgeConditionType.FIRST_TOURNAMENT
                ? tierCategory
                : BadgeCategory.ACHIEVEMENT;
    }

    private static BadgeAward toAward(BadgeSpec spec, BadgeCategory category, ParticipantContext context) {
        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("placement", context.placement());
        metadata.put("totalParticipants", context.totalParticipants());
        metadata.put("tournamentsCompleted", context.tournamentsCompleted());
        if (context.score() != null) {
            metadata.put("score", context.score());
        }
        return BadgeAward.builder()
                .badgeType(spec.badgeType())
                .category(category)
                .title(spec.title())
                .description(render(spec.description(), context))
                .icon(spec.icon())
                .rarity(spec.rarity())
                .metadata(metadata)
                .build();
    }

    private static String render(String template, ParticipantContext context) {
        if (template == null) {
            return null;
        }
        final String name = context.tournamentName() != null ? context.tournamentName() : "the tournament";
        final String rendered = template
                .replace("{tournament_name}", name)
                .replace("{placement}", String.valueOf(context.placement()))
                .replace("{count}", String.valueOf(context.tournamentsCompleted()));
        return rendered.length() > MAX_DESCRIPTION_LENGTH ? rendered.substring(0, MAX_DESCRIPTION_LENGTH) : rendered;
    }

    private static BadgeSpec defaultSpec(String type, String icon, String title, String description, BadgeRarity rarity) {
        return BadgeSpec.builder()
                .badgeType(type)
                .icon(icon)
                .title(title)
                .description(description)
                .rarity(rarity)
                .enabled(true)
                .build();
    }
}
