package com.asvarishch.rewards.policy;

import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.enums.BadgeRarity;
import com.asvarishch.rewards.enums.SkillCategory;
import com.asvarishch.rewards.exception.RewardPolicyException;
import com.asvarishch.rewards.util.JsonConfigHelper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Validates the loosely-typed reward config blob into a {@link RewardPolicy}.
 * <p>
 * Layout of the blob:
 * <pre>
 * {
 *   "template_name": "STANDARD",
 *   "skill_mappings": [{"skill": "speed", "weight": 1.5, "category": "PHYSICAL", "enabled": true}],
 *   "first_place":  {"base_xp": 500, "xp_multiplier": 1.5, "credits": 500, "skill_points": 10, "badges": [...]},
 *   "second_place": {...}, "third_place": {...}, "participation": {...}
 * }
 * </pre>
 * Sections that are left out are taken from the named template, or from the supplied base policy.
 * Anything present but malformed raises {@link RewardPolicyException}; the caller decides on the fallback.
 */
@Component
@RequiredArgsConstructor
public class RewardPolicyParser {

    static final BigDecimal MIN_WEIGHT = new BigDecimal("0.1");
    static final BigDecimal MAX_WEIGHT = new BigDecimal("5.0");
    static final BigDecimal MAX_XP_MULTIPLIER = new BigDecimal("5.0");
    static final BigDecimal MAX_THRESHOLD = new BigDecimal("100");
    static final int MAX_BASE_XP = 100_000;
    static final int MAX_CREDITS = 1_000_000;
    static final BigDecimal MAX_SKILL_POINTS = new BigDecimal("1000");

    // Column sizes of tournament_badges and skill_rewards.
    static final int MAX_SKILL_NAME_LENGTH = 64;
    static final int MAX_BADGE_TYPE_LENGTH = 64;
    static final int MAX_TITLE_LENGTH = 120;
    static final int MAX_DESCRIPTION_LENGTH = 500;
    static final int MAX_ICON_LENGTH = 16;
    static final String DEFAULT_BADGE_ICON = "🏆";

    private static final String TEMPLATE_NAME = "template_name";
    private static final String SKILL_MAPPINGS = "skill_mappings";
    private static final String FIRST_PLACE = "first_place";
    private static final String SECOND_PLACE = "second_place";
    private static final String THIRD_PLACE = "third_place";
    private static final String PARTICIPATION = "participation";

    private final JsonConfigHelper jsonHelper;

    /**
     * @param json reward config of the tournament
     * @param base policy that supplies the sections the blob leaves out
     * @throws RewardPolicyException if the blob is not a valid policy
     */
    public RewardPolicy parse(String json, RewardPolicy base) {
        final JsonNode root = jsonHelper.readConfigJson(json);
        if (!root.isObject()) {
            throw new RewardPolicyException("reward config must be a JSON object");
        }

        final String templateName = jsonHelper.getText(root, TEMPLATE_NAME);
        final RewardPolicy effectiveBase = RewardPolicyTemplates.byName(templateName).orElse(base);

        return RewardPolicy.builder()
                .templateName(templateName != null ? templateName : effectiveBase.templateName())
                .customConfig(true)
                .skillMappings(root.has(SKILL_MAPPINGS)
                        ? parseSkillMappings(root.get(SKILL_MAPPINGS))
                        : effectiveBase.skillMappings())
                .firstPlace(parseTier(root, FIRST_PLACE, 1, effectiveBase.firstPlace()))
                .secondPlace(parseTier(root, SECOND_PLACE, 2, effectiveBase.secondPlace()))
                .thirdPlace(parseTier(root, THIRD_PLACE, 3, effectiveBase.thirdPlace()))
                .participation(parseTier(root, PARTICIPATION, 0, effectiveBase.participation()))
                .build();
    }

    /** Serializes a policy back into the blob layout; used for the distribution snapshot. */
    public String toJson(RewardPolicy policy) {
        final ObjectNode root = jsonHelper.mapper().createObjectNode();
        root.put(TEMPLATE_NAME, policy.templateName());
        root.put("custom_config", policy.customConfig());
        final ArrayNode mappings = root.putArray(SKILL_MAPPINGS);
        for (SkillMapping m : policy.skillMappings()) {
            mappings.addObject()
                    .put("skill", m.skillName())
                    .put("weight", m.weight())
                    .put("category", m.category().name())
                    .put("enabled", m.enabled());
        }
        writeTier(root.putObject(FIRST_PLACE), policy.firstPlace());
        writeTier(root.putObject(SECOND_PLACE), policy.secondPlace());
        writeTier(root.putObject(THIRD_PLACE), policy.thirdPlace());
        writeTier(root.putObject(PARTICIPATION), policy.participation());
        return jsonHelper.writeJson(root);
    }

    // --- skill mappings ---

    private List<SkillMapping> parseSkillMappings(JsonNode node) {
        if (!node.isArray()) {
            throw new RewardPolicyException("'" + SKILL_MAPPINGS + "' must be an array");
        }
        final List<SkillMapping> result = new ArrayList<>();
        final Set<String> seen = new HashSet<>();
        for (JsonNode item : node) {
            final SkillMapping mapping = parseSkillMapping(item);
            if (!seen.add(mapping.skillName())) {
                throw new RewardPolicyException("duplicate skill mapping: " + mapping.skillName());
            }
            result.add(mapping);
        }
        return result;
    }

    private SkillMapping parseSkillMapping(JsonNode item) {
        if (!item.isObject()) {
            throw new RewardPolicyException("skill mapping must be an object");
        }
        final String skill = jsonHelper.getText(item, "skill");
        if (jsonHelper.isBlank(skill)) {
            throw new RewardPolicyException("skill mapping without 'skill' name");
        }
        requireMaxLength(skill.trim(), MAX_SKILL_NAME_LENGTH, "skill name");
        BigDecimal weight = jsonHelper.getDecimal(item, "weight");
        if (weight == null) {
            weight = BigDecimal.ONE;
        }
        if (weight.compareTo(MIN_WEIGHT) < 0 || weight.compareTo(MAX_WEIGHT) > 0) {
            throw new RewardPolicyException("weight of '" + skill + "' must be between "
                    + MIN_WEIGHT + " and " + MAX_WEIGHT + ", got " + weight);
        }
        final String category = jsonHelper.getText(item, "category");
        final Boolean enabled = jsonHelper.getBoolean(item, "enabled");
        return new SkillMapping(
                skill.trim(),
                weight,
                category == null ? SkillCategory.PHYSICAL : parseEnum(SkillCategory.class, category, "category"),
                Boolean.TRUE.equals(enabled));
    }

    // --- tiers ---

    private PlacementTier parseTier(JsonNode root, String field, int placement, PlacementTier fallback) {
        if (!root.has(field) || root.get(field).isNull()) {
            return fallback;
        }
        final JsonNode node = root.get(field);
        if (!node.isObject()) {
            throw new RewardPolicyException("'" + field + "' must be an object");
        }

        final Integer baseXp = jsonHelper.getInt(node, "base_xp");
        final BigDecimal multiplier = jsonHelper.getDecimal(node, "xp_multiplier");
        final Integer credits = jsonHelper.getInt(node, "credits");
        final BigDecimal pool = jsonHelper.getDecimal(node, "skill_points");

        if (baseXp != null && (baseXp < 0 || baseXp > MAX_BASE_XP)) {
            throw new RewardPolicyException(field + ".base_xp must be between 0 and " + MAX_BASE_XP);
        }
        if (multiplier != null && (multiplier.signum() < 0 || multiplier.compareTo(MAX_XP_MULTIPLIER) > 0)) {
            throw new RewardPolicyException(field + ".xp_multiplier must be between 0 and " + MAX_XP_MULTIPLIER);
        }
        if (credits != null && (credits < 0 || credits > MAX_CREDITS)) {
            throw new RewardPolicyException(field + ".credits must be between 0 and " + MAX_CREDITS);
        }
        if (pool != null && (pool.signum() < 0 || pool.compareTo(MAX_SKILL_POINTS) > 0)) {
            throw new RewardPolicyException(field + ".skill_points must be between 0 and " + MAX_SKILL_POINTS);
        }

        return PlacementTier.builder()
                .baseXp(baseXp != null ? baseXp : RewardPolicyTemplates.defaultBaseXp(placement))
                .xpMultiplier(multiplier != null ? multiplier : BigDecimal.ONE)
                .credits(credits != null ? credits : 0)
                .skillPointPool(pool != null ? pool : RewardPolicyTemplates.defaultPointPool(placement))
                .badges(parseBadges(node.get("badges"), field))
                .build();
    }

    private List<BadgeSpec> parseBadges(JsonNode node, String tierField) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new RewardPolicyException(tierField + ".badges must be an array");
        }
        final List<BadgeSpec> badges = new ArrayList<>();
        for (JsonNode item : node) {
            badges.add(parseBadge(item, tierField));
        }
        return badges;
    }

    private BadgeSpec parseBadge(JsonNode item, String tierField) {
        if (!item.isObject()) {
            throw new RewardPolicyException(tierField + " badge must be an object");
        }
        final String type = jsonHelper.getText(item, "badge_type");
        if (jsonHelper.isBlank(type)) {
            throw new RewardPolicyException(tierField + " badge without 'badge_type'");
        }
        final String badgeType = type.trim().toUpperCase(Locale.ROOT);
        final String icon = jsonHelper.getText(item, "icon");
        final String title = jsonHelper.getText(item, "title");
        final String description = jsonHelper.getText(item, "description");
        requireMaxLength(badgeType, MAX_BADGE_TYPE_LENGTH, tierField + " badge_type");
        requireMaxLength(icon, MAX_ICON_LENGTH, "icon of " + badgeType);
        requireMaxLength(title, MAX_TITLE_LENGTH, "title of " + badgeType);
        requireMaxLength(description, MAX_DESCRIPTION_LENGTH, "description of " + badgeType);
        final String rarity = jsonHelper.getText(item, "rarity");
        final Boolean enabled = jsonHelper.getBoolean(item, "enabled");
        return BadgeSpec.builder()
                .badgeType(badgeType)
                .icon(icon != null ? icon : DEFAULT_BADGE_ICON)
                .title(title)
                .description(description)
                .rarity(rarity == null ? BadgeRarity.COMMON : parseEnum(BadgeRarity.class, rarity, "rarity"))
                .enabled(enabled == null || enabled)
                .condition(parseCondition(item.get("condition"), type))
                .build();
    }

    private BadgeCondition parseCondition(JsonNode node, String badgeType) {
        if (node == null || node.isNull()) {
            return BadgeCondition.ALWAYS;
        }
        if (!node.isObject()) {
            throw new RewardPolicyException("condition of " + badgeType + " must be an object");
        }
        final String type = jsonHelper.getText(node, "type");
        if (jsonHelper.isBlank(type)) {
            throw new RewardPolicyException("condition of " + badgeType + " without 'type'");
        }
        final BadgeConditionType conditionType = parseEnum(BadgeConditionType.class, type, "condition type");
        final BigDecimal threshold = jsonHelper.getDecimal(node, "threshold");
        if (conditionType == BadgeConditionType.SCORE_THRESHOLD && threshold == null) {
            throw new RewardPolicyException("score_threshold condition of " + badgeType + " needs a threshold");
        }
        if (threshold != null && (threshold.signum() < 0 || threshold.compareTo(MAX_THRESHOLD) > 0)) {
            throw new RewardPolicyException("threshold of " + badgeType + " must be between 0 and " + MAX_THRESHOLD);
        }
        return new BadgeCondition(conditionType, threshold);
    }

    private static void requireMaxLength(String value, int max, String what) {
        if (value != null && value.length() > max) {
            throw new RewardPolicyException(what + " must be at most " + max + " characters, got " + value.length());
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String raw, String field) {
        try {
            return Enum.valueOf(type, raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RewardPolicyException("unknown " + field + ": " + raw, e);
        }
    }

    private static void writeTier(ObjectNode node, PlacementTier tier) {
        node.put("base_xp", tier.baseXp());
        node.put("xp_multiplier", tier.xpMultiplier());
        node.put("credits", tier.credits());
        node.put("skill_points", tier.skillPointPool());
        final ArrayNode badges = node.putArray("badges");
        for (BadgeSpec b : tier.badges()) {
            final ObjectNode badge = badges.addObject()
                    .put("badge_type", b.badgeType())
                    .put("icon", b.icon())
                    .put("title", b.title())
                    .put("description", b.description())
                    .put("rarity", b.rarity().name())
                    .put("enabled", b.enabled());
            if (!b.condition().isUnconditional()) {
                final ObjectNode condition = badge.putObject("condition")
                        .put("type", b.condition().type().name().toLowerCase(Locale.ROOT));
                if (b.condition().threshold() != null) {
                    condition.put("threshold", b.condition().threshold());
                }
            }
        }
    }
}
