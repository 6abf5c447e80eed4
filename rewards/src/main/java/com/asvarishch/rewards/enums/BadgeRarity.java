package com.asvarishch.rewards.enums;

/**
 * Badge rarity, declared from most common to rarest so that {@link #ordinal()} grows with rarity.
 */
public enum BadgeRarity {
    COMMON,
    UNCOMMON,
    RARE,
    EPIC,
    LEGENDARY
}
