package com.asvarishch.rewards.strategy;

import com.asvarishch.rewards.enums.BadgeConditionType;
import com.asvarishch.rewards.policy.BadgeCondition;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;


@Component
public class BadgeConditionResolver {

    private final Map<BadgeConditionType, BadgeConditionStrategy> strategyByType;

    public BadgeConditionResolver(List<BadgeConditionStrategy> strategies) {
        this.strategyByType = index(strategies);
    }

    public BadgeConditionStrategy resolve(BadgeCondition condition) {
        final BadgeConditionType type = condition == null ? BadgeConditionType.ALWAYS : condition.type();
        BadgeConditionStrategy strategy = strategyByType.get(type);
        if (strategy == null) {
            throw new IllegalArgumentException("No BadgeConditionStrategy bean for type=" + type);
        }
        return strategy;
    }

    private static Map<BadgeConditionType, BadgeConditionStrategy> index(List<BadgeConditionStrategy> beans) {
        EnumMap<BadgeConditionType, BadgeConditionStrategy> map = new EnumMap<>(BadgeConditionType.class);
        for (BadgeConditionStrategy s : beans) {
            BadgeConditionType k = Objects.requireNonNull(s.getType(), s.getClass().getName() + " returned null getType()");
            if (map.putIfAbsent(k, s) != null) {
                throw new IllegalStateException("Duplicate BadgeConditionStrategy for type=" + k);
            }
        }
        return map;
    }
}
