package com.asvarishch.rewards.controller;

import com.asvarishch.rewards.dto.BadgeShowcaseResponse;
import com.asvarishch.rewards.dto.SkillProfileResponse;
import com.asvarishch.rewards.service.RewardQueryService;
import com.asvarishch.rewards.service.SkillProfileService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users/{userId}")
public class UserProgressController {

    private final RewardQueryService queryService;
    private final SkillProfileService skillProfileService;

    @GetMapping("/badges/showcase")
    public ResponseEntity<BadgeShowcaseResponse> badgeShowcase(@PathVariable Long userId) {
        return ResponseEntity.ok(queryService.getBadgeShowcase(userId));
    }

    @GetMapping("/skills")
    public ResponseEntity<SkillProfileResponse> skills(@PathVariable Long userId) {
        return ResponseEntity.ok(skillProfileService.getSkillProfile(userId));
    }
}
