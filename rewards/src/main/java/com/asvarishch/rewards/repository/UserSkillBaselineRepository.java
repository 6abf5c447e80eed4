package com.asvarishch.rewards.repository;

import com.asvarishch.rewards.model.UserSkillBaseline;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserSkillBaselineRepository extends JpaRepository<UserSkillBaseline, Long> {

    List<UserSkillBaseline> findByUserId(Long userId);
}
