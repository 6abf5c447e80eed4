package com.asvarishch.rewards.exception;

public class RewardNotFoundException extends RuntimeException {

    public RewardNotFoundException(Long tournamentId, Long userId) {
        super("No rewards recorded for userId=" + userId + " in tournamentId=" + tournamentId);
    }
}
