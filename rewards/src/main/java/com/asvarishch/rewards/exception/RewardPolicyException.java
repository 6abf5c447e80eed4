package com.asvarishch.rewards.exception;

/**
 * Reward policy JSON that cannot be turned into a valid policy.
 */
public class RewardPolicyException extends RuntimeException {

    public RewardPolicyException(String message) {
        super(message);
    }

    public RewardPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
