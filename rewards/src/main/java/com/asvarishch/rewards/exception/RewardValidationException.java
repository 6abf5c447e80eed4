package com.asvarishch.rewards.exception;

/**
 * Input or state that makes a reward operation impossible. Raised before anything is written.
 */
public class RewardValidationException extends RuntimeException {

    public RewardValidationException(String message) {
        super(message);
    }
}
