package com.asvarishch.rewards.enums;

public enum DistributionOutcome {
    /** First distribution for the tournament. */
    DISTRIBUTED,
    /** Forced re-run over an already distributed tournament. */
    REDISTRIBUTED,
    /** Nothing written; rewards were already in place. */
    ALREADY_DISTRIBUTED,
    /** Dry run, nothing is persisted. */
    PREVIEW
}
