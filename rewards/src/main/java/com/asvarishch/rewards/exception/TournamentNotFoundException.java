package com.asvarishch.rewards.exception;

public class TournamentNotFoundException extends RuntimeException {

    public TournamentNotFoundException(Long tournamentId) {
        super("Tournament not found: id=" + tournamentId);
    }
}
