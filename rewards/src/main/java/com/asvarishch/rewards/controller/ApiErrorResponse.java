package com.asvarishch.rewards.controller;

public record ApiErrorResponse(String code, String message) {}
