package com.guildpool.api.error;

public record ErrorResponse(String code, String message) {}
