package com.ainp.api.common;

public record ErrorResponse(String code, String message) {}
