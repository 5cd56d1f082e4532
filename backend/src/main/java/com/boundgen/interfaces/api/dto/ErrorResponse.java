package com.boundgen.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
