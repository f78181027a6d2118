package com.parlayarchitect.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    INVALID_REQUEST("INVALID_REQUEST"),
    CONFIGURATION_ERROR("CONFIGURATION_ERROR");

    private final String code;
}
