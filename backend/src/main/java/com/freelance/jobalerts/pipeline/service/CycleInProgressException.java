package com.freelance.jobalerts.pipeline.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class CycleInProgressException extends RuntimeException {
    public CycleInProgressException(String message) {
        super(message);
    }
}
