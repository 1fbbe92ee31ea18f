package com.susuchain.domain.exception;

public class DutyNotFoundException extends RuntimeException {

    private final String dutyId;

    public DutyNotFoundException(String dutyId) {
        super("Duty not found: " + dutyId);
        this.dutyId = dutyId;
    }

    public DutyNotFoundException(String dutyId, Throwable cause) {
        super("Duty not found: " + dutyId, cause);
        this.dutyId = dutyId;
    }

    public String getDutyId() {
        return dutyId;
    }
}
