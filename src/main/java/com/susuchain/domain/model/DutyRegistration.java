package com.susuchain.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DutyRegistration {

    private String dutyId;
    private String groupAddress;
    private String name;
    private Status status;

    public enum Status {
        CREATED,
        /**
         * The group already had an active duty; nothing new was registered.
         */
        ALREADY_EXISTS
    }

    public boolean isNewlyCreated() {
        return status == Status.CREATED;
    }
}
