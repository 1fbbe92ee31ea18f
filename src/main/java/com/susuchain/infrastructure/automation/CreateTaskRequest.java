package com.susuchain.infrastructure.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateTaskRequest {

    private String execAddress;
    private String execSelector;

    /**
     * Calls come from a dedicated sender, the only caller the group accepts as executor.
     */
    private boolean dedicatedMsgSender;

    private String name;
    private String resolverAddress;
    private String resolverData;
}
