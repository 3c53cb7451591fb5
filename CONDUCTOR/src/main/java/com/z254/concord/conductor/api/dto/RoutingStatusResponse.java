package com.z254.concord.conductor.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingStatusResponse {

    private String conversationId;
    private boolean running;
    private boolean waiting;
    private String message;
}
