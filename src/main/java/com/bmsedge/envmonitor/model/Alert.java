package com.bmsedge.envmonitor.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class Alert {

    @NonNull
    AlertType type;

    @NonNull
    String message;

    @NonNull
    Severity severity;
}
