package com.example.seriesscan.infrastructure.event;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ScanNotification {

    private String eventName;

    private Object payload;
}
