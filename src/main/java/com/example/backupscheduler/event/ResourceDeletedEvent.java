package com.example.backupscheduler.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * Published when a managed server has been deleted by its owning service
 */
@Getter
@ToString
@RequiredArgsConstructor
public class ResourceDeletedEvent {

    private final String resourceId;
}
