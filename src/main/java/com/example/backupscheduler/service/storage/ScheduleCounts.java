package com.example.backupscheduler.service.storage;

import lombok.Value;

@Value
public class ScheduleCounts {
    long total;
    long enabled;
}
