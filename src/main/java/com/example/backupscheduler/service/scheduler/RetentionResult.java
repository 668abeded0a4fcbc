package com.example.backupscheduler.service.scheduler;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RetentionResult {

    int kept;

    /**
     * Ids of the backups removed, oldest first
     */
    List<String> deleted;

    int failed;

    public static RetentionResult nothingToDo(int kept) {
        return RetentionResult.builder().kept(kept).deleted(List.of()).failed(0).build();
    }
}
