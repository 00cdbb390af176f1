package com.yanweiyi.micodeexecutor.model;

import lombok.Data;

import java.time.Instant;

/**
 * @author yanweiyi
 */
@Data
public class WorkerView {

    private String id;

    private String address;

    private Integer capacity;

    private Integer availableSlots;

    private Integer activeTasks;

    private Instant lastHeartbeat;
}
