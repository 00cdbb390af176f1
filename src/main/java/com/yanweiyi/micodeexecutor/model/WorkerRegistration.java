package com.yanweiyi.micodeexecutor.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author yanweiyi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WorkerRegistration {

    private String id;

    private String address;

    private Integer capacity;
}
