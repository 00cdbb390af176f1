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
public class SubmitResponse {

    private String jobId;

    private String message;
}
