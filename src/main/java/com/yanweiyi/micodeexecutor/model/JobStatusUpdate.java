package com.yanweiyi.micodeexecutor.model;

import com.yanweiyi.micodeexecutor.model.enums.JobStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author yanweiyi
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusUpdate {

    private String workerId;

    private JobStatusEnum status;

    private String compilerOutput;
}
