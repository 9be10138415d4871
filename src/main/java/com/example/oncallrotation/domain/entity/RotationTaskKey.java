package com.example.oncallrotation.domain.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite identity of a {@link RotationTask}
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RotationTaskKey implements Serializable {

    private String team;
    private String taskId;
}
