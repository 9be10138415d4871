package com.example.oncallrotation.service;

import com.example.oncallrotation.domain.entity.RotationTaskKey;
import com.example.oncallrotation.domain.repository.RotationTaskRepository;
import com.example.oncallrotation.dto.RotationTaskResponse;
import com.example.oncallrotation.exception.ResourceNotFoundException;
import com.example.oncallrotation.mapper.RotationTaskMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Read and delete access to rotation tasks for operators
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RotationTaskService {

    private final RotationTaskRepository taskRepository;
    private final RotationTaskMapper taskMapper;

    @Transactional(readOnly = true)
    public List<RotationTaskResponse> listTasks(String team) {
        var tasks = team == null ? taskRepository.findAll() : taskRepository.findByTeamOrderByTaskId(team);
        return taskMapper.toResponseList(tasks);
    }

    /**
     * @throws ResourceNotFoundException if no such task exists
     */
    @Transactional
    public void deleteTask(String team, String taskId) {
        var key = new RotationTaskKey(team, taskId);
        if (!taskRepository.existsById(key)) {
            throw new ResourceNotFoundException("Rotation task", team + "/" + taskId);
        }
        taskRepository.deleteById(key);
        log.info("Deleted rotation task {}/{}", team, taskId);
    }
}
