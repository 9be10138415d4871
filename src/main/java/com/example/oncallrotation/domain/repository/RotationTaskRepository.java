package com.example.oncallrotation.domain.repository;

import com.example.oncallrotation.domain.entity.RotationTask;
import com.example.oncallrotation.domain.entity.RotationTaskKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository for RotationTask entity.
 * <p>
 * {@code save} overwrites a task with the same key, so re-issuing a schedule command replaces it.
 */
@Repository
public interface RotationTaskRepository extends JpaRepository<RotationTask, RotationTaskKey> {

    List<RotationTask> findByTeamOrderByTaskId(String team);

    List<RotationTask> findByTeamAndChannelIdOrderByTaskId(String team, String channelId);

    /**
     * Store the next occurrence of an existing task.
     *
     * @return number of rows updated (0 if the task no longer exists)
     */
    @Modifying
    @Transactional
    @Query("""
            UPDATE RotationTask t
            SET t.nextOccurrenceUtc = :nextUtc,
                t.nextOccurrenceLocal = :nextLocal,
                t.lastUpdatedAt = :lastUpdatedAt
            WHERE t.team = :team
              AND t.taskId = :taskId
            """)
    int updateOccurrence(
            @Param("team") String team,
            @Param("taskId") String taskId,
            @Param("nextUtc") long nextUtc,
            @Param("nextLocal") String nextLocal,
            @Param("lastUpdatedAt") Instant lastUpdatedAt);

    long countByNextOccurrenceUtcGreaterThan(long epochSecond);

    long countByNextOccurrenceUtcLessThanEqual(long epochSecond);
}
