package com.models_api.repository;

import com.models_api.entity.ModelTask;
import com.models_api.enumeration.status.TaskStatusEnum;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZonedDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ModelTaskRepository extends JpaRepository<ModelTask, String> {

    Optional<ModelTask> findFirstByModelNameOrderBySubmittedAtDesc(String modelName);

    List<ModelTask> findByStatusOrderByPriorityDescSubmittedAtAsc(TaskStatusEnum status, Pageable pageable);

    @Query("SELECT t.stopRequested FROM ModelTask t WHERE t.taskId = :taskId")
    Boolean findStopRequested(@Param("taskId") String taskId);

    // succeeds for exactly one worker
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ModelTask t
               SET t.status = :processing, t.workerId = :workerId, t.startedAt = :now, t.heartbeatAt = :now
             WHERE t.taskId = :taskId AND t.status = :pending AND t.stopRequested = false
            """)
    int claim(@Param("taskId") String taskId,
              @Param("workerId") String workerId,
              @Param("now") ZonedDateTime now,
              @Param("pending") TaskStatusEnum pending,
              @Param("processing") TaskStatusEnum processing);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ModelTask t SET t.stopRequested = true WHERE t.taskId = :taskId")
    int requestStop(@Param("taskId") String taskId);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ModelTask t
               SET t.status = :cancelled, t.finishedAt = :now, t.errorMessage = :reason
             WHERE t.taskId = :taskId AND t.status = :pending
            """)
    int cancelPending(@Param("taskId") String taskId,
                      @Param("now") ZonedDateTime now,
                      @Param("reason") String reason,
                      @Param("pending") TaskStatusEnum pending,
                      @Param("cancelled") TaskStatusEnum cancelled);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ModelTask t SET t.heartbeatAt = :now WHERE t.taskId = :taskId AND t.status = :processing")
    int heartbeat(@Param("taskId") String taskId,
                  @Param("now") ZonedDateTime now,
                  @Param("processing") TaskStatusEnum processing);

    // terminal rows are never overwritten
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ModelTask t
               SET t.status = :status, t.result = :result, t.errorMessage = :error, t.finishedAt = :now
             WHERE t.taskId = :taskId AND t.status = :processing
            """)
    int finish(@Param("taskId") String taskId,
               @Param("status") TaskStatusEnum status,
               @Param("result") String result,
               @Param("error") String error,
               @Param("now") ZonedDateTime now,
               @Param("processing") TaskStatusEnum processing);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE ModelTask t
               SET t.status = :failure, t.errorMessage = :reason, t.finishedAt = :now
             WHERE t.status = :processing AND t.heartbeatAt < :cutoff
            """)
    int expireLeases(@Param("cutoff") ZonedDateTime cutoff,
                     @Param("now") ZonedDateTime now,
                     @Param("reason") String reason,
                     @Param("processing") TaskStatusEnum processing,
                     @Param("failure") TaskStatusEnum failure);
}
