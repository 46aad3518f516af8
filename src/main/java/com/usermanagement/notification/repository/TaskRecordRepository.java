package com.usermanagement.notification.repository;

import com.usermanagement.notification.entity.TaskRecord;
import com.usermanagement.notification.entity.TaskStatus;
import com.usermanagement.notification.event.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TaskRecordRepository extends JpaRepository<TaskRecord, Long> {

    Optional<TaskRecord> findByTaskId(UUID taskId);

    List<TaskRecord> findByStatusOrderByUpdatedAtDesc(TaskStatus status);

    List<TaskRecord> findByRecipientEmailOrderByCreatedAtDesc(String recipientEmail);

    List<TaskRecord> findByEventTypeOrderByCreatedAtDesc(EventType eventType);

    List<TaskRecord> findByEventTypeAndStatus(EventType eventType, TaskStatus status);

    List<TaskRecord> findByStatusInOrderByCreatedAtAsc(Collection<TaskStatus> statuses);

    long countByStatus(TaskStatus status);

    @Query("SELECT t FROM TaskRecord t WHERE t.status = com.usermanagement.notification.entity.TaskStatus.FAILED AND t.completedAt >= :since ORDER BY t.completedAt DESC")
    List<TaskRecord> findFailedSince(@Param("since") LocalDateTime since);
}
