package com.enms.analytics.persistence;

import com.enms.analytics.job.JobStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface TrainingJobRepository extends JpaRepository<TrainingJobEntity, Long> {

    Optional<TrainingJobEntity> findByActiveKey(String activeKey);

    @Query("SELECT j FROM TrainingJobEntity j WHERE j.status IN :statuses AND j.createdAt < :before " +
            "ORDER BY j.createdAt ASC")
    List<TrainingJobEntity> findStale(@Param("statuses") Collection<JobStatus> statuses,
                                      @Param("before") LocalDateTime before);

    List<TrainingJobEntity> findTop50ByOrderByCreatedAtDesc();

    @Modifying(clearAutomatically = true)
    @Query("UPDATE TrainingJobEntity j SET j.status = :running, j.startedAt = :now " +
            "WHERE j.id = :id AND j.status = :pending")
    int markRunning(@Param("id") Long id,
                    @Param("pending") JobStatus pending,
                    @Param("running") JobStatus running,
                    @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE TrainingJobEntity j SET j.progressPct = :progress, j.statusMessage = :message " +
            "WHERE j.id = :id AND j.status IN :active")
    int updateProgress(@Param("id") Long id,
                       @Param("active") Collection<JobStatus> active,
                       @Param("progress") int progress,
                       @Param("message") String message);

    /**
     * Move a non-terminal job to a terminal status and release its active key.
     * Returns 0 when the job already reached a terminal status.
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE TrainingJobEntity j SET j.status = :status, j.statusMessage = :message, " +
            "j.resultRef = :resultRef, j.endedAt = :now, j.activeKey = NULL " +
            "WHERE j.id = :id AND j.status IN :active")
    int finish(@Param("id") Long id,
               @Param("active") Collection<JobStatus> active,
               @Param("status") JobStatus status,
               @Param("message") String message,
               @Param("resultRef") String resultRef,
               @Param("now") LocalDateTime now);
}
