package com.wpanther.ticketbulkops.repository;

import com.wpanther.ticketbulkops.entity.Job;
import com.wpanther.ticketbulkops.entity.JobStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface JobRepository extends JpaRepository<Job, Long> {

    /**
     * Find job by its task queue id
     */
    Optional<Job> findByExternalId(String externalId);

    /**
     * Job by task queue id, row locked until the surrounding transaction ends.
     * State transitions read through this so concurrent writers see each other's commits.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.externalId = :externalId")
    Optional<Job> findByExternalIdForUpdate(@Param("externalId") String externalId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM Job j WHERE j.id = :id")
    Optional<Job> findByIdForUpdate(@Param("id") Long id);

    /**
     * Jobs of an owner, newest first
     */
    Page<Job> findByOwnerIdOrderByCreatedAtDesc(String ownerId, Pageable pageable);

    Page<Job> findByOwnerIdAndStatusOrderByCreatedAtDesc(String ownerId, JobStatus status, Pageable pageable);

    Page<Job> findByOwnerIdAndOperationSlugOrderByCreatedAtDesc(String ownerId, String operationSlug,
                                                                 Pageable pageable);

    Page<Job> findByOwnerIdAndStatusAndOperationSlugOrderByCreatedAtDesc(
            String ownerId, JobStatus status, String operationSlug, Pageable pageable);

    /**
     * Jobs in any of the given states
     */
    List<Job> findByStatusIn(Collection<JobStatus> statuses);

    /**
     * Terminal jobs finished before the cutoff, candidates for deletion
     */
    List<Job> findByStatusInAndCompletedAtBefore(Collection<JobStatus> statuses, Instant cutoff);

    /**
     * Operation slugs that have at least one job
     */
    @Query("SELECT DISTINCT j.operationSlug FROM Job j ORDER BY j.operationSlug")
    List<String> findDistinctOperationSlugs();
}
