package com.eyelevel.docpipeline.repository;

import com.eyelevel.docpipeline.model.ExecutionRecord;
import com.eyelevel.docpipeline.model.ExecutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link ExecutionRecord} entity.
 */
@Repository
public interface ExecutionRecordRepository extends JpaRepository<ExecutionRecord, String> {

    /**
     * Atomically moves an execution to {@code RUNNING} under the given owner's lease, provided it is not
     * suspended and is either {@code PENDING} or {@code RUNNING} with a lease that this owner already holds
     * or that has expired. Bumps the version so that any stale in-memory copy can no longer be saved.
     *
     * @return the number of updated rows: 1 if the claim was granted, 0 otherwise.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE ExecutionRecord e SET e.status = :running, e.leaseOwner = :owner, "
            + "e.leaseExpiresAt = :leaseUntil, e.updatedAt = :now, e.version = e.version + 1 "
            + "WHERE e.executionId = :id AND e.suspended = false AND (e.status = :pending "
            + "OR (e.status = :running AND (e.leaseOwner = :owner OR e.leaseExpiresAt IS NULL "
            + "OR e.leaseExpiresAt < :now)))")
    int claim(@Param("id") String executionId, @Param("owner") String owner, @Param("now") Instant now,
              @Param("leaseUntil") Instant leaseUntil, @Param("pending") ExecutionStatus pending,
              @Param("running") ExecutionStatus running);

    /**
     * IDs of executions that nobody is driving: {@code RUNNING} with an expired lease, or {@code PENDING}
     * and untouched since {@code pendingBefore}. Suspended executions are excluded.
     */
    @Query("SELECT e.executionId FROM ExecutionRecord e WHERE e.suspended = false AND "
            + "((e.status = :running AND (e.leaseExpiresAt IS NULL OR e.leaseExpiresAt < :now)) "
            + "OR (e.status = :pending AND e.updatedAt < :pendingBefore)) ORDER BY e.updatedAt ASC")
    List<String> findRecoverableIds(@Param("now") Instant now, @Param("pendingBefore") Instant pendingBefore,
                                    @Param("pending") ExecutionStatus pending,
                                    @Param("running") ExecutionStatus running);
}
