package com.eyelevel.docpipeline.repository;

import com.eyelevel.docpipeline.model.ExecutionAuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExecutionAuditEventRepository extends JpaRepository<ExecutionAuditEvent, Long> {

    List<ExecutionAuditEvent> findAllByExecutionIdOrderByIdAsc(String executionId);
}
