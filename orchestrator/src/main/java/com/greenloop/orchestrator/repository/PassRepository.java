package com.greenloop.orchestrator.repository;

import com.greenloop.orchestrator.model.Pass;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface PassRepository extends JpaRepository<Pass, UUID> {

    List<Pass> findByRunIdOrderByPassNumberAsc(UUID runId);
}
