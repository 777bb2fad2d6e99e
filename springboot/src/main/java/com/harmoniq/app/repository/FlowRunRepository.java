package com.harmoniq.app.repository;

import com.harmoniq.app.entity.FlowRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FlowRunRepository extends JpaRepository<FlowRun, Long> {

    List<FlowRun> findTop20ByOrderByCreatedAtDesc();
}
