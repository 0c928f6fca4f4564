package dev.postrelay.repository;

import dev.postrelay.entity.JobScheduleState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for per-job scheduling state.
 */
@Repository
public interface JobScheduleStateRepository extends JpaRepository<JobScheduleState, String> {
}
