package dev.postrelay.repository;

import dev.postrelay.entity.JobSettings;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JobSettingsRepository extends JpaRepository<JobSettings, String> {
}
