package dev.postrelay.repository;

import dev.postrelay.entity.RetentionPolicy;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RetentionPolicyRepository extends JpaRepository<RetentionPolicy, Long> {
}
