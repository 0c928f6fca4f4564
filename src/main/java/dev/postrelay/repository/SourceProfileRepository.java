package dev.postrelay.repository;

import dev.postrelay.entity.SourceProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for scraped profiles.
 */
@Repository
public interface SourceProfileRepository extends JpaRepository<SourceProfile, Long> {

    Optional<SourceProfile> findByUsername(String username);

    List<SourceProfile> findByActiveTrueOrderByIdAsc();
}
