package dev.pairreview.repository;

import dev.pairreview.domain.entity.Worktree;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface WorktreeRepository extends JpaRepository<Worktree, UUID> {

    Optional<Worktree> findByRepositoryAndPrNumber(String repository, Integer prNumber);

    List<Worktree> findByLastAccessedAtBefore(Instant cutoff);
}
