package dev.pairreview.repository;

import dev.pairreview.domain.entity.DiffSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DiffSnapshotRepository extends JpaRepository<DiffSnapshot, Long> {
}
