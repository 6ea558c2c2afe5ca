package ru.panic.orderautomationbot.repository;

import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;
import org.springframework.stereotype.Repository;
import ru.panic.orderautomationbot.model.StatsSnapshot;

import java.util.Optional;

@Repository
public interface StatsSnapshotRepository extends CrudRepository<StatsSnapshot, Long> {
    @Query("SELECT s.* FROM stats_snapshots_table s ORDER BY s.created_at DESC, s.id DESC LIMIT 1")
    Optional<StatsSnapshot> findLatest();
}
