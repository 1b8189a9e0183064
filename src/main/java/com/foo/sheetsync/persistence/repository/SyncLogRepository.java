package com.foo.sheetsync.persistence.repository;

import com.foo.sheetsync.persistence.entity.SyncLog;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SyncLogRepository extends JpaRepository<SyncLog, Long> {

  Optional<SyncLog> findTopByOrderByCreatedAtDescIdDesc();
}
