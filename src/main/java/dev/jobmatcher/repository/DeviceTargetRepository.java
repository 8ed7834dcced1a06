package dev.jobmatcher.repository;

import dev.jobmatcher.entity.DeviceTarget;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DeviceTargetRepository extends JpaRepository<DeviceTarget, String> {
}
