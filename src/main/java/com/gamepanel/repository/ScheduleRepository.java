package com.gamepanel.repository;

import com.gamepanel.entity.ScheduleEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface ScheduleRepository extends JpaRepository<ScheduleEntity, String> {

    List<ScheduleEntity> findByActive(Boolean active);

    List<ScheduleEntity> findByServerIdOrderByNameAsc(String serverId);

    List<ScheduleEntity> findAllByOrderByNameAsc();

    long countByActive(Boolean active);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ScheduleEntity s set s.lastRunAt = :lastRunAt where s.id = :id")
    int updateLastRunAt(@Param("id") String id, @Param("lastRunAt") Instant lastRunAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ScheduleEntity s set s.nextRunAt = :nextRunAt where s.id = :id")
    int updateNextRunAt(@Param("id") String id, @Param("nextRunAt") Instant nextRunAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update ScheduleEntity s set s.lastRunStatus = :status where s.id = :id")
    int updateLastRunStatus(@Param("id") String id, @Param("status") String status);
}
