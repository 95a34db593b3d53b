package com.gamepanel.repository;

import com.gamepanel.entity.ScheduleRunLogEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleRunLogRepository extends JpaRepository<ScheduleRunLogEntity, String> {

    List<ScheduleRunLogEntity> findByScheduleIdOrderByStartTimeDesc(String scheduleId, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ScheduleRunLogEntity l where l.scheduleId = :scheduleId")
    int deleteAllByScheduleId(@Param("scheduleId") String scheduleId);
}
