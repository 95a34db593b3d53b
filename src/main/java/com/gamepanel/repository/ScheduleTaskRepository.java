package com.gamepanel.repository;

import com.gamepanel.entity.ScheduleTaskEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ScheduleTaskRepository extends JpaRepository<ScheduleTaskEntity, String> {

    List<ScheduleTaskEntity> findByScheduleIdOrderBySequenceAsc(String scheduleId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from ScheduleTaskEntity t where t.scheduleId = :scheduleId")
    int deleteAllByScheduleId(@Param("scheduleId") String scheduleId);
}
