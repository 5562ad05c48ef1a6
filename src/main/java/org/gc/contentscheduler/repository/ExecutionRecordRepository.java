package org.gc.contentscheduler.repository;

import org.gc.contentscheduler.domain.ExecutionRecord;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExecutionRecordRepository extends ElasticsearchRepository<ExecutionRecord, String> {

    List<ExecutionRecord> findTop50ByScheduleIdOrderByStartedAtUtcDesc(String scheduleId);
}
