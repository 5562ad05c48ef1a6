package org.gc.contentscheduler.repository;

import org.gc.contentscheduler.domain.BlogSchedule;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BlogScheduleRepository extends ElasticsearchRepository<BlogSchedule, String> {

    List<BlogSchedule> findByActiveTrue();
}
