package org.gc.contentscheduler.repository;

import org.gc.contentscheduler.domain.BlogPost;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BlogPostRepository extends ElasticsearchRepository<BlogPost, String> {

    List<BlogPost> findTop20ByScheduleIdOrderByCreatedAtUtcDesc(String scheduleId);
}
