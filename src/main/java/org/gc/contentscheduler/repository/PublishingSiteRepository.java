package org.gc.contentscheduler.repository;

import org.gc.contentscheduler.domain.PublishingSite;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;

public interface PublishingSiteRepository extends ElasticsearchRepository<PublishingSite, String> {
}
