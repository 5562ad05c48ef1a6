package org.gc.contentscheduler.repository;

import org.gc.contentscheduler.domain.Notification;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface NotificationRepository extends ElasticsearchRepository<Notification, String> {
}
