package org.gc.contentscheduler.repository;

import org.gc.contentscheduler.domain.PromptTemplate;
import org.springframework.data.elasticsearch.repository.ElasticsearchRepository;

public interface PromptTemplateRepository extends ElasticsearchRepository<PromptTemplate, String> {
}
