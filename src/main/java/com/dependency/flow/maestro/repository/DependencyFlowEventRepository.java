package com.dependency.flow.maestro.repository;

import com.dependency.flow.maestro.model.DependencyFlowEvent;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface DependencyFlowEventRepository extends MongoRepository<DependencyFlowEvent, String> {

    List<DependencyFlowEvent> findBySourceBuildId(long sourceBuildId);
}
