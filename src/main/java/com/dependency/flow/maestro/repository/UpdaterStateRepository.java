package com.dependency.flow.maestro.repository;

import com.dependency.flow.maestro.model.UpdaterState;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

@Repository
public interface UpdaterStateRepository extends MongoRepository<UpdaterState, String> {

    // Reminder dispatch: bundles holding at least one reminder that is due
    List<UpdaterState> findByRemindersDueAtLessThanEqual(Instant now);
}
