package com.dependency.flow.maestro.dto;

import com.dependency.flow.maestro.model.CodeFlowState;
import com.dependency.flow.maestro.model.PendingUpdate;
import com.dependency.flow.maestro.model.PullRequestState;
import com.dependency.flow.maestro.model.Reminder;
import com.dependency.flow.maestro.model.UpdaterPhase;
import com.dependency.flow.maestro.model.UpdaterState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdaterStateResponse {

    private String updaterId;
    private UpdaterPhase phase;
    private PullRequestState pullRequest;
    private CodeFlowState codeFlow;
    private List<PendingUpdate> pendingUpdates;
    private List<Reminder> reminders;
    private Instant lastUpdatedAt;

    public static UpdaterStateResponse from(UpdaterState state) {
        return UpdaterStateResponse.builder()
                .updaterId(state.getId())
                .phase(state.phase())
                .pullRequest(state.getPullRequest())
                .codeFlow(state.getCodeFlow())
                .pendingUpdates(state.getPendingUpdates())
                .reminders(state.getReminders())
                .lastUpdatedAt(state.getLastUpdatedAt())
                .build();
    }
}
