package com.dependency.flow.maestro.service.codeflow;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CodeFlowResponse {

    private String requestId;
    private Status status;
    private String headBranch;

    @JsonIgnore
    public boolean isReady() {
        return status == Status.READY;
    }

    public enum Status {
        READY,      // head branch holds the synchronized changes
        PENDING
    }
}
