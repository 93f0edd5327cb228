package com.dependency.flow.maestro.service.codeflow;

/**
 * Client of the branch synchronization service that flows source changes into a target
 * repository branch. Both calls may throw
 * {@link com.dependency.flow.maestro.exception.CodeFlowServiceException}.
 */
public interface PcsClient {

    /**
     * Asks the service to bring {@code request.headBranch} up to date with the source commit.
     */
    CodeFlowResponse requestSync(CodeFlowRequest request);

    CodeFlowResponse pollSync(String requestId);
}
