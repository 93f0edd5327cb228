package com.dependency.flow.maestro.service.codeflow;

import com.dependency.flow.maestro.exception.CodeFlowServiceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

@Service
@RequiredArgsConstructor
@Slf4j
public class HttpPcsClient implements PcsClient {

    private final WebClient.Builder webClientBuilder;

    @Value("${maestro.pcs.base-url}")
    private String pcsBaseUrl;

    @Override
    public CodeFlowResponse requestSync(CodeFlowRequest request) {
        log.info("Requesting code flow of {}@{} into {}:{} on branch {}",
                request.getSourceRepository(), request.getSourceSha(),
                request.getTargetRepository(), request.getTargetBranch(), request.getHeadBranch());
        try {
            CodeFlowResponse response = buildClient().post()
                    .uri("/codeflows")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(CodeFlowResponse.class)
                    .block();
            return requireBody(response, "requestSync");
        } catch (WebClientResponseException e) {
            throw new CodeFlowServiceException("Code flow request for " + request.getSubscriptionId()
                    + " rejected: " + e.getStatusCode() + " " + e.getResponseBodyAsString(), e);
        } catch (CodeFlowServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CodeFlowServiceException("Code flow request for " + request.getSubscriptionId()
                    + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public CodeFlowResponse pollSync(String requestId) {
        log.debug("Polling code flow request {}", requestId);
        try {
            CodeFlowResponse response = buildClient().get()
                    .uri("/codeflows/{requestId}", requestId)
                    .retrieve()
                    .bodyToMono(CodeFlowResponse.class)
                    .block();
            return requireBody(response, "pollSync " + requestId);
        } catch (WebClientResponseException e) {
            throw new CodeFlowServiceException("Polling code flow request " + requestId
                    + " failed: " + e.getStatusCode(), e);
        } catch (CodeFlowServiceException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CodeFlowServiceException("Polling code flow request " + requestId
                    + " failed: " + e.getMessage(), e);
        }
    }

    private CodeFlowResponse requireBody(CodeFlowResponse response, String operation) {
        if (response == null || response.getStatus() == null) {
            throw new CodeFlowServiceException("Empty response from code flow service for " + operation);
        }
        return response;
    }

    private WebClient buildClient() {
        return webClientBuilder.clone()
                .baseUrl(pcsBaseUrl)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }
}
