package com.dependency.flow.maestro.service.coherency;

import com.dependency.flow.maestro.model.CoherencyErrorDetails;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoherencyResult {

    @Builder.Default
    private List<DependencyUpdate> requiredUpdates = new ArrayList<>();

    @Builder.Default
    private boolean coherencySuccessful = true;

    @Builder.Default
    private List<CoherencyErrorDetails> errors = new ArrayList<>();

    public boolean hasUpdates() {
        return !requiredUpdates.isEmpty();
    }
}
