package com.dependency.flow.maestro.model;

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
public class CoherencyErrorDetails {

    private String error;

    @Builder.Default
    private List<String> potentialSolutions = new ArrayList<>();
}
