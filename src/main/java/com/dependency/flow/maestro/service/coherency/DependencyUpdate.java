package com.dependency.flow.maestro.service.coherency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyUpdate {

    private DependencyDetail from;
    private DependencyDetail to;

    public String getDependencyName() {
        return to.getName();
    }
}
