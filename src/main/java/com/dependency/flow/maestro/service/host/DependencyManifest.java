package com.dependency.flow.maestro.service.host;

import com.dependency.flow.maestro.service.coherency.DependencyDetail;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON dependency manifest kept in every target repository.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DependencyManifest {

    private List<DependencyDetail> dependencies = new ArrayList<>();
}
