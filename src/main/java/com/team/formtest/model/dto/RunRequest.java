package com.team.formtest.model.dto;

import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.Scenario;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request to execute test runs: a registered form id or inline metadata, plus scenarios.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {

    private String metadataId;          // registered form
    private FormMetadata metadata;      // or inline metadata, registered on the fly
    private List<Scenario> scenarios;   // defaults to VALID
}
