package com.team.formtest.model.dto;

import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.Scenario;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SynthesizeRequest {

    private String metadataId;
    private FormMetadata metadata;
    private Scenario scenario;      // defaults to VALID
    private Long seed;              // random when absent, echoed in the response
}
