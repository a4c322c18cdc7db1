package com.team.formtest.model.run;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Screenshot {

    private ScreenshotStage stage;
    private String reference;       // opaque storage reference (file path for Playwright)
    private LocalDateTime capturedAt;
}
