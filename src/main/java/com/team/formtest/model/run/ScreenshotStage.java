package com.team.formtest.model.run;

public enum ScreenshotStage {
    BEFORE,
    AFTER_FILL,
    AFTER_SUBMIT,
    ERROR
}
