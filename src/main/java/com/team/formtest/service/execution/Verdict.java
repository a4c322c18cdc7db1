package com.team.formtest.service.execution;

import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor
public class Verdict {

    private final RunStatus status;
    private final ErrorKind errorKind;   // null when passed
    private final String summary;        // null when passed
}
