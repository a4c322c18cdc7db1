package com.team.formtest.model.run;

public enum CancelAck {
    CANCEL_REQUESTED,
    ALREADY_TERMINAL,
    NOT_FOUND
}
