package com.altrii.mdm.modules.enrollment.domain;

public enum TicketState {
    ISSUED,
    DOWNLOADED
}
