package com.altrii.mdm.modules.supervision.presentation.dto;

import java.util.UUID;

public record CommandReceiptResponse(
        UUID commandUUID,
        String requestType,
        String status
) {
}
