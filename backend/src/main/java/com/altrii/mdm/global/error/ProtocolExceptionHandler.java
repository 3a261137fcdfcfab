package com.altrii.mdm.global.error;

import com.altrii.mdm.global.web.DeviceProtocolController;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

@ControllerAdvice(assignableTypes = DeviceProtocolController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ProtocolExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ProtocolExceptionHandler.class);

    @ExceptionHandler(ProblemException.class)
    public ResponseEntity<Void> handleProblem(ProblemException ex) {
        log.warn("Protocol request rejected: {} ({})", ex.getCode(), ex.getDetailMessage());
        return ResponseEntity.status(ex.getStatusCode()).build();
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Void> handleUnexpected(Exception ex) {
        log.error("Protocol request failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).build();
    }
}
