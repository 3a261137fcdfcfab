package com.altrii.mdm.modules.enrollment.presentation;

import com.altrii.mdm.global.config.MdmProperties;
import com.altrii.mdm.modules.enrollment.application.EnrollmentRegistrar;
import com.altrii.mdm.modules.enrollment.domain.EnrollmentTicket;
import com.altrii.mdm.modules.enrollment.domain.SupervisionEnrollment;
import com.altrii.mdm.modules.enrollment.presentation.dto.CompleteEnrollmentRequest;
import com.altrii.mdm.modules.enrollment.presentation.dto.CompleteEnrollmentResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mdm/enroll")
@Tag(name = "Enrollment")
public class EnrollmentController {

    public static final MediaType APPLE_CONFIGURATION = MediaType.parseMediaType("application/x-apple-aspen-config");

    private final EnrollmentRegistrar enrollmentRegistrar;
    private final MdmProperties properties;

    public EnrollmentController(EnrollmentRegistrar enrollmentRegistrar, MdmProperties properties) {
        this.enrollmentRegistrar = enrollmentRegistrar;
        this.properties = properties;
    }

    @GetMapping("/{code}")
    @Operation(summary = "Download the supervision profile behind an enrollment code (single use)")
    public ResponseEntity<byte[]> download(@PathVariable("code") String code) {
        EnrollmentTicket ticket = enrollmentRegistrar.resolve(code);
        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(properties.getEnrollment().getDownloadFilename())
                .build();
        return ResponseEntity.ok()
                .contentType(APPLE_CONFIGURATION)
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .body(ticket.profileBytes());
    }

    @PostMapping
    @Operation(summary = "Mark a downloaded enrollment as installed on the device")
    public ResponseEntity<CompleteEnrollmentResponse> complete(@Valid @RequestBody CompleteEnrollmentRequest request) {
        SupervisionEnrollment enrollment = enrollmentRegistrar.completeEnrollment(request.deviceId(), request.userId());
        return ResponseEntity.ok(new CompleteEnrollmentResponse(true, enrollment.getStatus().name(),
                enrollment.getEnrolledAt()));
    }
}
