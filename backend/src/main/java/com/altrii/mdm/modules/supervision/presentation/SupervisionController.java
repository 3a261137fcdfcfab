package com.altrii.mdm.modules.supervision.presentation;

import java.util.UUID;

import com.altrii.mdm.modules.supervision.application.SupervisionService;
import com.altrii.mdm.modules.supervision.presentation.dto.CommandReceiptResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.DeviceStatusResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.GenerateProfileRequest;
import com.altrii.mdm.modules.supervision.presentation.dto.GenerateProfileResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.ProfileResponse;
import com.altrii.mdm.modules.supervision.presentation.dto.SendCommandRequest;
import com.altrii.mdm.modules.supervision.presentation.dto.VerificationResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mdm")
@Tag(name = "Supervision", description = "Operator API, requires X-Api-Key")
public class SupervisionController {

    private final SupervisionService supervisionService;

    public SupervisionController(SupervisionService supervisionService) {
        this.supervisionService = supervisionService;
    }

    @Operation(summary = "Generate a supervision profile", description = "Builds and signs the profile and returns a single-use enrollment code.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Profile generated"),
            @ApiResponse(responseCode = "400", description = "Invalid security level"),
            @ApiResponse(responseCode = "403", description = "Security level not included in the plan"),
            @ApiResponse(responseCode = "404", description = "Unknown device")
    })
    @PostMapping("/profiles/generate")
    public ResponseEntity<GenerateProfileResponse> generateProfile(@Valid @RequestBody GenerateProfileRequest request) {
        return ResponseEntity.ok(supervisionService.generateProfile(request));
    }

    @Operation(summary = "Profile metadata")
    @GetMapping("/profiles/{profileId}")
    public ResponseEntity<ProfileResponse> getProfile(@PathVariable("profileId") UUID profileId) {
        return ResponseEntity.ok(supervisionService.getProfile(profileId));
    }

    @Operation(summary = "Queue a command for a device", description = "Wakes the device when it has push credentials.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Command queued"),
            @ApiResponse(responseCode = "400", description = "Unsupported command or invalid parameters"),
            @ApiResponse(responseCode = "404", description = "Unknown device"),
            @ApiResponse(responseCode = "429", description = "Too many outstanding commands")
    })
    @PostMapping("/devices/{deviceId}/command")
    public ResponseEntity<CommandReceiptResponse> sendCommand(
            @PathVariable("deviceId") String deviceId,
            @Valid @RequestBody SendCommandRequest request
    ) {
        return ResponseEntity.ok(supervisionService.sendCommand(deviceId, request));
    }

    @Operation(summary = "Cancel a command that has not been sent yet")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Cancelled"),
            @ApiResponse(responseCode = "404", description = "Unknown command"),
            @ApiResponse(responseCode = "409", description = "Already delivered to the device")
    })
    @DeleteMapping("/devices/{deviceId}/commands/{commandId}")
    public ResponseEntity<CommandReceiptResponse> cancelCommand(
            @PathVariable("deviceId") String deviceId,
            @PathVariable("commandId") UUID commandId
    ) {
        return ResponseEntity.ok(supervisionService.cancelCommand(deviceId, commandId));
    }

    @Operation(summary = "Device supervision status")
    @GetMapping("/devices/{deviceId}/status")
    public ResponseEntity<DeviceStatusResponse> getDeviceStatus(@PathVariable("deviceId") String deviceId) {
        return ResponseEntity.ok(supervisionService.getDeviceStatus(deviceId));
    }

    @Operation(summary = "Ask the device to report profiles, security info, restrictions and apps")
    @PostMapping("/devices/{deviceId}/verify")
    public ResponseEntity<VerificationResponse> verifyDevice(@PathVariable("deviceId") String deviceId) {
        return ResponseEntity.ok(supervisionService.verifyDevice(deviceId));
    }
}
