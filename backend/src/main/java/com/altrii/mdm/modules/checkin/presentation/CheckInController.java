package com.altrii.mdm.modules.checkin.presentation;

import com.altrii.mdm.global.plist.PropertyListCodec;
import com.altrii.mdm.global.web.DeviceProtocolController;
import com.altrii.mdm.modules.checkin.application.CheckInMessageParser;
import com.altrii.mdm.modules.checkin.application.CheckInService;
import com.altrii.mdm.modules.checkin.domain.CheckInMessage;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mdm/checkin")
public class CheckInController implements DeviceProtocolController {

    private final PropertyListCodec codec;
    private final CheckInMessageParser parser;
    private final CheckInService checkInService;

    public CheckInController(PropertyListCodec codec, CheckInMessageParser parser, CheckInService checkInService) {
        this.codec = codec;
        this.parser = parser;
        this.checkInService = checkInService;
    }

    @PutMapping("/{deviceId}")
    public ResponseEntity<Void> checkIn(
            @PathVariable("deviceId") String deviceId,
            @RequestBody(required = false) byte[] body
    ) {
        CheckInMessage message = parser.parse(codec.decode(body));
        checkInService.handle(deviceId, message);
        return ResponseEntity.ok().build();
    }
}
