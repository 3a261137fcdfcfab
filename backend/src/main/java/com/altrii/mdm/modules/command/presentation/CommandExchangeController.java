package com.altrii.mdm.modules.command.presentation;

import com.altrii.mdm.global.plist.PropertyListCodec;
import com.altrii.mdm.global.web.DeviceProtocolController;
import com.altrii.mdm.modules.command.application.CommandExchangeService;
import com.altrii.mdm.modules.command.application.CommandReportParser;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/mdm/server")
public class CommandExchangeController implements DeviceProtocolController {

    public static final MediaType APPLE_MDM_COMMAND = MediaType.parseMediaType("application/x-apple-aspen-mdm");

    private final PropertyListCodec codec;
    private final CommandReportParser parser;
    private final CommandExchangeService exchangeService;

    public CommandExchangeController(PropertyListCodec codec, CommandReportParser parser,
                                     CommandExchangeService exchangeService) {
        this.codec = codec;
        this.parser = parser;
        this.exchangeService = exchangeService;
    }

    @PutMapping("/{deviceId}")
    public ResponseEntity<byte[]> exchange(
            @PathVariable("deviceId") String deviceId,
            @RequestBody(required = false) byte[] body
    ) {
        return exchangeService.exchange(deviceId, parser.parse(codec.decode(body)))
                .map(command -> ResponseEntity.ok().contentType(APPLE_MDM_COMMAND).body(command))
                .orElseGet(() -> ResponseEntity.ok().build());
    }
}
