package com.altrii.mdm.global.web;

public interface DeviceProtocolController {
}
