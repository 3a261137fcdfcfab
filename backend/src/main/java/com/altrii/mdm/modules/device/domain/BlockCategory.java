package com.altrii.mdm.modules.device.domain;

public enum BlockCategory {
    ADULT,
    GAMBLING,
    SOCIAL_MEDIA,
    GAMING,
    NEWS,
    ENTERTAINMENT,
    SHOPPING,
    DATING
}
