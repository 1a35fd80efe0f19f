package com.example.inboxsync.domain;

import java.util.Locale;
import org.springframework.util.StringUtils;

public enum NetworkDistance {
    SELF,
    FIRST,
    SECOND,
    THIRD,
    OUT_OF_NETWORK;

    public static NetworkDistance fromProvider(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return switch (value.trim().toUpperCase(Locale.ROOT)) {
            case "SELF" -> SELF;
            case "FIRST", "FIRST_DEGREE", "DISTANCE_1" -> FIRST;
            case "SECOND", "SECOND_DEGREE", "DISTANCE_2" -> SECOND;
            case "THIRD", "THIRD_DEGREE", "DISTANCE_3" -> THIRD;
            case "OUT_OF_NETWORK" -> OUT_OF_NETWORK;
            default -> null;
        };
    }
}
