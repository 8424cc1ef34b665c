package com.tixgo.common.enums;

public enum UserRole {
    USER,
    VENDOR,
    ADMIN
}
