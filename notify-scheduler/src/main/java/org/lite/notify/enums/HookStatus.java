package org.lite.notify.enums;

public enum HookStatus {
    STARTED,
    SUCCESS,
    FAILED,
    TIMEOUT
}
