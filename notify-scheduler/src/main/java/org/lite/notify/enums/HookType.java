package org.lite.notify.enums;

public enum HookType {
    BEFORE_EXECUTE("before_execute"),
    AFTER_SUCCESS("after_success"),
    AFTER_FAILURE("after_failure");

    private final String value;

    HookType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
