package org.lite.notify.enums;

public enum ScriptType {
    PYTHON,
    SHELL
}
