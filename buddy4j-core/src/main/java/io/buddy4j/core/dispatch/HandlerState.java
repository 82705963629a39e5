package io.buddy4j.core.dispatch;

public enum HandlerState {
    IDLE,
    BUSY
}
