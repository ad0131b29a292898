package com.shellguard.security.handler;

public enum HandlerResult {
    PASS,
    REJECT
}
