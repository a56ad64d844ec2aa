package com.demo.lending.service;

public record PolicyCheck(boolean passed, String message) {

    public static PolicyCheck pass() {
        return new PolicyCheck(true, null);
    }

    public static PolicyCheck violation(String message) {
        return new PolicyCheck(false, message);
    }
}
