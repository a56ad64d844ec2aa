package com.demo.lending.service.token;

/** Result of one external token ledger call; a failure means the call had no effect. */
public record TokenCallResult(boolean success, String reason) {

    public static TokenCallResult ok() {
        return new TokenCallResult(true, null);
    }

    public static TokenCallResult failed(String reason) {
        return new TokenCallResult(false, reason);
    }
}
