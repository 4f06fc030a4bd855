package com.zktune.tunebackend.shared;

public final class Accounts {
    private Accounts() {}

    /** Accounts are compared exactly; only surrounding whitespace is dropped. */
    public static String require(String account, String what) {
        if (account == null || account.isBlank()) {
            throw new IllegalArgumentException(what + " account is required");
        }
        return account.strip();
    }

    public static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
