package com.myorg.scf.contracts.state;

public enum StateConsistency {
    EVENTUAL("eventual"),
    STRONG("strong"),
    UNSPECIFIED(null);

    private final String code;

    StateConsistency(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
