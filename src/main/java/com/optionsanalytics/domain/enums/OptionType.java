package com.optionsanalytics.domain.enums;

/** European option right. */
public enum OptionType {
    CALL,
    PUT;

    public boolean isCall() {
        return this == CALL;
    }
}
