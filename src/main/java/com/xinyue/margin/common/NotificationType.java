package com.xinyue.margin.common;

public enum NotificationType {
    INDEX_UPDATED,
    DEPOSIT,
    WITHDRAWAL,
    TRADE,
    GLOBAL_OPERATOR_SET,
    LOCAL_OPERATOR_SET
}
