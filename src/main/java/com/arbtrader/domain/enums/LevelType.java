package com.arbtrader.domain.enums;

/** Whether a grid level opens a position or closes one. */
public enum LevelType {
    ENTRY,
    EXIT
}
