package com.econlens.core.view;

public enum TableOrder {
    CHRONOLOGICAL,
    REVERSE
}
