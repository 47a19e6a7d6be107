package org.nowstart.optimizer.data.type;

public enum Direction {
    LONG,
    SHORT
}
