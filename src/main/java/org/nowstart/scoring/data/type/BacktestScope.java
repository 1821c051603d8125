package org.nowstart.scoring.data.type;

public enum BacktestScope {
    TRAINING,
    VALIDATION
}
