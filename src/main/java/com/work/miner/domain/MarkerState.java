package com.work.miner.domain;

public enum MarkerState {
    NOT_OWNER,
    ACTIVE,
    WAITING_TIMEOUT
}
