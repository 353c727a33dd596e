package com.gpu.specharvester.service;

public enum RunState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED
}
