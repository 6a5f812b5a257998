package com.nevis.xray.model;

public enum ProgressSignal {
    CONTINUE,
    ABORT
}
