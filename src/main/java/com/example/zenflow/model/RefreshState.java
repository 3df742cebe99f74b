package com.example.zenflow.model;

public enum RefreshState {
    IDLE,
    INVALIDATED,
    REFRESHED
}
