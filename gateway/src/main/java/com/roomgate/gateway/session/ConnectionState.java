package com.roomgate.gateway.session;

public enum ConnectionState {
    OPEN,
    CLOSING,
    CLOSED
}
