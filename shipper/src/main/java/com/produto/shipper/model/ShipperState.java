package com.produto.shipper.model;

/**
 * Lifecycle of a {@link com.produto.shipper.service.LokiLogShipper}.
 * RUNNING is initial, STOPPED is terminal.
 */
public enum ShipperState {
    RUNNING,
    SHUTTING_DOWN,
    STOPPED
}
