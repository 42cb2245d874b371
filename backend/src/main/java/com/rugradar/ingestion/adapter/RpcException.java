package com.rugradar.ingestion.adapter;

/**
 * Thrown when a Solana RPC call fails: HTTP or JSON-RPC error, timeout, local rate-limit timeout,
 * or a dropped subscription socket.
 */
public class RpcException extends RuntimeException {

    public RpcException(String message) {
        super(message);
    }

    public RpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
