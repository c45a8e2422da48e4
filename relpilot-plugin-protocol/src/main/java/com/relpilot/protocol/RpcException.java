package com.relpilot.protocol;

import com.relpilot.plugin.PluginException;
import io.grpc.Status;

/**
 * Transport-level failure of a plugin call. {@link #getCode()} is the gRPC status the call ended
 * with, or {@link Status.Code#UNKNOWN} when the failure happened on this side before or after
 * the call (closed client, unreadable reply, unencodable request).
 */
public class RpcException extends PluginException {

    private final Status.Code code;

    public RpcException(String message) {
        this(Status.Code.UNKNOWN, message, null);
    }

    public RpcException(String message, Throwable cause) {
        this(Status.Code.UNKNOWN, message, cause);
    }

    public RpcException(Status.Code code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public Status.Code getCode() {
        return code;
    }
}
