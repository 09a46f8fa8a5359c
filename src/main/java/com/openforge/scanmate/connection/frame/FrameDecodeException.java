package com.openforge.scanmate.connection.frame;

import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;

/** A client frame that cannot be understood; the message is sent back as-is. */
public class FrameDecodeException extends GatewayException {

    public FrameDecodeException(String message) {
        super(ErrorKind.VALIDATION, message);
    }
}
