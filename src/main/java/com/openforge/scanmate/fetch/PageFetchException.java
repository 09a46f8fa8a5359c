package com.openforge.scanmate.fetch;

import com.openforge.scanmate.task.ErrorKind;
import com.openforge.scanmate.task.GatewayException;

/** The target page could not be reached or read. */
public class PageFetchException extends GatewayException {

    public PageFetchException(ErrorKind kind, String message, Throwable cause) {
        super(kind, message, cause);
    }
}
