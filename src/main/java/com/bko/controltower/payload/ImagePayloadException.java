package com.bko.controltower.payload;

import com.bko.controltower.ControlTowerException;

public class ImagePayloadException extends ControlTowerException {

    public ImagePayloadException(String message) {
        super(message);
    }

    public ImagePayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
