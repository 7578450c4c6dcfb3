package com.pawshugs.adoption.exception;

public class StoreNotConfiguredException extends RuntimeException {

    public StoreNotConfiguredException() {
        super("Database not configured");
    }
}
