package com.keystone.registry;

/**
 * Thrown when {@code <base>/services} cannot be listed. {@link #getStatus()} is -1 when no
 * response was received.
 */
public class ServiceListingException extends RuntimeException {

    private final String url;
    private final int status;

    public ServiceListingException(String url, int status, String message) {
        super(message);
        this.url = url;
        this.status = status;
    }

    public ServiceListingException(String url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.status = -1;
    }

    public String getUrl() {
        return url;
    }

    public int getStatus() {
        return status;
    }
}
