package com.pcoptimizer.licensing.store;

public class DuplicateLicenseKeyException extends RuntimeException {

    private final String licenseKey;

    public DuplicateLicenseKeyException(String licenseKey, Throwable cause) {
        super("License key already exists: " + licenseKey, cause);
        this.licenseKey = licenseKey;
    }

    public String getLicenseKey() {
        return licenseKey;
    }
}
