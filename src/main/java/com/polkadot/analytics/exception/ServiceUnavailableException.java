package com.polkadot.analytics.exception;

public class ServiceUnavailableException extends AnalyticsException {

    public ServiceUnavailableException(String service) {
        super(service + " service not available");
    }
}
