package com.demo.churn.service.alert;

/** State of one alert kind. Every state but CLEAR has a matching severity. */
public enum AlertState {
    CLEAR, ATTENTION, CRITICAL;

    public AlertSeverity severity() {
        switch (this) {
            case ATTENTION:
                return AlertSeverity.ATTENTION;
            case CRITICAL:
                return AlertSeverity.CRITICAL;
            default:
                return null;
        }
    }
}
