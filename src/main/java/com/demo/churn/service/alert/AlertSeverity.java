package com.demo.churn.service.alert;

public enum AlertSeverity { ATTENTION, CRITICAL }
