package com.demo.churn.service.model;

/** Published after an explicit reload swapped the active classifier. */
public record ModelReloadedEvent(String previousVersion, String currentVersion, long generation) {
}
