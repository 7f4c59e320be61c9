package com.ecowatch.collectors.api;

import com.ecowatch.core.model.AlertBulletin;

@FunctionalInterface
public interface AlertSource {
    AlertBulletin fetchAlerts();
}
