package com.example.servicereconciler.driver;

import com.example.servicereconciler.domain.ServiceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Maps each {@link ServiceKind} to its driver. Every kind must have exactly one.
 */
@Slf4j
@Component
public class DriverRegistry {

    private final Map<ServiceKind, ServiceDriver> drivers = new EnumMap<>(ServiceKind.class);

    public DriverRegistry(List<ServiceDriver> available) {
        for (ServiceDriver driver : available) {
            ServiceDriver previous = drivers.put(driver.kind(), driver);
            if (previous != null) {
                throw new IllegalStateException("Two drivers for kind " + driver.kind() + ": "
                        + previous.getClass().getSimpleName() + ", " + driver.getClass().getSimpleName());
            }
            log.info("Registered driver: {} ({})", driver.getClass().getSimpleName(), driver.kind().wireName());
        }
        for (ServiceKind kind : ServiceKind.values()) {
            if (!drivers.containsKey(kind)) {
                throw new IllegalStateException("No driver for kind " + kind.wireName());
            }
        }
    }

    public ServiceDriver forKind(ServiceKind kind) {
        return drivers.get(kind);
    }
}
