package com.nayem.beacon.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.util.List;

/**
 * Owns the resources Beacon opened for the application context and closes
 * them when the context shuts down.
 */
public class BeaconRegistry implements DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(BeaconRegistry.class);

    private final List<AutoCloseable> resources;

    public BeaconRegistry(List<AutoCloseable> resources) {
        this.resources = List.copyOf(resources);
    }

    public List<AutoCloseable> getResources() {
        return resources;
    }

    @Override
    public void destroy() {
        log.info("BeaconRegistry shutting down, closing {} resources", resources.size());
        for (AutoCloseable resource : resources) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Failed to close Beacon resource: {}", e.getMessage());
            }
        }
    }
}
