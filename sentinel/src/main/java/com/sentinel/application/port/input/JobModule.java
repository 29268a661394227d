package com.sentinel.application.port.input;

import com.sentinel.service.queue.JobRegistry;

/**
 * JobModule - a business module that contributes job handlers.
 *
 * Discovered at startup through {@link java.util.ServiceLoader}; list implementations in
 * META-INF/services/com.sentinel.application.port.input.JobModule.
 */
public interface JobModule {

    /**
     * Module name, for startup logging.
     */
    String name();

    /**
     * Register this module's handlers. Called once, before workers start.
     */
    void register(JobRegistry registry);
}
