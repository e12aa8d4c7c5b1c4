package com.devicesim.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing DeviceSim-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setSimulation(String simulationId, String deviceType) {
        MDC.put("simulationId", simulationId);
        MDC.put("deviceType", deviceType);
    }

    public static void setLayer(int layer, String actionName) {
        MDC.put("layer", String.valueOf(layer));
        MDC.put("action", actionName);
    }

    public static void clearLayer() {
        MDC.remove("layer");
        MDC.remove("action");
    }

    public static void clear() {
        MDC.remove("simulationId");
        MDC.remove("deviceType");
        MDC.remove("layer");
        MDC.remove("action");
    }
}
