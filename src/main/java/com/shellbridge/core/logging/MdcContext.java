package com.shellbridge.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing shellbridge-specific MDC keys for structured logging.
 */
public final class MdcContext {

    public static final String CORRELATION_ID = "correlationId";
    public static final String BACKEND = "backend";
    public static final String WAVE_NUMBER = "waveNumber";

    private MdcContext() {}

    public static void setExecution(String correlationId) {
        MDC.put(CORRELATION_ID, correlationId);
    }

    public static void setBackend(String backend) {
        MDC.put(BACKEND, backend);
    }

    public static void setWave(int waveNumber) {
        MDC.put(WAVE_NUMBER, String.valueOf(waveNumber));
    }

    public static void clearExecution() {
        MDC.remove(CORRELATION_ID);
        MDC.remove(BACKEND);
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID);
        MDC.remove(BACKEND);
        MDC.remove(WAVE_NUMBER);
    }
}
