package com.calor;

import org.apache.log4j.Logger;

public final class Logging {

    private static final String CALOR_LOGGER_NAME = "com.calor";

    private Logging() {
    }

    public static Logger getCalorLogger() {
        return Logger.getLogger(CALOR_LOGGER_NAME);
    }
}
