package com.example.seasonroster.exception;

/**
 * Rejected generation input. Raised before any assignment is produced.
 */
public class ScheduleGenerationException extends RuntimeException {

    public static final String INVALID_WEEK_BOUNDARY = "INVALID_WEEK_BOUNDARY";
    public static final String SHOULDER_WITH_BEACH_SHOP = "SHOULDER_WITH_BEACH_SHOP";
    public static final String INVALID_PERIOD = "INVALID_PERIOD";
    public static final String DUPLICATE_EMPLOYEE = "DUPLICATE_EMPLOYEE";
    public static final String INVALID_HOUR_BOUNDS = "INVALID_HOUR_BOUNDS";
    public static final String INVALID_SEASON_RULES = "INVALID_SEASON_RULES";
    public static final String INVALID_AD_HOC_BOOKING = "INVALID_AD_HOC_BOOKING";

    private final String errorCode;
    private final Object[] parameters;

    public ScheduleGenerationException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters;
    }
}
