package ru.tigran.dialoguesimulator.exception;

/**
 * Thrown by the rate limiter once the daily request ceiling is reached.
 * Terminal: no amount of waiting inside the current day can admit another request.
 */
public class DailyQuotaExceededException extends ApplicationException {
    public DailyQuotaExceededException(String message) {
        super(message, ErrorCode.DAILY_LIMIT_REACHED);
    }
}
