/* (C)2026 */
package com.ammann.impact.util;

import com.ammann.impact.exception.ValidationException;

import java.time.Duration;

/**
 * Parses and renders the compact duration strings used throughout the analysis options,
 * for example {@code 15m}, {@code 24h} or {@code 7d}.
 *
 * <p>Grammar: a non-negative integer followed by a unit of {@code m} (minutes), {@code h}
 * (hours) or {@code d} (days). An unrecognized unit, or no unit at all, is read as hours.
 */
public final class DurationFormat
{
    private DurationFormat()
    {
    }

    /**
     * Parses a duration string.
     *
     * @param value duration string such as {@code 30m}
     * @return parsed duration
     * @throws ValidationException if the string is blank or carries no non-negative amount
     */
    public static Duration parse(String value)
    {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter("duration");
        }

        String trimmed = value.trim();
        char unit = trimmed.charAt(trimmed.length() - 1);
        String amountPart = Character.isDigit(unit) ? trimmed : trimmed.substring(0, trimmed.length() - 1);

        long amount;
        try {
            amount = Long.parseLong(amountPart);
        } catch (NumberFormatException e) {
            throw new ValidationException(
                    String.format("Invalid duration '%s': expected <non-negative integer><m|h|d>", value), e);
        }
        if (amount < 0) {
            throw ValidationException.invalidParameter("duration", value, "a non-negative amount");
        }

        return switch (unit) {
            case 'm' -> Duration.ofMinutes(amount);
            case 'd' -> Duration.ofDays(amount);
            default -> Duration.ofHours(amount);
        };
    }

    /**
     * Parses a duration that must be strictly positive, as window and interval sizes are.
     *
     * @param paramName option name reported on failure
     * @param value     duration string
     * @return parsed, positive duration
     */
    public static Duration parsePositive(String paramName, String value)
    {
        if (value == null || value.isBlank()) {
            throw ValidationException.missingParameter(paramName);
        }
        Duration duration = parse(value);
        if (duration.isZero()) {
            throw ValidationException.invalidParameter(paramName, value, "a positive duration");
        }
        return duration;
    }

    /**
     * Renders a duration as whole hours, or whole minutes when shorter than an hour.
     * Fractions are truncated.
     *
     * @param duration duration to render
     * @return compact representation such as {@code 3h} or {@code 45m}
     */
    public static String format(Duration duration)
    {
        long hours = duration.toHours();
        if (hours == 0) {
            return duration.toMinutes() + "m";
        }
        return hours + "h";
    }
}
