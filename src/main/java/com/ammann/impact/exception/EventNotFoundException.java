/* (C)2026 */
package com.ammann.impact.exception;

/**
 * Raised when a business event has no boundary record, so no analysis window can be anchored.
 *
 * <p>Mapped to HTTP 404 (Not Found) by {@link GlobalExceptionHandler}.
 */
public class EventNotFoundException extends ApiException
{
    private final String eventId;

    public EventNotFoundException(String eventId)
    {
        super("Business event not found: " + eventId);
        this.eventId = eventId;
    }

    public String getEventId()
    {
        return eventId;
    }
}
