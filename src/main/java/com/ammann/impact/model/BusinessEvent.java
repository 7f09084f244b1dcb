/* (C)2026 */
package com.ammann.impact.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Optional;

/**
 * A discrete business occurrence (outage, launch, price change) whose impact on customer
 * metrics is analyzed.
 */
@Entity
@Table(name = BusinessEvent.TABLE_NAME, indexes = {
        @Index(name = "idx_business_event_event_id", columnList = "event_id", unique = true)
})
public class BusinessEvent extends PanacheEntity
{
    public static final String TABLE_NAME = "business_event";

    /**
     * External identifier used by callers.
     */
    @Column(name = "event_id", nullable = false, length = 64)
    @NotNull
    public String eventId;

    @Column(length = 255)
    public String name;

    /**
     * Free-form category such as OUTAGE or PRICE_CHANGE.
     */
    @Column(name = "event_type", length = 64)
    public String eventType;

    @Column(name = "start_time", nullable = false)
    @NotNull
    public Instant startTime;

    /**
     * Null while the event is ongoing.
     */
    @Column(name = "end_time")
    public Instant endTime;

    public BusinessEvent()
    {
    }

    public BusinessEvent(String eventId, String name, Instant startTime, Instant endTime)
    {
        this.eventId = eventId;
        this.name = name;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public static Optional<BusinessEvent> findByEventId(String eventId)
    {
        return find("eventId", eventId).firstResultOptional();
    }

    public EventBounds toBounds()
    {
        return new EventBounds(eventId, startTime, endTime);
    }
}
