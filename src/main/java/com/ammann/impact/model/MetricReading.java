/* (C)2026 */
package com.ammann.impact.model;

import io.quarkus.hibernate.orm.panache.PanacheEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * Single metric observation for one customer, linked to the business event it is analyzed
 * against. Stored in long format: one row per (timestamp, customer, field).
 */
@Entity
@Table(name = MetricReading.TABLE_NAME, indexes = {
        @Index(name = "idx_metric_reading_event_ts", columnList = "event_id, observed_at"),
        @Index(name = "idx_metric_reading_field", columnList = "field_name")
})
public class MetricReading extends PanacheEntity
{
    public static final String TABLE_NAME = "metric_reading";

    @Column(name = "event_id", nullable = false, length = 64)
    @NotNull
    public String eventId;

    @Column(name = "customer_id", length = 64)
    public String customerId;

    @Column(name = "observed_at", nullable = false)
    @NotNull
    public Instant observedAt;

    /**
     * Metric name, for example sentiment_score or churn_risk.
     */
    @Column(name = "field_name", nullable = false, length = 64)
    @NotNull
    public String fieldName;

    @Column(name = "metric_value")
    public Double value;

    public MetricReading()
    {
    }

    public MetricReading(String eventId, String customerId, Instant observedAt, String fieldName, Double value)
    {
        this.eventId = eventId;
        this.customerId = customerId;
        this.observedAt = observedAt;
        this.fieldName = fieldName;
        this.value = value;
    }

    /**
     * Non-null readings of the given fields for an event, ordered by observation time and
     * customer.
     */
    public static List<MetricReading> findForEvent(String eventId, Collection<String> fields)
    {
        return list("eventId = ?1 and fieldName in ?2 and value is not null order by observedAt, customerId",
                eventId, fields);
    }
}
