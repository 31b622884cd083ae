package dev.campfire.alert;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * An operator-facing alert about a source (or about the discovery queue when {@code sourceId} is
 * null). Alerts are append-only apart from acknowledgement.
 *
 * <p>Maps to the {@code source_alerts} table managed by Flyway migrations.
 */
@Entity
@Table(name = "source_alerts")
public class SourceAlert {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "source_id")
    private UUID sourceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "alert_type", nullable = false)
    private AlertType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertSeverity severity;

    @Column(nullable = false)
    private String message;

    @Column(name = "acknowledged_at")
    private Instant acknowledgedAt;

    @Column(name = "acknowledged_by")
    private String acknowledgedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected SourceAlert() {
        // JPA requires no-arg constructor
    }

    public SourceAlert(UUID sourceId, AlertType type, AlertSeverity severity, String message) {
        this.sourceId = sourceId;
        this.type = type;
        this.severity = severity;
        this.message = message;
    }

    @PrePersist
    protected void onCreate() {
        this.createdAt = Instant.now().truncatedTo(ChronoUnit.MICROS);
    }

    public void acknowledge(String actor, Instant at) {
        if (acknowledgedAt == null) {
            this.acknowledgedAt = at;
            this.acknowledgedBy = actor;
        }
    }

    public boolean isAcknowledged() {
        return acknowledgedAt != null;
    }

    public UUID getId() {
        return id;
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public Instant getAcknowledgedAt() {
        return acknowledgedAt;
    }

    public String getAcknowledgedBy() {
        return acknowledgedBy;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
