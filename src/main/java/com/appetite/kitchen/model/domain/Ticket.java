package com.appetite.kitchen.model.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A kitchen ticket: one unit of work at a preparation station.
 *
 * The ticket is persisted by {@link com.appetite.kitchen.repository.TicketRepository}
 * and projected into the in-memory ticket cache. Only status, notes, reason and the
 * lifecycle timestamps change after creation; the id never does.
 */
@Getter
@Setter
@Entity
@Table(name = "kitchen_ticket", indexes = {
        @Index(name = "idx_ticket_order_item", columnList = "orderItemId"),
        @Index(name = "idx_ticket_station_status", columnList = "station,status")
})
public class Ticket {
    @Id
    private UUID id;

    private UUID orderId;
    private UUID orderItemId;
    private UUID menuItemId;

    @Column(nullable = false)
    private String station;

    @Column(nullable = false)
    private String status;

    private int quantity;

    private UUID reasonCodeId;

    @Column(length = 1024)
    private String notes;

    // Denormalized for display, resolved by the producer
    private String menuItemName;
    private String stationName;
    private String tableNumber;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant deliveredAt;

    public Ticket() {
    }

    public Ticket(UUID id, String station, String status) {
        this.id = id;
        this.station = station;
        this.status = status;
    }

    /**
     * Field-by-field copy, used by the cache to update tickets without mutating
     * instances already handed out to readers.
     */
    public Ticket copy() {
        Ticket copy = new Ticket(id, station, status);
        copy.orderId = orderId;
        copy.orderItemId = orderItemId;
        copy.menuItemId = menuItemId;
        copy.quantity = quantity;
        copy.reasonCodeId = reasonCodeId;
        copy.notes = notes;
        copy.menuItemName = menuItemName;
        copy.stationName = stationName;
        copy.tableNumber = tableNumber;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.startedAt = startedAt;
        copy.finishedAt = finishedAt;
        copy.deliveredAt = deliveredAt;
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Ticket ticket = (Ticket) o;
        return Objects.equals(id, ticket.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Ticket{" +
                "id=" + id +
                ", station='" + station + '\'' +
                ", status='" + status + '\'' +
                ", orderId=" + orderId +
                ", orderItemId=" + orderItemId +
                ", quantity=" + quantity +
                ", tableNumber='" + tableNumber + '\'' +
                '}';
    }
}
