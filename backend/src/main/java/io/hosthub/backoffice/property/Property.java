package io.hosthub.backoffice.property;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/**
 * A rentable property. Only the fields needed to fan owner-scoped recurrence rules out to concrete
 * properties are mapped here; the rest of the property record belongs to the back office.
 */
@Entity
@Table(name = "properties")
public class Property {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "owner_id", nullable = false)
  private UUID ownerId;

  @Column(name = "name", nullable = false, length = 200)
  private String name;

  @Column(name = "is_active", nullable = false)
  private boolean active;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Property() {}

  public Property(UUID ownerId, String name) {
    this.ownerId = ownerId;
    this.name = name;
    this.active = true;
    this.createdAt = Instant.now();
  }

  public void setActive(boolean active) {
    this.active = active;
  }

  public UUID getId() {
    return id;
  }

  public UUID getOwnerId() {
    return ownerId;
  }

  public String getName() {
    return name;
  }

  public boolean isActive() {
    return active;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
