package com.pixperfect.assets.common.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Metadata row for a stored image. The blob itself lives in the configured
 * storage backend under {@link #storageKey}.
 */
@Entity
@Getter
@Setter
@ToString
@NoArgsConstructor
@Table(name = "assets", indexes = @Index(name = "idx_assets_owner", columnList = "owner_id"))
public class ImageAsset {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "owner_id", nullable = false)
    private Long ownerId;

    // Read-only association so the schema carries the foreign key to accounts.
    @ToString.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", insertable = false, updatable = false)
    private Account owner;

    @Column(name = "storage_key", nullable = false)
    private String storageKey;

    @Column(name = "overlay_props", columnDefinition = "TEXT")
    private String overlayProps;

    @Column(name = "text_overlay", columnDefinition = "TEXT")
    private String textOverlay;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public ImageAsset(Long ownerId, String storageKey, String overlayProps, String textOverlay) {
        this.ownerId = ownerId;
        this.storageKey = storageKey;
        this.overlayProps = overlayProps;
        this.textOverlay = textOverlay;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
