package com.wadechandler.identity.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "contacts")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Contact {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 50)
    private String phoneNumber;

    private String email;

    /** Owning primary's id; {@code null} for primaries. */
    private Long linkedId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private LinkPrecedence linkPrecedence = LinkPrecedence.PRIMARY;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private Instant updatedAt;

    private Instant deletedAt;

    public boolean isPrimary() {
        return linkPrecedence == LinkPrecedence.PRIMARY;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }

    /**
     * The id of the primary this contact belongs to: its own id when primary,
     * otherwise {@link #linkedId}.
     */
    public Long rootId() {
        return isPrimary() ? id : linkedId;
    }
}
