package dev.jobmatcher.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Registered push target. Registration and retirement are handled outside this service.
 */
@Data
@Entity
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "device_targets")
public class DeviceTarget {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 255)
    private String deviceToken;

    @Column(nullable = false)
    private boolean active;
}
