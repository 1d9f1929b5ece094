package com.campussecurity.dispatch.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed-location signal source: an ESP32 panic button or an AI vision/audio detector.
 * The device's beacon is where its signals are raised.
 */
@Entity
@Table(name = "physical_devices", indexes = {
    @Index(name = "idx_device_device_id", columnList = "device_id", unique = true),
    @Index(name = "idx_device_beacon", columnList = "beacon_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PhysicalDevice {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * e.g. "ESP32-001", "AI-VISION-01"
     */
    @Column(name = "device_id", nullable = false, unique = true, length = 100)
    private String deviceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "device_type", nullable = false, length = 30)
    private DeviceType deviceType;

    @Column(name = "beacon_id", nullable = false)
    private Long beaconId;

    private String name;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;
}
