package com.campussecurity.dispatch.repository;

import com.campussecurity.dispatch.entity.PhysicalDevice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface PhysicalDeviceRepository extends JpaRepository<PhysicalDevice, Long> {

    Optional<PhysicalDevice> findByDeviceIdAndActiveTrue(String deviceId);
}
