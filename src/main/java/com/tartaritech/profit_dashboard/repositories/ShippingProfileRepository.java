package com.tartaritech.profit_dashboard.repositories;

import java.util.List;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import com.tartaritech.profit_dashboard.entities.ShippingProfile;

@Repository
public interface ShippingProfileRepository extends JpaRepository<ShippingProfile, Long> {

    List<ShippingProfile> findAllByOrderByPriorityAscCreatedAtAscIdAsc();

    List<ShippingProfile> findByActiveTrueOrderByPriorityAscCreatedAtAscIdAsc();
}
