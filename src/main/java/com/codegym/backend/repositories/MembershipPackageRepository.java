package com.codegym.backend.repositories;

import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.codegym.backend.entities.MembershipPackage;

public interface MembershipPackageRepository extends JpaRepository<MembershipPackage, UUID> {

    List<MembershipPackage> findAllByOrderByDurationMonthsAsc();

    boolean existsByNameIgnoreCase(String name);
}
