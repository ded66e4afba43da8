package com.codegym.backend.repositories;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.codegym.backend.entities.Member;

public interface MemberRepository extends JpaRepository<Member, UUID> {

    boolean existsByEmailIgnoreCase(String email);

    List<Member> findAllByOrderByRegistrationDateDesc();

    List<Member> findAllByOrderByFullNameAsc();

    long countByActiveUntilGreaterThanEqual(LocalDate day);
}
