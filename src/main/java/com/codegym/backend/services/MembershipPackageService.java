package com.codegym.backend.services;

import java.util.List;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.codegym.backend.audit.Auditable;
import com.codegym.backend.dto.catalog.MembershipPackageRequestDTO;
import com.codegym.backend.dto.catalog.MembershipPackageResponseDTO;
import com.codegym.backend.entities.MembershipPackage;
import com.codegym.backend.exceptions.ConflictException;
import com.codegym.backend.exceptions.ResourceNotFoundException;
import com.codegym.backend.mappers.CatalogMapper;
import com.codegym.backend.repositories.InvoiceRepository;
import com.codegym.backend.repositories.MembershipPackageRepository;
import com.codegym.backend.services.util.EntityIds;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class MembershipPackageService {

    private final MembershipPackageRepository packageRepository;
    private final InvoiceRepository invoiceRepository;

    @Transactional(readOnly = true)
    public List<MembershipPackageResponseDTO> listPackages() {
        return packageRepository.findAllByOrderByDurationMonthsAsc().stream()
                .map(CatalogMapper::toResponseDTO)
                .toList();
    }

    public MembershipPackage findById(String id) {
        UUID uuid = EntityIds.parseExisting(id, "Package");
        return packageRepository.findById(uuid)
                .orElseThrow(() -> new ResourceNotFoundException("Package not found"));
    }

    @Auditable(action = "PACKAGE_CREATED", entityType = "MembershipPackage")
    @Transactional
    public MembershipPackageResponseDTO create(MembershipPackageRequestDTO request) {
        MembershipPackage pkg = new MembershipPackage();
        CatalogMapper.apply(request, pkg);
        MembershipPackage saved = packageRepository.save(pkg);
        log.info("Package '{}' created ({} months)", saved.getName(), saved.getDurationMonths());
        return CatalogMapper.toResponseDTO(saved);
    }

    @Auditable(action = "PACKAGE_UPDATED", entityType = "MembershipPackage")
    @Transactional
    public MembershipPackageResponseDTO update(String id, MembershipPackageRequestDTO request) {
        MembershipPackage pkg = findById(id);
        CatalogMapper.apply(request, pkg);
        return CatalogMapper.toResponseDTO(packageRepository.save(pkg));
    }

    /**
     * Invoices reference their package, so a sold package stays in the catalog.
     */
    @Auditable(action = "PACKAGE_DELETED", entityType = "MembershipPackage")
    @Transactional
    public void delete(String id) {
        MembershipPackage pkg = findById(id);
        if (invoiceRepository.existsByMembershipPackageId(pkg.getId())) {
            throw new ConflictException("Package '" + pkg.getName() + "' has invoices and cannot be deleted");
        }
        packageRepository.delete(pkg);
        log.info("Package '{}' deleted", pkg.getName());
    }
}
