package com.diamondline.ingest.controller;

import com.diamondline.ingest.dto.AliasAuditDTO;
import com.diamondline.ingest.model.AliasResolutionAudit;
import com.diamondline.ingest.repository.AliasResolutionAuditRepository;
import com.diamondline.ingest.service.IdentityResolver;
import org.springframework.data.domain.PageRequest;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/identity")
public class IdentityAuditController {

    private final AliasResolutionAuditRepository auditRepository;
    private final IdentityResolver identityResolver;

    public IdentityAuditController(AliasResolutionAuditRepository auditRepository, IdentityResolver identityResolver) {
        this.auditRepository = auditRepository;
        this.identityResolver = identityResolver;
    }

    @GetMapping("/audits")
    public List<AliasAuditDTO> listAudits(@RequestParam(value = "page", defaultValue = "0") int page,
                                          @RequestParam(value = "size", defaultValue = "50") int size) {
        return auditRepository.findAllByOrderByResolvedAtDesc(PageRequest.of(page, size))
                .map(IdentityAuditController::toDto)
                .getContent();
    }

    // alias rows edited directly in the store become visible after a reload
    @PostMapping("/reload")
    public void reload() {
        identityResolver.reload();
    }

    private static AliasAuditDTO toDto(AliasResolutionAudit a) {
        return new AliasAuditDTO(a.getId(), a.getSource(), a.getKind().name(), a.getRawToken(),
                a.getMethod().name(), a.getCanonicalId(), a.getDetail(), a.getResolvedAt());
    }
}
