package com.diamondline.ingest.controller;

import com.diamondline.ingest.dto.SettlementSummaryDTO;
import com.diamondline.ingest.service.SettlementService;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/settlement")
public class SettlementController {

    private final SettlementService settlementService;

    public SettlementController(SettlementService settlementService) {
        this.settlementService = settlementService;
    }

    @PostMapping("/run")
    public SettlementSummaryDTO run() {
        try {
            return settlementService.settleOpenBets();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException e) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Store unavailable", e);
        }
    }
}
