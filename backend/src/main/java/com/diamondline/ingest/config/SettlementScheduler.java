package com.diamondline.ingest.config;

import com.diamondline.ingest.dto.SettlementSummaryDTO;
import com.diamondline.ingest.service.SettlementService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class SettlementScheduler {
    private static final Logger log = LoggerFactory.getLogger(SettlementScheduler.class);

    private final SettlementService settlementService;

    public SettlementScheduler(SettlementService settlementService) {
        this.settlementService = settlementService;
    }

    // "-" disables the trigger
    @Scheduled(cron = "${diamondline.settlement.cron:-}")
    public void settleOpenBets() {
        try {
            SettlementSummaryDTO summary = settlementService.settleOpenBets();
            if (summary.settled() > 0) {
                log.info("Background settlement closed {} of {} open bets.", summary.settled(), summary.getChecked());
            }
        } catch (Exception e) {
            log.warn("Background settlement failed: {}", e.getMessage());
        }
    }
}
