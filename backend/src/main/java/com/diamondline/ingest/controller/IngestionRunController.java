package com.diamondline.ingest.controller;

import com.diamondline.ingest.dto.IngestionRunSummaryDTO;
import com.diamondline.ingest.dto.RejectedRecordDTO;
import com.diamondline.ingest.model.IngestionRun;
import com.diamondline.ingest.repository.IngestionRunRepository;
import com.diamondline.ingest.repository.RejectedRecordRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/runs")
public class IngestionRunController {

    private final IngestionRunRepository runRepository;
    private final RejectedRecordRepository rejectedRecordRepository;

    public IngestionRunController(IngestionRunRepository runRepository,
                                  RejectedRecordRepository rejectedRecordRepository) {
        this.runRepository = runRepository;
        this.rejectedRecordRepository = rejectedRecordRepository;
    }

    @GetMapping
    public List<IngestionRunSummaryDTO> listRuns(@RequestParam(value = "page", defaultValue = "0") int page,
                                                 @RequestParam(value = "size", defaultValue = "20") int size) {
        Page<IngestionRun> p = runRepository.findAllByOrderByStartedAtDesc(PageRequest.of(page, size));
        return p.map(IngestionRunSummaryDTO::from).getContent();
    }

    @GetMapping("/{id}/rejected")
    public List<RejectedRecordDTO> listRejected(@PathVariable("id") Long id) {
        return rejectedRecordRepository.findAllByIngestionRunIdOrderByIdAsc(id).stream()
                .map(r -> new RejectedRecordDTO(r.getId(), r.getUnitKey(), r.getRecordType(), r.getCategory(), r.getReason(), r.getPayload()))
                .toList();
    }
}
