package com.diamondline.ingest.controller;

import com.diamondline.ingest.dto.WatermarkDTO;
import com.diamondline.ingest.service.WindowSelector;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;

@RestController
@RequestMapping("/api/watermarks")
public class WatermarkController {

    private final WindowSelector windowSelector;
    private final Clock clock;

    public WatermarkController(WindowSelector windowSelector, Clock clock) {
        this.windowSelector = windowSelector;
        this.clock = clock;
    }

    @GetMapping("/{jobName}")
    public WatermarkDTO get(@PathVariable("jobName") String jobName) {
        return new WatermarkDTO(jobName, windowSelector.currentWatermark(jobName),
                windowSelector.nextWindow(jobName, LocalDate.now(clock)));
    }
}
