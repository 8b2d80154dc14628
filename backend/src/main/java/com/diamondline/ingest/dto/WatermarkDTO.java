package com.diamondline.ingest.dto;

import java.time.LocalDate;

public record WatermarkDTO(String jobName, LocalDate lastCompletedDate, DateRange nextWindow) {}
