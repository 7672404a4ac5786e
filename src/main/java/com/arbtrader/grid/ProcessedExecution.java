package com.arbtrader.grid;

import java.time.LocalDateTime;

/** Execution already applied to the grid, kept for de-duplication until its market moves past it. */
public record ProcessedExecution(String executionId, String market, LocalDateTime time) {}
