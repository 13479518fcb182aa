package com.sandkev.tradevol.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AggregatedHistoricalPoint(LocalDate date, BigDecimal totalVolumeUsd) {}
