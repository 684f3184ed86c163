package com.company.anomaly.domain;

import lombok.Value;

import java.time.LocalDate;

@Value
public class DailyAnomalyCount {
    LocalDate date;
    long count;
}
