package com.titlesearch.pipeline.adapter;

import java.time.LocalDate;

public record DateRange(LocalDate start, LocalDate end) {
    public static DateRange lastYears(int years, LocalDate today) {
        return new DateRange(today.minusYears(Math.max(1, years)), today);
    }
}
