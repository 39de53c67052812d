package com.pricegate.domain.model;

import java.time.YearMonth;

/**
 * Requests spent on a quota-limited provider in one calendar month
 */
public record RequestCounter(int count, int month, int year) {

    public static RequestCounter startOf(YearMonth yearMonth) {
        return new RequestCounter(0, yearMonth.getMonthValue(), yearMonth.getYear());
    }

    public boolean isFor(YearMonth yearMonth) {
        return month == yearMonth.getMonthValue() && year == yearMonth.getYear();
    }

    public RequestCounter increment() {
        return new RequestCounter(count + 1, month, year);
    }
}
