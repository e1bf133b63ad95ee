package com.gillianbc.networth.market;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Month-start close of a broad-market index.
 */
@Getter
@EqualsAndHashCode
@ToString
public class IndexClose {

    private final LocalDate date;
    private final double close;

    public IndexClose(LocalDate date, double close) {
        this.date = Objects.requireNonNull(date, "date must not be null");
        if (close <= 0) {
            throw new IllegalArgumentException("close must be > 0");
        }
        this.close = close;
    }

    static IndexClose of(String isoDate, double close) {
        return new IndexClose(LocalDate.parse(isoDate), close);
    }
}
