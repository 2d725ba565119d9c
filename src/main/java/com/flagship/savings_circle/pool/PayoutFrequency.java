package com.flagship.savings_circle.pool;

import java.time.LocalDate;

/**
 * How often a round is scheduled to pay out.
 */
public enum PayoutFrequency {
    WEEKLY {
        @Override
        public LocalDate advance(LocalDate from, int periods) {
            return from.plusWeeks(periods);
        }
    },
    BIWEEKLY {
        @Override
        public LocalDate advance(LocalDate from, int periods) {
            return from.plusWeeks(2L * periods);
        }
    },
    MONTHLY {
        @Override
        public LocalDate advance(LocalDate from, int periods) {
            return from.plusMonths(periods);
        }
    };

    /**
     * Moves a date forward by the given number of payout periods.
     */
    public abstract LocalDate advance(LocalDate from, int periods);
}
