package com.tony.leagueAnalytics.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeagueDatesTest {

    @Test
    @DisplayName("Devrait lire le format jour-mois-année")
    void shouldParseDayMonthYear() {
        assertThat(LeagueDates.parse("07-11-2025")).isEqualTo(LocalDate.of(2025, 11, 7));
        assertThat(LeagueDates.parse(" 01-02-2026 ")).isEqualTo(LocalDate.of(2026, 2, 1));
    }

    @Test
    @DisplayName("Devrait comparer les dates chronologiquement et non comme du texte")
    void shouldCompareChronologically() {
        // "02-01-2026" < "31-12-2025" en ordre lexicographique
        assertThat(LeagueDates.parse("02-01-2026")).isAfter(LeagueDates.parse("31-12-2025"));
    }

    @Test
    @DisplayName("Devrait rejeter une date illisible ou impossible")
    void shouldRejectInvalidDates() {
        assertThatThrownBy(() -> LeagueDates.parse("2025-11-07")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LeagueDates.parse("31-02-2025")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> LeagueDates.parse(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Devrait reformater dans le même format")
    void shouldFormatBack() {
        assertThat(LeagueDates.format(LocalDate.of(2025, 9, 1))).isEqualTo("01-09-2025");
    }
}
