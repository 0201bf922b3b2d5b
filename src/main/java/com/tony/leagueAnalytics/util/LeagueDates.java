package com.tony.leagueAnalytics.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;

/**
 * Les dates des feuilles de match arrivent au format texte jour-mois-année (ex: "07-11-2025").
 * Toute comparaison passe par {@link LocalDate}, jamais par la chaîne brute.
 */
public final class LeagueDates {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("dd-MM-uuuu")
            .withResolverStyle(ResolverStyle.STRICT);

    private LeagueDates() {
    }

    public static LocalDate parse(String text) {
        if (text == null) throw new IllegalArgumentException("Date manquante");
        try {
            return LocalDate.parse(text.trim(), FORMAT);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Date illisible (attendu jj-mm-aaaa) : " + text, e);
        }
    }

    public static String format(LocalDate date) {
        return date.format(FORMAT);
    }
}
