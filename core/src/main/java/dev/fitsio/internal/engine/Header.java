/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.fitsio.internal.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

import dev.fitsio.engine.Status;

/**
 * The ordered records of one header, without the END record. Keywords are
 * stored upper-case.
 */
final class Header {

    private final List<HeaderCard> cards;

    Header() {
        this.cards = new ArrayList<>();
    }

    Header(List<HeaderCard> cards) {
        this.cards = new ArrayList<>(cards);
    }

    Header copy() {
        return new Header(cards);
    }

    List<HeaderCard> cards() {
        return cards;
    }

    HeaderCard find(String keyword) {
        String key = keyword.toUpperCase(Locale.ROOT);
        for (HeaderCard card : cards) {
            if (card.hasValue() && card.keyword().equals(key)) {
                return card;
            }
        }
        return null;
    }

    boolean contains(String keyword) {
        return find(keyword) != null;
    }

    String stringValue(String keyword) {
        HeaderCard card = find(keyword);
        if (card == null || card.value().isEmpty()) {
            return null;
        }
        return CardValues.isString(card.value()) ? CardValues.parseString(card.value()) : card.value();
    }

    long requireLong(String keyword, int missingStatus) throws StatusException {
        HeaderCard card = find(keyword);
        if (card == null || card.value().isEmpty()) {
            throw new StatusException(missingStatus);
        }
        Number number = CardValues.parseNumber(card.value(), missingStatus);
        if (!(number instanceof Long)) {
            throw new StatusException(missingStatus);
        }
        return number.longValue();
    }

    long longValue(String keyword, long defaultValue) throws StatusException {
        HeaderCard card = find(keyword);
        if (card == null || card.value().isEmpty()) {
            return defaultValue;
        }
        return CardValues.parseNumber(card.value(), Status.BAD_INTKEY).longValue();
    }

    double doubleValue(String keyword, double defaultValue) throws StatusException {
        HeaderCard card = find(keyword);
        if (card == null || card.value().isEmpty()) {
            return defaultValue;
        }
        return CardValues.parseNumber(card.value(), Status.BAD_DOUBLEKEY).doubleValue();
    }

    /**
     * Replaces the first record with the same keyword, or appends the record.
     */
    void set(HeaderCard card) {
        for (int i = 0; i < cards.size(); i++) {
            HeaderCard existing = cards.get(i);
            if (existing.hasValue() && existing.keyword().equals(card.keyword())) {
                cards.set(i, card);
                return;
            }
        }
        cards.add(card);
    }

    void remove(String keyword) {
        String key = keyword.toUpperCase(Locale.ROOT);
        cards.removeIf(card -> card.keyword().equals(key));
    }

    void removeIf(Predicate<HeaderCard> filter) {
        cards.removeIf(filter);
    }

    /**
     * Puts the given records at the top, removing any older records with the same keywords.
     */
    void setLeading(List<HeaderCard> leading) {
        for (HeaderCard card : leading) {
            cards.removeIf(existing -> existing.keyword().equals(card.keyword()));
        }
        cards.addAll(0, leading);
    }
}
