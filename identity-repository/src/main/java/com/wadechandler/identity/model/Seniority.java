package com.wadechandler.identity.model;

import java.util.Comparator;

/**
 * Total order of contacts by age: {@code createdAt} ascending, then {@code id} ascending.
 */
public final class Seniority {

    public static final Comparator<Contact> OLDEST_FIRST = Comparator
            .comparing(Contact::getCreatedAt)
            .thenComparing(Contact::getId);

    private Seniority() {
        // static helpers only
    }

    public static Contact olderOf(Contact a, Contact b) {
        return OLDEST_FIRST.compare(a, b) <= 0 ? a : b;
    }
}
