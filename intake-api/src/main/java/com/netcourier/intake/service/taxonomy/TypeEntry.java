package com.netcourier.intake.service.taxonomy;

import java.util.Locale;

public record TypeEntry(String name, String description) {

    public TypeEntry {
        description = description == null ? "" : description;
    }

    public boolean matchesIgnoringCase(String candidate) {
        return name != null && candidate != null
                && name.toLowerCase(Locale.ROOT).equals(candidate.toLowerCase(Locale.ROOT));
    }
}
