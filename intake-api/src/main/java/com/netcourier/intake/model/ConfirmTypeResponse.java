package com.netcourier.intake.model;

import com.netcourier.intake.service.taxonomy.TypeEntry;

import java.util.List;

public record ConfirmTypeResponse(boolean success, List<TypeEntry> types) {

    public static ConfirmTypeResponse succeeded(List<TypeEntry> types) {
        return new ConfirmTypeResponse(true, types);
    }
}
