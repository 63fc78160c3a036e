package dev.leaddispatch.model;

import dev.leaddispatch.lookup.NominatimPlace;

import java.util.List;

/**
 * Result of an external lookup. A failed lookup carries no places and a
 * tagged {@link LookupFailure}; it is never cached.
 */
public record LookupResult(
        List<NominatimPlace> places,
        boolean fromCache,
        LookupFailure failure,
        String failureMessage) {

    public static LookupResult fetched(List<NominatimPlace> places) {
        return new LookupResult(List.copyOf(places), false, null, null);
    }

    public static LookupResult cached(List<NominatimPlace> places) {
        return new LookupResult(List.copyOf(places), true, null, null);
    }

    public static LookupResult failed(LookupFailure failure, String message) {
        return new LookupResult(List.of(), false, failure, message);
    }

    public boolean isFailure() {
        return failure != null;
    }
}
