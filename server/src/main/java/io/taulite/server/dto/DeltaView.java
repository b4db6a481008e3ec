package io.taulite.server.dto;

import io.taulite.core.Delta;

public record DeltaView(String id, double value, long validFromNs, long validUntilNs) {

    public static DeltaView of(Delta d) {
        return new DeltaView(d.id(), d.value(), d.validFromNs(), d.validUntilNs());
    }
}
