package io.taulite.server.dto;

import io.taulite.core.Delta;

import java.util.Optional;

/** Result of a point query; {@code delta} is null when nothing is valid at the time. */
public record PointResponse(boolean found, DeltaView delta) {

    public static PointResponse of(Optional<Delta> hit) {
        return hit.map(d -> new PointResponse(true, DeltaView.of(d))).orElse(new PointResponse(false, null));
    }
}
