package io.taulite.server.dto;

import io.taulite.core.Sequence;

import java.util.List;

/** JSON view of a whole sequence (a stored series or a lens output). */
public record SequenceView(String id, String name, List<DeltaView> deltas) {

    public static SequenceView of(Sequence s) {
        return new SequenceView(s.id(), s.name(), s.deltas().stream().map(DeltaView::of).toList());
    }
}
