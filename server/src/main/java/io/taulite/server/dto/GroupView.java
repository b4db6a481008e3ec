package io.taulite.server.dto;

import io.taulite.core.Group;

import java.util.List;

public record GroupView(String id, List<SequenceView> sequences) {

    public static GroupView of(Group g) {
        return new GroupView(g.id(), g.sequences().stream().map(SequenceView::of).toList());
    }
}
