package io.taulite.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered, append-only collection of {@link Sequence}s.
 * <p>
 * Same discipline as {@link Sequence}, one level up: every sequence is
 * deep-copied on the way in, the group is never empty, and appends only
 * extend the tail.
 */
public final class Group {
    private final String id;
    private final List<Sequence> sequences;

    private Group(String id, List<Sequence> sequences) {
        this.id = id;
        this.sequences = sequences;
    }

    /**
     * @throws ValidationException EMPTY_SEQUENCES if {@code initial} is empty
     */
    public static Group create(Collection<Sequence> initial) {
        if (initial == null || initial.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_SEQUENCES, "group needs at least one sequence");
        }
        List<Sequence> owned = new ArrayList<>(initial.size());
        for (Sequence s : initial) {
            owned.add(Objects.requireNonNull(s, "sequence").copy());
        }
        return new Group(Ulid.next(), owned);
    }

    static Group restore(String id, List<Sequence> sequences) {
        if (sequences.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_SEQUENCES, "group needs at least one sequence");
        }
        return new Group(id, new ArrayList<>(sequences));
    }

    /**
     * @throws ValidationException EMPTY_INPUT if nothing is given
     */
    public void append(Collection<Sequence> newSequences) {
        if (newSequences == null || newSequences.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_INPUT, "nothing to append");
        }
        List<Sequence> copies = new ArrayList<>(newSequences.size());
        for (Sequence s : newSequences) {
            copies.add(Objects.requireNonNull(s, "sequence").copy());
        }
        sequences.addAll(copies);
    }

    public String id() { return id; }

    public int size() { return sequences.size(); }

    public Sequence get(int index) { return sequences.get(index); }

    public List<Sequence> sequences() { return Collections.unmodifiableList(sequences); }

    public byte[] serialize() {
        return RecordCodec.encodeGroup(this);
    }

    public static Group deserialize(byte[] record) {
        return RecordCodec.decodeGroup(record);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Group g)) return false;
        return id.equals(g.id) && sequences.equals(g.sequences);
    }

    @Override public int hashCode() {
        return Objects.hash(id, sequences);
    }

    @Override public String toString() {
        return "Group{id=" + id + ", size=" + sequences.size() + "}";
    }
}
