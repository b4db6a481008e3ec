package io.taulite.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Named, ordered, append-only collection of {@link Delta}s.
 * <p>
 * Ownership:
 *  - Every delta handed to {@link #create} or {@link #append} is deep-copied
 *    (fresh id, same value and interval); callers never alias our elements.
 * <p>
 * Invariants:
 *  - name is non-empty and there is at least one delta.
 *  - Indices are stable: append only extends the tail, so a delta at index i
 *    stays at index i (and keeps its id) for the life of the sequence.
 *  - Insertion order is treated as time order; it is not checked.
 * <p>
 * Not thread safe. Callers that share a sequence across threads must
 * serialize access themselves.
 */
public final class Sequence {
    private final String id;
    private final String name;
    private final List<Delta> deltas;

    private Sequence(String id, String name, List<Delta> deltas) {
        this.id = id;
        this.name = name;
        this.deltas = deltas;
    }

    /**
     * Create a sequence holding deep copies of {@code initial}.
     *
     * @throws ValidationException EMPTY_NAME or EMPTY_DELTAS
     */
    public static Sequence create(String name, Collection<Delta> initial) {
        if (name == null || name.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_NAME, "sequence name must not be empty");
        }
        if (initial == null || initial.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_DELTAS, "sequence needs at least one delta");
        }
        List<Delta> owned = new ArrayList<>(initial.size());
        for (Delta d : initial) {
            owned.add(Objects.requireNonNull(d, "delta").copy());
        }
        return new Sequence(Ulid.next(), name, owned);
    }

    /** Rebuild a sequence with known ids (decoder path); deltas are taken as-is. */
    static Sequence restore(String id, String name, List<Delta> deltas) {
        if (name.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_NAME, "sequence name must not be empty");
        }
        if (deltas.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_DELTAS, "sequence needs at least one delta");
        }
        return new Sequence(id, name, new ArrayList<>(deltas));
    }

    /**
     * Append deep copies of {@code newDeltas} to the tail.
     *
     * @throws ValidationException EMPTY_INPUT if nothing is given
     */
    public void append(Collection<Delta> newDeltas) {
        if (newDeltas == null || newDeltas.isEmpty()) {
            throw new ValidationException(ValidationException.Reason.EMPTY_INPUT, "nothing to append");
        }
        // copy first so a null element leaves the sequence untouched
        List<Delta> copies = new ArrayList<>(newDeltas.size());
        for (Delta d : newDeltas) {
            copies.add(Objects.requireNonNull(d, "delta").copy());
        }
        deltas.addAll(copies);
    }

    /** Deep copy of the whole sequence under a fresh id (and fresh delta ids). */
    public Sequence copy() {
        return create(name, deltas);
    }

    public String id() { return id; }

    public String name() { return name; }

    public int size() { return deltas.size(); }

    public Delta get(int index) { return deltas.get(index); }

    /** Read-only view, live with respect to later appends. */
    public List<Delta> deltas() { return Collections.unmodifiableList(deltas); }

    /**
     * Point lookup: the most recently appended delta whose interval contains
     * {@code timeNs}, if any.
     */
    public Optional<Delta> valueAt(long timeNs) {
        for (int i = deltas.size() - 1; i >= 0; i--) {
            Delta d = deltas.get(i);
            if (d.isValid(timeNs)) return Optional.of(d);
        }
        return Optional.empty();
    }

    /** Deltas whose interval intersects [fromNs, untilNs), in index order. */
    public List<Delta> overlapping(long fromNs, long untilNs) {
        List<Delta> out = new ArrayList<>();
        for (Delta d : deltas) {
            if (d.overlaps(fromNs, untilNs)) out.add(d);
        }
        return out;
    }

    /** Encode as id, name, count and one length-prefixed delta record per element. */
    public byte[] serialize() {
        return RecordCodec.encodeSequence(this);
    }

    /**
     * Decode a record produced by {@link #serialize()}.
     * Delta decoding errors propagate unchanged.
     */
    public static Sequence deserialize(byte[] record) {
        return RecordCodec.decodeSequence(record);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Sequence s)) return false;
        return id.equals(s.id) && name.equals(s.name) && deltas.equals(s.deltas);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, deltas);
    }

    @Override public String toString() {
        return "Sequence{" + name + ", id=" + id + ", size=" + deltas.size() + "}";
    }
}
