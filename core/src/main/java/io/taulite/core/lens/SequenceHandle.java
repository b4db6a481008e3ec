package io.taulite.core.lens;

import io.taulite.core.Delta;
import io.taulite.core.Sequence;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Non-owning reference from a {@link Lens} to one of its input sequences.
 * <p>
 * A lens never keeps a sequence alive and never copies it at bind time. It
 * asks the handle on every {@code apply}, so appends made after binding are
 * visible, and a handle whose target has gone away resolves empty.
 */
@FunctionalInterface
public interface SequenceHandle {

    /** The current target, or empty if it no longer exists. */
    Optional<Sequence> resolve();

    /** Handle to a sequence owned by the caller; it always resolves. */
    static SequenceHandle of(Sequence sequence) {
        Objects.requireNonNull(sequence, "sequence");
        return () -> Optional.of(sequence);
    }

    /**
     * The handle this one reads through. Handles that share an origin read the
     * same underlying sequence, possibly reshaped.
     */
    default SequenceHandle origin() {
        return this;
    }

    /** Apply this handle's reshaping to {@code base} in place of its origin's sequence. */
    default Sequence deriveFrom(Sequence base) {
        return base;
    }

    /**
     * The {@code prev} view of {@code source}: element i carries the value of
     * source element i-1 under the interval of source element i. Element 0
     * repeats the first value, so a return computed against it is 0.
     */
    static SequenceHandle lagged(SequenceHandle source) {
        Objects.requireNonNull(source, "source");
        return new SequenceHandle() {
            @Override
            public Optional<Sequence> resolve() {
                return source.resolve().map(s -> shiftByOne(s));
            }

            @Override
            public SequenceHandle origin() {
                return source.origin();
            }

            @Override
            public Sequence deriveFrom(Sequence base) {
                return shiftByOne(source.deriveFrom(base));
            }
        };
    }

    private static Sequence shiftByOne(Sequence s) {
        List<Delta> shifted = new ArrayList<>(s.size());
        double previous = s.get(0).value();
        for (Delta d : s.deltas()) {
            shifted.add(Delta.create(previous, d.validFromNs(), d.validUntilNs()));
            previous = d.value();
        }
        return Sequence.create(s.name() + "~prev", shifted);
    }
}
