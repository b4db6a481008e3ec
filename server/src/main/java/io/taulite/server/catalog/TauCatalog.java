package io.taulite.server.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.taulite.core.Delta;
import io.taulite.core.Group;
import io.taulite.core.Sequence;
import io.taulite.core.ValidationException;
import io.taulite.core.expr.Expression;
import io.taulite.core.lens.BuiltinTransform;
import io.taulite.core.lens.Lens;
import io.taulite.core.lens.SequenceHandle;
import io.taulite.storage.RecordStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Registry of series, groups and lenses by label.
 * <p>
 * Responsibilities:
 *  - Hide the record store from the HTTP layer: every mutation is written
 *    through to {@link RecordStore} before it returns.
 *  - Serialize access per label. Creates and drops take the registry lock;
 *    appends and reads take only the entry's own monitor.
 *  - Hand lenses checked handles instead of live sequences.
 * <p>
 * Handles:
 *  - carry (label, generation); a series created under the same label after a
 *    drop gets a new generation, so older handles resolve empty and the lens
 *    fails with MISSING_INPUT,
 *  - resolve to a copy taken under the series monitor, so a lens never sees an
 *    append half-applied.
 * <p>
 * Record layout in the store:
 *  - {@code sequence:<label>}  binary Sequence record
 *  - {@code group:<label>}     binary Group record
 *  - {@code lens:<label>}      JSON {@link LensDefinition}
 */
public final class TauCatalog implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(TauCatalog.class.getName());

    public static final int DEFAULT_LABEL_MAX_LENGTH = 32;
    static final String SEQUENCE_PREFIX = "sequence:";
    static final String GROUP_PREFIX = "group:";
    static final String LENS_PREFIX = "lens:";

    private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9_.:-]+");

    private final RecordStore store;
    private final int capacity;
    private final int labelMaxLength;
    private final ObjectMapper json = new ObjectMapper();

    private final Object registry = new Object();
    private final Map<String, SeriesEntry> series = new ConcurrentHashMap<>();
    private final Map<String, GroupEntry> groups = new ConcurrentHashMap<>();
    private final Map<String, LensEntry> lenses = new ConcurrentHashMap<>();
    private final AtomicLong generations = new AtomicLong();

    private static final class SeriesEntry {
        final long generation;
        Sequence sequence; // replaced whole on append, under the entry monitor
        boolean dropped;

        SeriesEntry(long generation, Sequence sequence) {
            this.generation = generation;
            this.sequence = sequence;
        }
    }

    private static final class GroupEntry {
        Group group;
        boolean dropped;

        GroupEntry(Group group) {
            this.group = group;
        }
    }

    private record LensEntry(LensDefinition definition, Lens lens) {}

    public TauCatalog(RecordStore store, int capacity) {
        this(store, capacity, DEFAULT_LABEL_MAX_LENGTH);
    }

    /**
     * Open a catalog over {@code store}, restoring every series, group and
     * lens it already holds.
     *
     * @param capacity maximum number of entries of each kind
     */
    public TauCatalog(RecordStore store, int capacity, int labelMaxLength) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be > 0");
        if (labelMaxLength <= 0) throw new IllegalArgumentException("labelMaxLength must be > 0");
        this.store = Objects.requireNonNull(store, "store");
        this.capacity = capacity;
        this.labelMaxLength = labelMaxLength;
        recover();
    }

    // ---------- series ----------

    public void createSeries(String label, Collection<Delta> deltas) {
        checkLabel(label);
        Sequence sequence = Sequence.create(label, deltas);
        synchronized (registry) {
            if (series.containsKey(label)) {
                throw new CatalogException(CatalogException.Reason.SERIES_ALREADY_EXISTS, "series '" + label + "' already exists");
            }
            ensureRoom(series.size(), "series");
            store.put(SEQUENCE_PREFIX + label, sequence.serialize());
            series.put(label, new SeriesEntry(generations.incrementAndGet(), sequence));
        }
        LOG.info(() -> "Created series " + label + " with " + sequence.size() + " deltas");
    }

    public void dropSeries(String label) {
        synchronized (registry) {
            SeriesEntry entry = requireSeries(label);
            store.delete(SEQUENCE_PREFIX + label);
            series.remove(label);
            synchronized (entry) {
                entry.dropped = true;
            }
        }
        LOG.info(() -> "Dropped series " + label);
    }

    /** @return the series size after the append */
    public int append(String label, Collection<Delta> deltas) {
        SeriesEntry entry = requireSeries(label);
        synchronized (entry) {
            if (entry.dropped) throw seriesNotFound(label);
            Sequence next = snapshot(entry.sequence);
            next.append(deltas);
            store.put(SEQUENCE_PREFIX + label, next.serialize());
            entry.sequence = next;
            int size = next.size();
            LOG.fine(() -> "Appended " + deltas.size() + " deltas to " + label + " (size " + size + ")");
            return size;
        }
    }

    /** Point-in-time copy of the series, ids included. */
    public Sequence series(String label) {
        SeriesEntry entry = requireSeries(label);
        synchronized (entry) {
            if (entry.dropped) throw seriesNotFound(label);
            return snapshot(entry.sequence);
        }
    }

    /** The latest-appended delta valid at {@code timeNs}, if any. */
    public Optional<Delta> queryPoint(String label, long timeNs) {
        SeriesEntry entry = requireSeries(label);
        synchronized (entry) {
            if (entry.dropped) throw seriesNotFound(label);
            return entry.sequence.valueAt(timeNs);
        }
    }

    /**
     * Deltas overlapping [fromNs, untilNs).
     *
     * @throws ValidationException INVALID_INTERVAL if the range is empty
     */
    public List<Delta> range(String label, long fromNs, long untilNs) {
        if (Long.compareUnsigned(untilNs, fromNs) <= 0) {
            throw new ValidationException(ValidationException.Reason.INVALID_INTERVAL,
                    "range end must be greater than range start");
        }
        SeriesEntry entry = requireSeries(label);
        synchronized (entry) {
            if (entry.dropped) throw seriesNotFound(label);
            return entry.sequence.overlapping(fromNs, untilNs);
        }
    }

    public List<String> listSeries() {
        return series.keySet().stream().sorted().toList();
    }

    // ---------- groups ----------

    public void createGroup(String label, List<String> seriesLabels) {
        checkLabel(label);
        Group group = Group.create(snapshots(seriesLabels));
        synchronized (registry) {
            if (groups.containsKey(label)) {
                throw new CatalogException(CatalogException.Reason.GROUP_ALREADY_EXISTS, "group '" + label + "' already exists");
            }
            ensureRoom(groups.size(), "groups");
            store.put(GROUP_PREFIX + label, group.serialize());
            groups.put(label, new GroupEntry(group));
        }
        LOG.info(() -> "Created group " + label + " with " + group.size() + " series");
    }

    /** Copy of the group, ids included. */
    public Group group(String label) {
        GroupEntry entry = requireGroup(label);
        synchronized (entry) {
            if (entry.dropped) throw groupNotFound(label);
            return Group.deserialize(entry.group.serialize());
        }
    }

    /** @return the group size after the append */
    public int appendToGroup(String label, List<String> seriesLabels) {
        GroupEntry entry = requireGroup(label);
        List<Sequence> added = snapshots(seriesLabels);
        synchronized (entry) {
            if (entry.dropped) throw groupNotFound(label);
            Group next = Group.deserialize(entry.group.serialize());
            next.append(added);
            store.put(GROUP_PREFIX + label, next.serialize());
            entry.group = next;
            return next.size();
        }
    }

    public void dropGroup(String label) {
        synchronized (registry) {
            GroupEntry entry = requireGroup(label);
            store.delete(GROUP_PREFIX + label);
            groups.remove(label);
            synchronized (entry) {
                entry.dropped = true;
            }
        }
        LOG.info(() -> "Dropped group " + label);
    }

    public List<String> listGroups() {
        return groups.keySet().stream().sorted().toList();
    }

    /** Apply a lens to every member of a group. */
    public Group applyLensToGroup(String lensLabel, String groupLabel) {
        LensEntry lens = requireLens(lensLabel);
        Group members = group(groupLabel);
        synchronized (lens) {
            return lens.lens().applyToGroup(members);
        }
    }

    // ---------- lenses ----------

    /**
     * Create a lens applying a built-in transform to one series.
     *
     * @throws CatalogException UNKNOWN_TRANSFORM or SERIES_NOT_FOUND
     */
    public void createLens(String label, String sourceLabel, String transformName) {
        BuiltinTransform transform = BuiltinTransform.fromName(transformName).orElseThrow(() ->
                new CatalogException(CatalogException.Reason.UNKNOWN_TRANSFORM, "unknown transform '" + transformName + "'"));
        if (sourceLabel == null) throw seriesNotFound(null);
        List<LensDefinition.Binding> bindings = new ArrayList<>();
        for (String variable : transform.inputVariables()) {
            bindings.add(new LensDefinition.Binding(variable, sourceLabel, BuiltinTransform.isLagged(variable)));
        }
        register(new LensDefinition(label, transform.transformName(), transform.expression(), bindings));
    }

    /**
     * Create a lens from an expression and a variable -> series label mapping.
     * The expression is syntax-checked here.
     */
    public void defineLens(String label, String description, String expression, Map<String, String> inputs) {
        if (expression != null && !expression.isBlank()) {
            Expression.compile(expression);
        }
        List<LensDefinition.Binding> bindings = new ArrayList<>();
        inputs.forEach((variable, seriesLabel) -> {
            if (variable == null || variable.isBlank()) {
                throw new ValidationException(ValidationException.Reason.EMPTY_VARIABLE, "variable name must not be empty");
            }
            if (seriesLabel == null) throw seriesNotFound(null);
            bindings.add(new LensDefinition.Binding(variable, seriesLabel, false));
        });
        register(new LensDefinition(label, Objects.requireNonNullElse(description, ""),
                Objects.requireNonNullElse(expression, ""), bindings));
    }

    /** New lens reading the inputs of {@code inputsFrom} through the expression of {@code expressionFrom}. */
    public void composeLens(String label, String inputsFrom, String expressionFrom) {
        checkLabel(label);
        LensEntry first = requireLens(inputsFrom);
        LensEntry second = requireLens(expressionFrom);
        Lens composed = Lens.compose(label, first.lens(), second.lens());
        var definition = new LensDefinition(label, composed.description(), composed.expression(),
                first.definition().inputs());
        add(new LensEntry(definition, composed));
    }

    public Sequence applyLens(String label) {
        LensEntry entry = requireLens(label);
        synchronized (entry) {
            return entry.lens().apply();
        }
    }

    /** Apply the lens, then look up the delta valid at {@code timeNs}. */
    public Optional<Delta> queryLens(String label, long timeNs) {
        return applyLens(label).valueAt(timeNs);
    }

    public LensDefinition lensDefinition(String label) {
        return requireLens(label).definition();
    }

    public void dropLens(String label) {
        synchronized (registry) {
            requireLens(label);
            store.delete(LENS_PREFIX + label);
            lenses.remove(label);
        }
        LOG.info(() -> "Dropped lens " + label);
    }

    public List<String> listLenses() {
        return lenses.keySet().stream().sorted().toList();
    }

    @Override
    public void close() {
        store.close();
    }

    // ---------- internals ----------

    private void register(LensDefinition definition) {
        checkLabel(definition.label());
        add(new LensEntry(definition, instantiate(definition, true)));
    }

    private void add(LensEntry entry) {
        String label = entry.definition().label();
        synchronized (registry) {
            if (lenses.containsKey(label)) {
                throw new CatalogException(CatalogException.Reason.LENS_ALREADY_EXISTS, "lens '" + label + "' already exists");
            }
            ensureRoom(lenses.size(), "lenses");
            store.put(LENS_PREFIX + label, toJson(entry.definition()));
            lenses.put(label, entry);
        }
        LOG.info(() -> "Created lens " + label + " = " + entry.definition().expression());
    }

    /**
     * Build a live lens from its definition. With {@code strict}, every bound
     * series must exist now; otherwise missing series yield handles that
     * never resolve.
     */
    private Lens instantiate(LensDefinition definition, boolean strict) {
        Lens lens = Lens.create(definition.label(), definition.description(), definition.expression());
        // one handle per series, so bindings over the same series share an origin
        Map<String, SequenceHandle> handles = new HashMap<>();
        for (LensDefinition.Binding b : definition.inputs()) {
            SeriesEntry entry = series.get(b.series());
            if (entry == null && strict) throw seriesNotFound(b.series());
            SequenceHandle handle = handles.computeIfAbsent(b.series(),
                    label -> handle(label, entry == null ? -1L : entry.generation));
            lens.bindInput(b.variable(), b.lagged() ? SequenceHandle.lagged(handle) : handle);
        }
        return lens;
    }

    private SequenceHandle handle(String label, long generation) {
        return () -> {
            SeriesEntry entry = series.get(label);
            if (entry == null || entry.generation != generation) return Optional.empty();
            synchronized (entry) {
                return entry.dropped ? Optional.empty() : Optional.of(snapshot(entry.sequence));
            }
        };
    }

    private List<Sequence> snapshots(List<String> seriesLabels) {
        List<Sequence> out = new ArrayList<>(seriesLabels.size());
        for (String label : seriesLabels) {
            out.add(series(label));
        }
        return out;
    }

    private static Sequence snapshot(Sequence live) {
        return Sequence.deserialize(live.serialize());
    }

    private void recover() {
        try {
            for (String key : store.keys(SEQUENCE_PREFIX)) {
                Sequence s = Sequence.deserialize(store.get(key));
                series.put(key.substring(SEQUENCE_PREFIX.length()), new SeriesEntry(generations.incrementAndGet(), s));
            }
            for (String key : store.keys(GROUP_PREFIX)) {
                groups.put(key.substring(GROUP_PREFIX.length()), new GroupEntry(Group.deserialize(store.get(key))));
            }
            for (String key : store.keys(LENS_PREFIX)) {
                LensDefinition def = json.readValue(store.get(key), LensDefinition.class);
                lenses.put(def.label(), new LensEntry(def, instantiate(def, false)));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("catalog recovery failed", e);
        }
        if (!series.isEmpty() || !groups.isEmpty() || !lenses.isEmpty()) {
            LOG.info(() -> "Restored " + series.size() + " series, " + groups.size() + " groups, "
                    + lenses.size() + " lenses");
        }
    }

    private byte[] toJson(LensDefinition definition) {
        try {
            return json.writeValueAsBytes(definition);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot encode lens " + definition.label(), e);
        }
    }

    private void checkLabel(String label) {
        if (label == null || label.isBlank() || label.length() > labelMaxLength || !LABEL.matcher(label).matches()) {
            throw new CatalogException(CatalogException.Reason.INVALID_LABEL,
                    "label must be 1-" + labelMaxLength + " characters of [A-Za-z0-9_.:-], got '" + label + "'");
        }
    }

    private void ensureRoom(int current, String what) {
        if (current >= capacity) {
            throw new CatalogException(CatalogException.Reason.CATALOG_FULL,
                    "catalog holds the maximum of " + capacity + " " + what);
        }
    }

    // labels may arrive null from request bodies; null is never a key
    private SeriesEntry requireSeries(String label) {
        SeriesEntry entry = label == null ? null : series.get(label);
        if (entry == null) throw seriesNotFound(label);
        return entry;
    }

    private GroupEntry requireGroup(String label) {
        GroupEntry entry = label == null ? null : groups.get(label);
        if (entry == null) throw groupNotFound(label);
        return entry;
    }

    private LensEntry requireLens(String label) {
        LensEntry entry = label == null ? null : lenses.get(label);
        if (entry == null) throw lensNotFound(label);
        return entry;
    }

    private static CatalogException seriesNotFound(String label) {
        return new CatalogException(CatalogException.Reason.SERIES_NOT_FOUND, "series '" + label + "' not found");
    }

    private static CatalogException groupNotFound(String label) {
        return new CatalogException(CatalogException.Reason.GROUP_NOT_FOUND, "group '" + label + "' not found");
    }

    private static CatalogException lensNotFound(String label) {
        return new CatalogException(CatalogException.Reason.LENS_NOT_FOUND, "lens '" + label + "' not found");
    }
}
