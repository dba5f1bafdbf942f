package io.segmentlite.segment.library;

import io.segmentlite.segment.model.Scope;
import io.segmentlite.segment.model.SegmentDefinition;
import io.segmentlite.segment.validation.SegmentValidator;
import io.segmentlite.segment.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Saved segments, gated by validation.
 *
 * Nothing invalid is ever stored: {@link #save} and {@link #update} throw
 * {@link SegmentValidationException} carrying every problem found. Names are
 * sanitised before validation, and saving under an existing name replaces that segment.
 */
public final class SegmentLibrary {

    private static final Logger logger = LoggerFactory.getLogger(SegmentLibrary.class);

    public static final String UNNAMED = "Unnamed Segment";
    public static final String COPY_SUFFIX = " - Copy";
    static final int MAX_NAME_LENGTH = 100;

    private static final Pattern DISALLOWED = Pattern.compile("[^a-zA-Z0-9\\s\\-_().]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final SegmentRepository repository;
    private final SegmentValidator validator;
    private final Clock clock;

    public SegmentLibrary(SegmentRepository repository, SegmentValidator validator, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "Repository cannot be null");
        this.validator = Objects.requireNonNull(validator, "Validator cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public SegmentLibrary(SegmentRepository repository, SegmentValidator validator) {
        this(repository, validator, Clock.systemUTC());
    }

    /**
     * Validates and stores a definition, replacing any saved segment with the same name.
     *
     * @throws SegmentValidationException if the definition is not valid
     */
    public SavedSegment save(SegmentDefinition definition) {
        SegmentDefinition named = checked(definition);
        Instant now = clock.instant();
        Optional<SavedSegment> existing = repository.findByName(named.name());
        SavedSegment saved = existing
                .map(s -> s.withDefinition(named, now))
                .orElseGet(() -> new SavedSegment(UUID.randomUUID().toString(), named, now, now, 0));
        repository.save(saved);
        logger.info("{} segment '{}' ({})", existing.isPresent() ? "Updated" : "Saved", saved.name(), saved.id());
        return saved;
    }

    /**
     * Replaces the definition of a saved segment.
     *
     * @throws NoSuchElementException if no segment has that id
     * @throws SegmentValidationException if the definition is not valid
     */
    public SavedSegment update(String id, SegmentDefinition definition) {
        SavedSegment current = require(id);
        SavedSegment updated = current.withDefinition(checked(definition), clock.instant());
        repository.save(updated);
        logger.info("Updated segment '{}' ({})", updated.name(), id);
        return updated;
    }

    /**
     * Loads a saved segment for use, counting the use.
     */
    public Optional<SavedSegment> load(String id) {
        return repository.findById(id).map(segment -> {
            SavedSegment used = segment.used();
            repository.save(used);
            return used;
        });
    }

    public Optional<SavedSegment> find(String id) {
        return repository.findById(id);
    }

    /**
     * Saves a copy named {@code "<name> - Copy"} with its usage count reset.
     *
     * @throws NoSuchElementException if no segment has that id
     */
    public SavedSegment duplicate(String id) {
        SavedSegment source = require(id);
        String copyName = sanitizeName(source.name() + COPY_SUFFIX);
        Instant now = clock.instant();
        SavedSegment copy = new SavedSegment(UUID.randomUUID().toString(),
                source.definition().withName(copyName), now, now, 0);
        repository.save(copy);
        logger.info("Duplicated segment '{}' as '{}'", source.name(), copyName);
        return copy;
    }

    public boolean delete(String id) {
        boolean deleted = repository.deleteById(id);
        if (deleted) {
            logger.info("Deleted segment {}", id);
        }
        return deleted;
    }

    public List<SavedSegment> list(LibraryOrder order) {
        return repository.findAll().stream()
                .sorted(order.comparator())
                .toList();
    }

    /**
     * Segments whose name or description contains the term (ignoring case) and whose
     * root scope matches.
     *
     * @param term  Search text, null or blank for all
     * @param scope Root scope to keep, null for all
     */
    public List<SavedSegment> search(String term, Scope scope, LibraryOrder order) {
        String needle = term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
        return repository.findAll().stream()
                .filter(s -> needle.isEmpty()
                        || s.name().toLowerCase(Locale.ROOT).contains(needle)
                        || s.description().toLowerCase(Locale.ROOT).contains(needle))
                .filter(s -> scope == null || s.definition().effectiveRootScope() == scope)
                .sorted(order.comparator())
                .toList();
    }

    /**
     * Keeps letters, digits, whitespace and {@code -_().}, collapses whitespace and
     * truncates to 100 characters. Falls back to {@value #UNNAMED}.
     */
    public static String sanitizeName(String name) {
        if (name == null) {
            return UNNAMED;
        }
        String cleaned = DISALLOWED.matcher(name).replaceAll("");
        cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ");
        if (cleaned.length() > MAX_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAME_LENGTH);
        }
        cleaned = cleaned.strip();
        return cleaned.isEmpty() ? UNNAMED : cleaned;
    }

    private SegmentDefinition checked(SegmentDefinition definition) {
        Objects.requireNonNull(definition, "Segment definition cannot be null");
        ValidationResult result = validator.validate(definition);
        if (!result.ok()) {
            throw new SegmentValidationException(result);
        }
        return definition.withName(sanitizeName(definition.name()));
    }

    private SavedSegment require(String id) {
        return repository.findById(id)
                .orElseThrow(() -> new NoSuchElementException("No saved segment with id " + id));
    }
}
