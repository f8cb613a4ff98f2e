package com.taskforest.core.extract;

import com.taskforest.core.model.Skeleton;
import com.taskforest.core.model.TaskRecord;
import com.taskforest.core.prefix.PrefixNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Reads one {@link TaskRecord} and produces its {@link Skeleton}.
 * <p>
 * A record without an id or without a parseable creation time is rejected
 * with {@link MalformedRecordException}; no field is ever defaulted, since a
 * made-up {@code createdAt} would corrupt every temporal check downstream.
 * Extraction is pure and safe to run concurrently for independent records.
 */
public class SkeletonExtractor {

    private static final Logger log = LoggerFactory.getLogger(SkeletonExtractor.class);

    private static final List<Function<String, Instant>> TIMESTAMP_PARSERS = List.of(
            Instant::parse,
            v -> OffsetDateTime.parse(v).toInstant(),
            v -> ZonedDateTime.parse(v).toInstant()
    );

    private final int maxPrefixLength;
    private final boolean sanitize;

    public SkeletonExtractor() {
        this(PrefixNormalizer.DEFAULT_MAX_LENGTH, true);
    }

    public SkeletonExtractor(int maxPrefixLength, boolean sanitize) {
        this.maxPrefixLength = maxPrefixLength;
        this.sanitize = sanitize;
    }

    /**
     * @param record raw record from the storage layer
     * @return a fresh skeleton whose parent pointer is the record's declared parent
     * @throws MalformedRecordException if the record lacks an id or a valid creation time,
     *                                  or if the adapter fails while being read
     */
    public Skeleton extract(TaskRecord record) {
        if (record == null) {
            throw new MalformedRecordException(null, "null record");
        }
        String id;
        try {
            id = record.id();
        } catch (RuntimeException e) {
            throw new MalformedRecordException(null, "unreadable id: " + e.getMessage(), e);
        }
        if (id == null || id.isBlank()) {
            throw new MalformedRecordException(null, "missing task id");
        }
        id = id.strip();

        try {
            Instant createdAt = parseTimestamp(record.createdAt());
            if (createdAt == null) {
                throw new MalformedRecordException(id, "missing or unparseable createdAt: " + record.createdAt());
            }
            Instant lastActivity = parseTimestamp(record.lastActivity());

            String ownInstruction = key(record.ownInstruction());
            var childPrefixes = new ArrayList<String>();
            List<String> declared = record.declaredChildInstructions();
            if (declared != null) {
                for (String instruction : declared) {
                    String prefix = key(instruction);
                    if (!prefix.isEmpty()) {
                        childPrefixes.add(prefix);
                    }
                }
            }

            var skeleton = new Skeleton(id, createdAt, lastActivity, record.workspace(),
                    ownInstruction, childPrefixes, record.declaredParentId());
            log.debug("Extracted {}: {} declared sub-task(s), declaredParent={}",
                    id, skeleton.getChildInstructionPrefixes().size(), skeleton.getDeclaredParentId());
            return skeleton;
        } catch (MalformedRecordException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MalformedRecordException(id, "extraction failed: " + e.getMessage(), e);
        }
    }

    /** Sanitizes (when enabled) and normalizes at the full prefix length. */
    public String key(String rawInstruction) {
        String text = sanitize ? InstructionSanitizer.sanitize(rawInstruction) : rawInstruction;
        return PrefixNormalizer.normalize(text, maxPrefixLength);
    }

    /**
     * Accepts ISO-8601 instants, offset or zoned date-times, and epoch milliseconds.
     *
     * @return the parsed instant, or {@code null} when the value is blank or unparseable
     */
    public static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String v = value.strip();
        if (v.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(v));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        DateTimeException lastFailure = null;
        for (Function<String, Instant> parser : TIMESTAMP_PARSERS) {
            try {
                return parser.apply(v);
            } catch (DateTimeException e) {
                lastFailure = e;
            }
        }
        log.debug("Unparseable timestamp '{}': {}", v, lastFailure.getMessage());
        return null;
    }
}
