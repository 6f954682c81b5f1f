package domain.id;

import domain.model.ChangeWarning;
import domain.model.ChangeWarningSink;
import domain.model.ProcessingContext;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Run-scoped mapping from temporary tokens to allocated article ids.
 *
 * <p>Create one instance per input file: the same token in two files names two
 * unrelated articles. Each distinct temporary token triggers at most one call to
 * the {@link IdAllocator} per run, including calls that failed.</p>
 */
public final class TemporaryIdRegistry {

    private static final Logger log = LoggerFactory.getLogger(TemporaryIdRegistry.class);

    private final IdAllocator allocator;
    private final ChangeWarningSink warningSink;
    private final Map<String, Long> ids = new LinkedHashMap<>();
    private final Set<String> failed = new HashSet<>();
    private int allocationCount;

    public TemporaryIdRegistry(IdAllocator allocator) {
        this(allocator, ChangeWarningSink.none());
    }

    public TemporaryIdRegistry(IdAllocator allocator, ChangeWarningSink warningSink) {
        if (allocator == null) throw new IllegalArgumentException("allocator is null");
        this.allocator = allocator;
        this.warningSink = warningSink == null ? ChangeWarningSink.none() : warningSink;
    }

    public Long resolve(String token) {
        return resolve(token, null);
    }

    /**
     * @return the id for {@code token}, or null when it is blank, of an unknown shape,
     * or its allocation failed
     */
    public Long resolve(String token, ProcessingContext ctx) {
        if (token == null || token.isBlank()) return null;
        String t = token.trim();

        switch (IdentifierToken.classify(t)) {
            case NUMERIC_LITERAL:
                try {
                    return Long.parseLong(t);
                } catch (NumberFormatException e) {
                    warningSink.warn(ChangeWarning.of(WarningCode.UNRESOLVED_REFERENCE, withToken(ctx, t),
                            "numeric id out of range", t));
                    return null;
                }
            case TEMPORARY:
                return resolveTemporary(IdentifierToken.normalize(t), ctx);
            default:
                return null;
        }
    }

    private Long resolveTemporary(String key, ProcessingContext ctx) {
        Long cached = ids.get(key);
        if (cached != null) return cached;
        if (failed.contains(key)) return null;

        try {
            allocationCount++;
            long id = allocator.allocateNewId();
            ids.put(key, id);
            log.info("Allocated id {} for '{}'", id, key);
            return id;
        } catch (IdAllocationException | RuntimeException e) {
            failed.add(key);
            log.error("Id allocation failed for '{}': {}", key, e.getMessage());
            warningSink.warn(ChangeWarning.of(WarningCode.ALLOCATION_FAILED, withToken(ctx, key),
                    "id allocation failed", e.getClass().getSimpleName() + ": " + e.getMessage()));
            return null;
        }
    }

    private static ProcessingContext withToken(ProcessingContext ctx, String token) {
        return ctx == null ? new ProcessingContext("", 0, token) : ctx.withToken(token);
    }

    public boolean isKnown(String token) {
        return ids.containsKey(IdentifierToken.normalize(token));
    }

    /**
     * Number of calls made to the allocator, successful or not.
     */
    public int allocationCount() {
        return allocationCount;
    }

    public int size() {
        return ids.size();
    }

    public Map<String, Long> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(ids));
    }
}
