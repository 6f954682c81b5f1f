package domain.id;

import domain.model.ChangeWarning;
import domain.model.ListChangeWarningSink;
import domain.model.ProcessingContext;
import domain.model.WarningCode;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class TemporaryIdRegistryTest {

    private static IdAllocator counting(AtomicLong next) {
        return next::getAndIncrement;
    }

    @Test
    void same_token_resolves_to_same_id_with_one_allocation() {
        AtomicLong next = new AtomicLong(1000);
        TemporaryIdRegistry registry = new TemporaryIdRegistry(counting(next));

        Long first = registry.resolve("ID1");
        Long second = registry.resolve("ID1");

        assertEquals(1000L, first);
        assertEquals(first, second);
        assertEquals(1, registry.allocationCount());
    }

    @Test
    void token_lookup_ignores_case_and_surrounding_blanks() {
        TemporaryIdRegistry registry = new TemporaryIdRegistry(counting(new AtomicLong(5)));

        assertEquals(registry.resolve("id2"), registry.resolve(" ID2 "));
        assertTrue(registry.isKnown("Id2"));
        assertEquals(1, registry.size());
    }

    @Test
    void numeric_literal_is_its_own_id_and_never_allocates() {
        TemporaryIdRegistry registry = new TemporaryIdRegistry(() -> {
            throw new AssertionError("allocator must not be called");
        });

        assertEquals(123456789012L, registry.resolve("123456789012"));
        assertEquals(0, registry.allocationCount());
    }

    @Test
    void distinct_tokens_get_distinct_ids() {
        TemporaryIdRegistry registry = new TemporaryIdRegistry(counting(new AtomicLong(1)));

        Long a = registry.resolve("ID1");
        Long b = registry.resolve("TEMP_1");

        assertNotEquals(a, b);
        assertEquals(2, registry.allocationCount());
        assertEquals(2, registry.snapshot().size());
    }

    @Test
    void unknown_shapes_and_blanks_resolve_to_null() {
        TemporaryIdRegistry registry = new TemporaryIdRegistry(counting(new AtomicLong(1)));

        assertNull(registry.resolve("abc"));
        assertNull(registry.resolve(""));
        assertNull(registry.resolve(null));
        assertEquals(0, registry.allocationCount());
    }

    @Test
    void failed_allocation_is_reported_once_and_not_retried() {
        List<ChangeWarning> warnings = new ArrayList<>();
        int[] calls = {0};
        TemporaryIdRegistry registry = new TemporaryIdRegistry(() -> {
            calls[0]++;
            throw new IdAllocationException("db down");
        }, new ListChangeWarningSink(warnings));

        ProcessingContext ctx = new ProcessingContext("f.xlsx", 4, "ID9");
        assertNull(registry.resolve("ID9", ctx));
        assertNull(registry.resolve("ID9", ctx));

        assertEquals(1, calls[0]);
        assertEquals(1, registry.allocationCount());
        assertFalse(registry.isKnown("ID9"));
        assertEquals(1, warnings.size());
        assertEquals(WarningCode.ALLOCATION_FAILED, warnings.get(0).getCode());
        assertEquals(4, warnings.get(0).getRowNumber());
    }

    @Test
    void runtime_fault_in_allocator_is_contained() {
        TemporaryIdRegistry registry = new TemporaryIdRegistry(() -> {
            throw new IllegalStateException("boom");
        });

        assertNull(registry.resolve("ID1"));
        assertEquals(1, registry.allocationCount());
    }

    @Test
    void numeric_overflow_is_unresolved() {
        List<ChangeWarning> warnings = new ArrayList<>();
        TemporaryIdRegistry registry = new TemporaryIdRegistry(counting(new AtomicLong(1)), new ListChangeWarningSink(warnings));

        assertNull(registry.resolve("99999999999999999999999"));
        assertEquals(WarningCode.UNRESOLVED_REFERENCE, warnings.get(0).getCode());
    }
}
