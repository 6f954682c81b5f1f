package domain.process;

import domain.change.ChangeLog;
import domain.change.ChangeRow;
import domain.classify.ActionClassifier;
import domain.classify.ClassificationRule;
import domain.classify.RowInput;
import domain.emit.BalanceApiSettings;
import domain.emit.EmittedStatement;
import domain.emit.StatementCategory;
import domain.id.IdAllocationException;
import domain.id.IdAllocator;
import domain.model.ChangeWarning;
import domain.model.WarningCode;
import domain.operation.Operation;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class ChangeLogProcessorTest {

    private static final LocalDate D = LocalDate.of(2025, 9, 15);

    private final AtomicLong next = new AtomicLong(5000);
    private final IdAllocator allocator = next::getAndIncrement;
    private final ChangeLogProcessor processor = new ChangeLogProcessor();

    private static ChangeRow row(int n, String token, String action, String attrs) {
        return new ChangeRow(n, D, token, null, action, attrs);
    }

    private static ChangeLog log(ChangeRow... rows) {
        return new ChangeLog("changes.xlsx", "42", new ArrayList<>(Arrays.asList(rows)));
    }

    private static boolean hasWarning(ChangeScript s, WarningCode code) {
        for (ChangeWarning w : s.getWarnings()) {
            if (w.getCode() == code) return true;
        }
        return false;
    }

    @Test
    void create_row_with_blank_token_gets_placeholder_and_references_both_ids() {
        ChangeScript s = processor.process(log(
                row(3, null, null, "name=Revenue\nord=10\nlvl=2\nparent=ID1")
        ), allocator);

        assertEquals(1, s.getStatements().size());
        EmittedStatement add = s.getStatements().get(0);
        assertEquals(StatementCategory.ADD, add.getCategory());
        // parent ID1 is resolved first, then the TEMP_1 placeholder
        assertTrue(add.getText().contains("p_parent_id => 5000,"));
        assertTrue(add.getText().contains("p_article_id => 5001\n"));
        assertEquals(2, s.getAllocationCount());
    }

    @Test
    void create_row_without_ord_emits_nothing_and_reports_omission() {
        ChangeScript s = processor.process(log(
                row(3, null, "добавление статьи", "name=Revenue\nlvl=2\nparent=ID1")
        ), allocator);

        assertFalse(s.hasStatements());
        long omissions = s.getWarnings().stream().filter(w -> w.getCode() == WarningCode.MISSING_PRECONDITION).count();
        assertEquals(1, omissions);
    }

    @Test
    void create_row_with_blank_ord_emits_nothing_and_reports_omission() {
        ChangeScript s = processor.process(log(
                row(3, "ID5", "добавление статьи", "name=X\nord=\nlvl=1\nparent=ID1")
        ), allocator);

        assertFalse(s.hasStatements());
        long omissions = s.getWarnings().stream().filter(w -> w.getCode() == WarningCode.MISSING_PRECONDITION).count();
        assertEquals(1, omissions);
    }

    @Test
    void composite_ignores_blank_name_and_keeps_order_part() {
        ChangeScript s = processor.process(log(
                row(3, "100", "меняет позицию, название", "name=\nord=4")
        ), allocator);

        assertEquals(1, s.getStatements().size());
        String sql = s.getStatements().get(0).getText();
        assertTrue(sql.contains("fn_balance_article_ord_set("));
        assertTrue(sql.contains("p_article_ord => 4,"));
    }

    @Test
    void create_row_with_unknown_parent_shape_is_kept_with_null_parent() {
        ChangeScript s = processor.process(log(
                row(3, "ID5", "добавление статьи", "name=X\nord=1\nlvl=1\nparent=Итого")
        ), allocator);

        assertEquals(1, s.getStatements().size());
        assertTrue(s.getStatements().get(0).getText().contains("p_parent_id => NULL,"));
        assertTrue(hasWarning(s, WarningCode.UNRESOLVED_REFERENCE));
    }

    @Test
    void statements_are_ordered_renumber_add_change() {
        ChangeScript s = processor.process(log(
                row(3, "100", "сменила название на", "First"),
                row(4, "ID1", "добавление статьи", "name=A\nord=1\nlvl=1\nparent=0"),
                row(5, "order >= 10 and order <= 20 shift down by +5", null, null),
                row(6, "101", "логически удаляем из документа", null),
                row(7, "ID2", "добавление статьи", "name=B\nord=2\nlvl=1\nparent=0")
        ), allocator);

        List<EmittedStatement> st = s.getStatements();
        assertEquals(5, st.size());
        assertEquals(StatementCategory.RENUMBER, st.get(0).getCategory());
        assertEquals(4, st.get(1).getRowNumber());
        assertEquals(7, st.get(2).getRowNumber());
        assertEquals(3, st.get(3).getRowNumber());
        assertEquals(6, st.get(4).getRowNumber());
        assertEquals(1, s.count(StatementCategory.RENUMBER));
        assertEquals(2, s.count(StatementCategory.ADD));
        assertEquals(2, s.count(StatementCategory.CHANGE));
    }

    @Test
    void forward_reference_sees_the_id_allocated_for_a_later_row() {
        ChangeScript s = processor.process(log(
                row(3, "200", "changes level and parent", "lvl=2\nparent=ID7"),
                row(4, "ID7", "добавление статьи", "name=New parent\nord=3\nlvl=1\nparent=0")
        ), allocator);

        assertEquals(1, s.getAllocationCount());
        String add = s.getStatements().get(0).getText();
        String change = s.getStatements().get(1).getText();
        assertTrue(add.contains("p_article_id => 5000\n"));
        assertTrue(change.contains("p_parent_id => 5000,"));
    }

    @Test
    void placeholder_skips_tokens_already_used_in_the_file() {
        ChangeScript s = processor.process(log(
                row(3, "TEMP_1", "добавление статьи", "name=A\nord=1\nlvl=1\nparent=0"),
                row(4, null, "добавление статьи", "name=B\nord=2\nlvl=1\nparent=TEMP_1")
        ), allocator);

        assertEquals(2, s.getAllocationCount());
        assertEquals(2, s.count(StatementCategory.ADD));
        String second = s.getStatements().get(1).getText();
        assertTrue(second.contains("p_parent_id => 5000,"));
        assertTrue(second.contains("p_article_id => 5001\n"));
    }

    @Test
    void open_ended_directive_is_closed_below_the_previous_begin() {
        ChangeScript s = processor.process(log(
                row(3, "order >= 30 and order <= 40 shift down by 1", null, null),
                row(4, "order >= 10 shift down by 2", null, null)
        ), allocator);

        assertEquals(2, s.getStatements().size());
        String closed = s.getStatements().get(1).getText();
        assertTrue(closed.contains("p_begin_ord => 10,"));
        assertTrue(closed.contains("p_end_ord => 29,"));
        assertTrue(closed.contains("p_shift_ord => 2,"));
    }

    @Test
    void first_open_ended_directive_keeps_sentinel_end() {
        ChangeScript s = processor.process(log(
                row(3, "articles with order > 50 shift down by 3", null, null)
        ), allocator);

        String sql = s.getStatements().get(0).getText();
        assertTrue(sql.contains("p_begin_ord => 51,"));
        assertTrue(sql.contains("p_end_ord => 1000,"));
    }

    @Test
    void open_ended_directive_in_ascending_order_is_reported_not_emitted() {
        ChangeScript s = processor.process(log(
                row(3, "order > 5 shift down by 1", null, null),
                row(4, "order >= 10 shift down by 1", null, null)
        ), allocator);

        assertEquals(1, s.getStatements().size());
        assertTrue(hasWarning(s, WarningCode.RENUMBER_ORDER_UNSUPPORTED));
        assertTrue(s.getMarkers().get(0).startsWith("-- Unsupported renumber order in row 4"));
    }

    @Test
    void explicit_range_ending_at_1000_is_not_reclosed() {
        ChangeScript s = processor.process(log(
                row(3, "order >= 30 and order <= 40 shift down by 1", null, null),
                row(4, "order >= 10 and order <= 1000 shift down by 2", null, null)
        ), allocator);

        assertEquals(2, s.getStatements().size());
        assertTrue(s.getStatements().get(1).getText().contains("p_end_ord => 1000,"));
    }

    @Test
    void oversized_renumber_bound_is_not_a_row_failure() {
        ChangeScript s = processor.process(log(
                row(3, "order > 99999999999999999999 shift down by 1", null, null),
                row(4, "100", "сменила название на", "X")
        ), allocator);

        assertEquals(1, s.getStatements().size());
        assertFalse(hasWarning(s, WarningCode.ROW_FAILED));
    }

    @Test
    void undated_rows_are_ignored_in_both_passes() {
        ChangeScript s = processor.process(log(
                new ChangeRow(3, null, "ID1", null, "добавление статьи", "name=A\nord=1\nlvl=1\nparent=0"),
                row(4, "100", "сменила название на", "X")
        ), allocator);

        assertEquals(0, s.getAllocationCount());
        assertEquals(1, s.getStatements().size());
        assertEquals(1, s.getSourceRows().size());
    }

    @Test
    void invalid_date_becomes_row_failure() {
        ChangeScript s = processor.process(log(
                ChangeRow.withInvalidDate(3, "someday", "100", null, "сменила название на", "X"),
                row(4, "101", "сменила название на", "Y")
        ), allocator);

        assertEquals(1, s.getStatements().size());
        assertTrue(s.getMarkers().get(0).startsWith("-- ERROR in row 3:"));
        assertTrue(hasWarning(s, WarningCode.INVALID_CHANGE_DATE));
        assertTrue(hasWarning(s, WarningCode.ROW_FAILED));
    }

    @Test
    void unrecognized_action_leaves_marker() {
        ChangeScript s = processor.process(log(
                row(3, "100", "moves to\narchive", null)
        ), allocator);

        assertFalse(s.hasStatements());
        assertEquals(List.of("-- Unrecognized action in row 3: moves to archive"), s.getMarkers());
        assertTrue(hasWarning(s, WarningCode.UNRECOGNIZED_ACTION));
    }

    @Test
    void failing_row_does_not_stop_the_file() {
        ClassificationRule exploding = new ClassificationRule() {
            @Override
            public String name() {
                return "exploding";
            }

            @Override
            public boolean matches(RowInput input) {
                return "boom".equals(input.getAction());
            }

            @Override
            public Operation build(RowInput input) {
                throw new IllegalStateException("rule failure");
            }
        };
        List<ClassificationRule> rules = new ArrayList<>();
        rules.add(exploding);
        rules.addAll(ActionClassifier.defaultRules());
        ChangeLogProcessor p = new ChangeLogProcessor(new ActionClassifier(rules), BalanceApiSettings.defaults());

        ChangeScript s = p.process(log(
                row(3, "100", "boom", null),
                row(4, "100", "сменила название на", "ok")
        ), allocator);

        assertEquals(1, s.getStatements().size());
        assertEquals("-- ERROR in row 3: rule failure", s.getMarkers().get(0));
        assertTrue(hasWarning(s, WarningCode.ROW_FAILED));
    }

    @Test
    void allocation_failure_skips_dependent_statement_only() {
        IdAllocator failing = () -> {
            throw new IdAllocationException("no sequence");
        };
        ChangeScript s = processor.process(log(
                row(3, "ID1", "добавление статьи", "name=A\nord=1\nlvl=1\nparent=0"),
                row(4, "100", "сменила название на", "X")
        ), failing);

        assertEquals(1, s.getStatements().size());
        assertEquals(StatementCategory.CHANGE, s.getStatements().get(0).getCategory());
        assertEquals(1, s.getAllocationCount());
        assertTrue(hasWarning(s, WarningCode.ALLOCATION_FAILED));
        assertTrue(hasWarning(s, WarningCode.UNRESOLVED_REFERENCE));
    }

    @Test
    void source_rows_are_echoed_tab_separated() {
        ChangeScript s = processor.process(log(
                new ChangeRow(3, D, "100", "Revenue", "сменила название на", "Net")
        ), allocator);

        assertEquals("15.09.2025\t100\tRevenue\tсменила название на\t\"Net\"", s.getSourceRows().get(0));
        assertEquals("changes.xlsx", s.getSourceName());
        assertEquals("42", s.getReportId());
    }

    @Test
    void each_call_uses_a_fresh_registry() {
        ChangeLogProcessor p = new ChangeLogProcessor();
        ChangeScript a = p.process(log(row(3, "ID1", "сменила название на", "X")), allocator);
        ChangeScript b = p.process(log(row(3, "ID1", "сменила название на", "X")), allocator);

        assertEquals(1, a.getAllocationCount());
        assertEquals(1, b.getAllocationCount());
        assertNotEquals(a.getStatements().get(0).getText(), b.getStatements().get(0).getText());
    }
}
