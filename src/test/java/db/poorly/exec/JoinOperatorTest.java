package db.poorly.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import db.poorly.catalog.TypedValue;

public class JoinOperatorTest {

    private static ColumnSet student(long id, String name) {
        return ColumnSet.of("s.id", TypedValue.ofInt(id), "s.name", TypedValue.ofString(name));
    }

    private static ColumnSet enrollment(long studentId, String course) {
        return ColumnSet.of("e.student_id", TypedValue.ofInt(studentId), "e.course", TypedValue.ofString(course));
    }

    private static final List<JoinKey> ON_ID = List.of(new JoinKey("s.id", "e.student_id"));

    @Test
    void innerJoinYieldsOneRowPerMatchedLeftRow() {
        ListOperator left = new ListOperator(List.of(student(1, "Alice"), student(2, "Bob"), student(3, "Eve")));
        ListOperator right = new ListOperator(List.of(
            enrollment(1, "Math"), enrollment(3, "Art"), enrollment(1, "Physics"), enrollment(9, "Nobody")));

        List<ColumnSet> out = Operator.drain(new JoinOperator(left, right, ON_ID));

        assertEquals(2, out.size());
        ColumnSet alice = out.get(0);
        assertEquals(TypedValue.ofString("Alice"), alice.get("s.name"));
        // later right rows of the group overwrite earlier ones
        assertEquals(TypedValue.ofString("Physics"), alice.get("e.course"));
        assertEquals(4, alice.size());
        assertEquals(TypedValue.ofString("Art"), out.get(1).get("e.course"));
        assertEquals(1, left.closed);
        assertEquals(1, right.closed);
    }

    @Test
    void everyKeyMustMatch() {
        ListOperator left = new ListOperator(List.of(
            ColumnSet.of("l.a", TypedValue.ofInt(1), "l.b", TypedValue.ofString("x")),
            ColumnSet.of("l.a", TypedValue.ofInt(1), "l.b", TypedValue.ofString("y"))));
        ListOperator right = new ListOperator(List.of(
            ColumnSet.of("r.a", TypedValue.ofInt(1), "r.b", TypedValue.ofString("y"))));
        List<ColumnSet> out = Operator.drain(new JoinOperator(left, right,
            List.of(new JoinKey("l.a", "r.a"), new JoinKey("l.b", "r.b"))));
        assertEquals(1, out.size());
        assertEquals(TypedValue.ofString("y"), out.get(0).get("l.b"));
    }

    @Test
    void incomparableKeysNeverMatch() {
        JoinOperator join = new JoinOperator(new ListOperator(List.of()), new ListOperator(List.of()), ON_ID);
        ColumnSet l = student(1, "a");
        assertEquals(-1, join.compare(l, ColumnSet.of("e.student_id", TypedValue.ofString("1"))));
        assertEquals(-1, join.compare(l, ColumnSet.of("e.course", TypedValue.ofString("x"))));
        assertEquals(0, join.compare(l, enrollment(1, "x")));
        assertEquals(1, join.compare(student(5, "a"), enrollment(1, "x")));

        ListOperator left = new ListOperator(List.of(ColumnSet.of("s.id", TypedValue.ofFloat(Double.NaN))));
        ListOperator right = new ListOperator(List.of(ColumnSet.of("e.student_id", TypedValue.ofFloat(Double.NaN))));
        assertTrue(Operator.drain(new JoinOperator(left, right, ON_ID)).isEmpty());
    }

    @Test
    void noKeysJoinsEveryLeftRowWithAllRightRows() {
        ListOperator left = new ListOperator(List.of(student(1, "a"), student(2, "b")));
        ListOperator right = new ListOperator(List.of(enrollment(1, "x")));
        assertEquals(2, Operator.drain(new JoinOperator(left, right, List.of())).size());
    }
}
