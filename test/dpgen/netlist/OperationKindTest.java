package dpgen.netlist;

import java.util.List;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class OperationKindTest {

  SignalRegistry signals;
  Signal s8, u12, u1, u2;

  @BeforeEach
  void setUp() {
    signals = new SignalRegistry();
    s8 = signals.createInput(8, true);
    u12 = signals.createInput(12, false);
    u1 = signals.createInput(1, false);
    u2 = signals.createInput(2, false);
  }

  @Test
  void testArithmetic() {
    Assertions.assertEquals(12, OperationKind.ADD.inferWidth(List.of(s8, u12)));
    Assertions.assertTrue(OperationKind.SUB.inferSigned(List.of(u12, s8)));
    Assertions.assertFalse(OperationKind.DIV.inferSigned(List.of(u12, u1)));
    Assertions.assertEquals(20, OperationKind.MUL.inferWidth(List.of(s8, u12)));
    Assertions.assertTrue(OperationKind.MUL.inferSigned(List.of(s8, u12)));
  }

  @Test
  void testLogicalAndShift() {
    Assertions.assertEquals(12, OperationKind.NAND.inferWidth(List.of(s8, u12)));
    Assertions.assertFalse(OperationKind.AND.inferSigned(List.of(s8, s8)));
    Assertions.assertEquals(8, OperationKind.NOT.inferWidth(List.of(s8)));
    Assertions.assertTrue(OperationKind.NOT.inferSigned(List.of(s8)));
    Assertions.assertEquals(8, OperationKind.SHRA.inferWidth(List.of(s8, u12)));
    Assertions.assertTrue(OperationKind.SHRA.inferSigned(List.of(s8, u12)));
    Assertions.assertFalse(OperationKind.SHL.inferSigned(List.of(u12, s8)));
  }

  @Test
  void testSingleBitResults() {
    for (OperationKind kind : OperationCategory.Comparison.kinds()) {
      Assertions.assertEquals(1, kind.inferWidth(List.of(s8, u12)));
      Assertions.assertFalse(kind.inferSigned(List.of(s8, s8)));
    }
    for (OperationKind kind : OperationCategory.Reduction.kinds()) {
      Assertions.assertTrue(kind.isUnary());
      Assertions.assertEquals(1, kind.inferWidth(List.of(u12)));
    }
  }

  @Test
  void testSelection() {
    Assertions.assertEquals(12, OperationKind.MUX2.inferWidth(List.of(u1, s8, u12)));
    Assertions.assertTrue(OperationKind.MUX2.inferSigned(List.of(u1, s8, u12)));
    Assertions.assertEquals(12, OperationKind.CONDITIONAL.inferWidth(List.of(u1, u12, s8)));
    Assertions.assertEquals(8, OperationKind.MUX4.inferWidth(List.of(u2, s8, u12, u1, u1)));
    Assertions.assertFalse(OperationKind.MUX4.inferSigned(List.of(u2, s8, s8, s8, s8)));
  }

  @Test
  void testConcat() {
    Assertions.assertEquals(21, OperationKind.CONCAT.inferWidth(List.of(s8, u12, u1)));
    Assertions.assertFalse(OperationKind.CONCAT.inferSigned(List.of(s8, s8)));
    Assertions.assertTrue(OperationKind.CONCAT.acceptsOperandCount(4));
    Assertions.assertFalse(OperationKind.CONCAT.acceptsOperandCount(1));
  }

  @ParameterizedTest
  @EnumSource(OperationKind.class)
  void testArity(OperationKind kind) {
    Assertions.assertFalse(kind.acceptsOperandCount(0));
    Assertions.assertTrue(kind.acceptsOperandCount(kind.minOperands));
    Assertions.assertFalse(kind.acceptsOperandCount(kind.minOperands - 1));
    Assertions.assertThrows(IllegalArgumentException.class, () -> kind.inferWidth(List.of()));
    Assertions.assertTrue(kind.category.kinds().contains(kind));
  }

  @Test
  void testArityTable() {
    Assertions.assertEquals(5, OperationKind.MUX4.minOperands);
    Assertions.assertEquals(3, OperationKind.MUX2.maxOperands);
    Assertions.assertEquals(1, OperationKind.NOT.maxOperands);
    Assertions.assertFalse(OperationKind.ADD.acceptsOperandCount(3));
  }

  @Test
  void testCategories() {
    Assertions.assertEquals(List.of(OperationKind.SHL, OperationKind.SHR, OperationKind.SHRA), OperationCategory.Shift.kinds());
    Assertions.assertEquals(7, OperationCategory.Logical.kinds().size());
    Assertions.assertFalse(OperationCategory.Conditional.drawable);
  }

  @Test
  void testWidthOverflow() {
    Signal huge = signals.createWire(Integer.MAX_VALUE - 4, false);
    Assertions.assertThrows(ArithmeticException.class, () -> OperationKind.MUL.inferWidth(List.of(huge, s8)));
    Assertions.assertThrows(ArithmeticException.class, () -> OperationKind.CONCAT.inferWidth(List.of(u1, huge, u12)));
    Assertions.assertEquals(Integer.MAX_VALUE - 3, OperationKind.CONCAT.inferWidth(List.of(huge, u1)));
    Assertions.assertEquals(Integer.MAX_VALUE - 4, OperationKind.ADD.inferWidth(List.of(huge, s8)));
  }

  @Test
  void testOperationCreate() {
    Signal out = signals.createWire(8, false);
    Assertions.assertTrue(Operation.create(OperationKind.ADD, out, List.of(s8)).isEmpty());
    Assertions.assertTrue(Operation.create(OperationKind.MUX4, out, List.of(u2, s8, s8, s8)).isEmpty());
    Operation op = Operation.create(OperationKind.ADD, out, List.of(s8, u12)).orElseThrow();
    Assertions.assertEquals(List.of(s8, u12), op.getOperands());
    Assertions.assertEquals(0, op.getDepth());
    Assertions.assertEquals(0, op.getStage());
    Assertions.assertEquals("wire_0 = add[in_0, in_1]", op.toString());
  }
}
