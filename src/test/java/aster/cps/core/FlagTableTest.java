package aster.cps.core;

import static aster.cps.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.EnumSet;
import java.util.Map;
import org.junit.jupiter.api.Test;

public class FlagTableTest {

  @Test
  public void testFlagsAreKeyedByIdentity() {
    FlagTable table = new FlagTable();
    CoreModel.Stmt a = brk();
    CoreModel.Stmt b = brk();
    assertEquals(a, b, "同值节点应相等");

    assertTrue(table.mark(a, Flag.PROPAGATE));
    assertTrue(table.has(a, Flag.PROPAGATE));
    assertFalse(table.has(b, Flag.PROPAGATE), "标记不能泄漏到同值的其它节点");
    assertFalse(table.isMarked(b));
  }

  @Test
  public void testMarkIsIdempotentUnion() {
    FlagTable table = new FlagTable();
    CoreModel.Stmt loop = whileLoop(bool(true));
    assertTrue(table.mark(loop, Flag.AWAIT));
    assertFalse(table.mark(loop, Flag.AWAIT), "重复标记应返回 false");
    table.union(loop, EnumSet.of(Flag.LOOP, Flag.AWAIT));

    assertEquals(EnumSet.of(Flag.AWAIT, Flag.LOOP), table.get(loop));
    assertTrue(table.hasAny(loop, Flag.PROPAGATE, Flag.LOOP));
    assertFalse(table.hasAny(loop, Flag.PROPAGATE));
    assertEquals(1, table.size());
  }

  @Test
  public void testSnapshotIsDetached() {
    FlagTable table = new FlagTable();
    CoreModel.Stmt s = await();
    table.mark(s, Flag.AWAIT);
    Map<CoreModel.Stmt, java.util.Set<Flag>> before = table.snapshot();
    table.mark(s, Flag.PROPAGATE);

    assertEquals(EnumSet.of(Flag.AWAIT), before.get(s));
    assertThrows(UnsupportedOperationException.class, () -> table.get(s).add(Flag.LOOP));
    assertTrue(table.get(eval(num(1))).isEmpty());
  }

  @Test
  public void testSnapshotMatchesUntilMarksChange() {
    FlagTable table = new FlagTable();
    CoreModel.Stmt exit = brk();
    CoreModel.Stmt twin = brk();
    table.mark(exit, Flag.PROPAGATE);
    Map<CoreModel.Stmt, java.util.Set<Flag>> before = table.snapshot();

    assertTrue(table.matches(before));
    table.mark(exit, Flag.PROPAGATE);
    assertTrue(table.matches(before), "重复标记不改变快照");
    table.mark(twin, Flag.PROPAGATE);
    assertFalse(table.matches(before), "新节点被标记后应不再匹配");
  }
}
