package aster.cps.core;

import java.util.Collections;
import java.util.EnumSet;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 语句标记的旁路表，按对象身份索引。
 *
 * <p>标记只增不减：同一次编译内重复标记是幂等的并集操作。</p>
 */
public final class FlagTable {
  private final Map<CoreModel.Stmt, EnumSet<Flag>> flags = new IdentityHashMap<>();

  public boolean has(CoreModel.Stmt node, Flag flag) {
    EnumSet<Flag> set = flags.get(node);
    return set != null && set.contains(flag);
  }

  public boolean hasAny(CoreModel.Stmt node, Flag first, Flag... rest) {
    EnumSet<Flag> set = flags.get(node);
    if (set == null) {
      return false;
    }
    if (set.contains(first)) {
      return true;
    }
    for (Flag f : rest) {
      if (set.contains(f)) return true;
    }
    return false;
  }

  /**
   * @return 节点当前标记的只读视图；未标记时为空集合
   */
  public Set<Flag> get(CoreModel.Stmt node) {
    EnumSet<Flag> set = flags.get(node);
    return set == null ? Set.of() : Collections.unmodifiableSet(set);
  }

  /**
   * 添加单个标记。
   *
   * @return true 表示此前未带该标记
   */
  public boolean mark(CoreModel.Stmt node, Flag flag) {
    return flags.computeIfAbsent(node, k -> EnumSet.noneOf(Flag.class)).add(flag);
  }

  public void union(CoreModel.Stmt node, Set<Flag> other) {
    if (other.isEmpty()) {
      return;
    }
    flags.computeIfAbsent(node, k -> EnumSet.noneOf(Flag.class)).addAll(other);
  }

  public boolean isMarked(CoreModel.Stmt node) {
    EnumSet<Flag> set = flags.get(node);
    return set != null && !set.isEmpty();
  }

  public int size() { return flags.size(); }

  /**
   * 当前标记分配是否与快照一致：节点集合按身份相同，且每个节点的标记集合相等。
   * 快照本身是 IdentityHashMap，其 equals 按引用比较值，不能直接用来比较两次标注结果。
   */
  public boolean matches(Map<CoreModel.Stmt, Set<Flag>> snapshot) {
    if (snapshot.size() != flags.size()) {
      return false;
    }
    for (var e : flags.entrySet()) {
      Set<Flag> other = snapshot.get(e.getKey());
      if (other == null || !other.equals(e.getValue())) {
        return false;
      }
    }
    return true;
  }

  /** 当前标记分配的快照（深拷贝），与 {@link #matches} 配合比较两次标注结果。 */
  public Map<CoreModel.Stmt, Set<Flag>> snapshot() {
    Map<CoreModel.Stmt, Set<Flag>> copy = new IdentityHashMap<>();
    for (var e : flags.entrySet()) {
      copy.put(e.getKey(), EnumSet.copyOf(e.getValue()));
    }
    return copy;
  }
}
