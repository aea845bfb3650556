package aster.cps.nodes;

import com.oracle.truffle.api.frame.VirtualFrame;

/**
 * 按顺序匹配分支；subject 为空时 guard 作为布尔条件。只执行第一个命中的分支。
 */
public final class SwitchNode extends CpsNode {
  @Child private CpsNode subject;
  @Children private final CpsNode[] guards;
  @Children private final CpsNode[] bodies;
  @Child private CpsNode defaultNode;

  public SwitchNode(CpsNode subject, CpsNode[] guards, CpsNode[] bodies, CpsNode defaultNode) {
    this.subject = subject;
    this.guards = guards;
    this.bodies = bodies;
    this.defaultNode = defaultNode;
  }

  @Override
  public Object execute(VirtualFrame frame) {
    Object value = subject != null ? subject.execute(frame) : null;
    for (int i = 0; i < guards.length; i++) {
      Object guard = guards[i].execute(frame);
      boolean hit = subject != null ? Exec.valueEquals(value, guard) : Exec.toBool(guard);
      if (hit) {
        return bodies[i].execute(frame);
      }
    }
    return defaultNode != null ? defaultNode.execute(frame) : null;
  }
}
