package metacpp.lowering.core;

import java.util.Iterator;

/**
 * 合成标识符序列：严格单调、永不重复。
 *
 * <p>生成器作为参数在各阶段之间显式传递，而不是全局计数器。前缀由编译单元名派生，
 * 保证与源程序中的标识符不冲突。</p>
 */
public final class IdentifierGenerator implements Iterator<String> {
  private final String prefix;
  private long next;

  public IdentifierGenerator(String prefix) {
    if (prefix == null || prefix.isEmpty()) {
      throw new IllegalArgumentException("identifier prefix cannot be empty");
    }
    this.prefix = prefix;
  }

  /** 针对编译单元的生成器，形如 {@code lowering_internal_a_b_x0}。 */
  public static IdentifierGenerator forUnit(String unitName) {
    return new IdentifierGenerator("lowering_internal_" + unitName.replace('.', '_') + "_x");
  }

  @Override
  public boolean hasNext() {
    return true;
  }

  @Override
  public String next() {
    if (next == Long.MAX_VALUE) {
      throw new IllegalStateException("identifier space exhausted for prefix " + prefix);
    }
    return prefix + next++;
  }

  public String prefix() {
    return prefix;
  }

  /** 已生成的标识符数量。 */
  public long generatedCount() {
    return next;
  }
}
