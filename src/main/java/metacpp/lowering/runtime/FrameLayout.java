package metacpp.lowering.runtime;

import com.oracle.truffle.api.frame.FrameDescriptor;
import com.oracle.truffle.api.frame.FrameSlotKind;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 降级函数的帧布局：参数占据前 N 个槽位，其余名字按首次出现的顺序分配。
 *
 * 降级树中同一个名字可以被多次赋值（例如多个 raise 点绑定同一个异常名），这些绑定共用一个槽位。
 * 槽位一律按 Object 存取。
 */
public final class FrameLayout {
  private final FrameDescriptor descriptor;
  private final List<String> slotNames;
  private final int parameterCount;

  private FrameLayout(FrameDescriptor descriptor, List<String> slotNames, int parameterCount) {
    this.descriptor = descriptor;
    this.slotNames = slotNames;
    this.parameterCount = parameterCount;
  }

  public static Builder builder(String functionName) {
    return new Builder(functionName);
  }

  public FrameDescriptor descriptor() {
    return descriptor;
  }

  public int parameterCount() {
    return parameterCount;
  }

  public int slotCount() {
    return slotNames.size();
  }

  public String slotName(int slot) {
    return slotNames.get(slot);
  }

  @Override
  public String toString() {
    return slotNames.subList(0, parameterCount) + " | " + slotNames.subList(parameterCount, slotNames.size());
  }

  /**
   * 布局构建器；{@link #build()} 之后不再接受新名字。
   */
  public static final class Builder {
    private final String functionName;
    private final Map<String, Integer> slots = new LinkedHashMap<>();
    private int parameterCount;
    private boolean built;

    private Builder(String functionName) {
      this.functionName = functionName;
    }

    /**
     * 声明下一个参数。
     *
     * @throws IllegalStateException 参数重名，或者在局部变量之后声明
     */
    public Builder parameter(String name) {
      checkOpen();
      if (slots.size() != parameterCount) {
        throw new IllegalStateException("Parameter " + name + " declared after locals in " + functionName);
      }
      if (slots.containsKey(name)) {
        throw new IllegalStateException("Duplicate parameter " + name + " in " + functionName);
      }
      slots.put(name, parameterCount++);
      return this;
    }

    /** 名字对应的槽位，第一次出现时分配。 */
    public int slotFor(String name) {
      Integer slot = slots.get(name);
      if (slot != null) {
        return slot;
      }
      checkOpen();
      int fresh = slots.size();
      slots.put(name, fresh);
      return fresh;
    }

    public boolean isBound(String name) {
      return slots.containsKey(name);
    }

    public int slotCount() {
      return slots.size();
    }

    public FrameLayout build() {
      built = true;
      FrameDescriptor.Builder descriptor = FrameDescriptor.newBuilder(slots.size());
      for (String name : slots.keySet()) {
        descriptor.addSlot(FrameSlotKind.Object, name, null);
      }
      return new FrameLayout(descriptor.build(), List.copyOf(slots.keySet()), parameterCount);
    }

    private void checkOpen() {
      if (built) {
        throw new IllegalStateException("Frame layout of " + functionName + " is already built");
      }
    }
  }
}
