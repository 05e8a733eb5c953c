package metacpp.lowering.nodes;

import com.oracle.truffle.api.CompilerDirectives;
import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;
import com.oracle.truffle.api.frame.VirtualFrame;
import metacpp.lowering.runtime.FunctionRegistry;
import metacpp.lowering.runtime.FunctionValue;

/**
 * 全局函数引用。首次执行时通过注册表解析，之后缓存结果。
 *
 * {@code unit} 为 {@code null} 时在当前单元中查找，否则在导入的单元中查找。
 */
public final class ReadGlobalNode extends LoweredExpressionNode {
  private final FunctionRegistry registry;
  private final String unit;
  private final String name;
  @CompilationFinal private FunctionValue cached;

  public ReadGlobalNode(FunctionRegistry registry, String unit, String name) {
    this.registry = registry;
    this.unit = unit;
    this.name = name;
  }

  @Override
  public Object executeGeneric(VirtualFrame frame) {
    if (cached == null) {
      CompilerDirectives.transferToInterpreterAndInvalidate();
      cached = registry.lookup(unit, name);
    }
    return cached;
  }

  @Override
  public String toString() {
    return unit == null ? name : unit + "." + name;
  }
}
