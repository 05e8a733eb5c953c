package metacpp.lowering.types;

import com.oracle.truffle.api.dsl.TypeSystem;
import metacpp.lowering.runtime.FunctionValue;

/**
 * 降级树求值器的类型系统
 *
 * int 在运行时统一为 long，bool 为 boolean；函数值单独列出，供调用节点按被调类型特化。
 * 其余值（类型值、自定义类型值、集合、列表）走通用 Object 路径。
 */
@TypeSystem({
    long.class,
    boolean.class,
    FunctionValue.class
})
public abstract class LoweredTypes {
  // DSL 生成的子类需要访问构造函数
  protected LoweredTypes() {}
}
