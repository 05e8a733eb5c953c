package metacpp.lowering.runtime;

/** 按（单元，名称）解析全局函数。{@code unit} 为 {@code null} 表示当前单元。 */
public interface FunctionRegistry {
  FunctionValue lookup(String unit, String name);
}
