package metacpp.lowering.runtime;

import com.oracle.truffle.api.CompilerDirectives.CompilationFinal;

/**
 * 降级与参考求值器的配置
 *
 * 集中管理所有环境变量配置，在类加载时读取一次。
 * 使用 @CompilationFinal 标记，求值器节点可以把这些字段当作编译期常量。
 */
public final class LoweringConfig {
  private LoweringConfig() {}

  /**
   * 调试模式开关
   * 环境变量：METACPP_LOWERING_DEBUG
   * 启用时以 INFO 级别输出降级后的完整 JSON，并在求值器节点打印调试信息
   */
  @CompilationFinal
  public static final boolean DEBUG = System.getenv("METACPP_LOWERING_DEBUG") != null;

  /**
   * 默认编译单元名
   * 环境变量：METACPP_LOWERING_UNIT
   * 如果未指定，默认为 "main"；用于派生合成标识符的前缀
   */
  @CompilationFinal
  public static final String DEFAULT_UNIT = getEnvOrDefault("METACPP_LOWERING_UNIT", "main");

  /**
   * 辅助方法：读取环境变量或返回默认值
   */
  private static String getEnvOrDefault(String key, String defaultValue) {
    String value = System.getenv(key);
    return value != null ? value : defaultValue;
  }
}
