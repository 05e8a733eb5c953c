package metacpp.lowering.runtime;

/**
 * 错误消息统一生成工具。
 *
 * <p>降级阶段的内部错误与参考求值器的运行时错误都使用中英文双语描述并附带恢复提示，
 * 英文部分保留稳定的关键字，测试可以据此断言。</p>
 */
public final class ErrorMessages {

  private ErrorMessages() {
    // 禁止实例化工具类
  }

  /**
   * 构造双语消息。
   *
   * @param zh 中文描述
   * @param en 英文描述（保留关键词）
   * @return 按照“中文 (English)”格式拼接的字符串
   */
  public static String bilingual(String zh, String en) {
    return zh + " (" + en + ")";
  }

  /**
   * 为消息附加恢复提示。
   *
   * @param message 主体消息
   * @param hintZh 中文提示
   * @param hintEn 英文提示
   * @return 包含提示信息的完整消息文本
   */
  public static String withHint(String message, String hintZh, String hintEn) {
    return message + "\n提示：" + hintZh + " (Hint: " + hintEn + ")";
  }

  /**
   * raise 语句出现在没有返回类型信息的上下文中（例如顶层断言）。
   *
   * @param where 出错位置描述
   * @return 带有恢复建议的错误描述
   */
  public static String raiseOutsideFunction(String where) {
    String english = "raise outside of any function context: " + where;
    String message = bilingual("raise 出现在函数上下文之外：" + where, english);
    return withHint(message, "上游阶段应拒绝此类程序", "The upstream checker should have rejected this program");
  }

  /**
   * 异常处理上下文栈的 push/pop 不配对。
   *
   * @param expected 期望弹出的处理器
   * @param actual 实际位于栈顶的处理器
   * @return 带有恢复建议的错误描述
   */
  public static String handlerStackMismatch(String expected, String actual) {
    String english = "handler stack mismatch: expected " + expected + ", found " + actual;
    String message = bilingual("异常处理上下文栈不匹配：期望 " + expected + "，实际 " + actual, english);
    return withHint(message, "检查 try 语句体的降级是否提前返回", "Check that lowering of the try body restores the stack");
  }

  /**
   * 引用了外部符号表中不存在的外部名称。
   *
   * @param unit 外部编译单元
   * @param symbol 符号名
   * @return 带有恢复建议的错误描述
   */
  public static String unknownExternalSymbol(String unit, String symbol) {
    String english = "unknown external symbol " + unit + "." + symbol;
    String message = bilingual("外部符号不存在：" + unit + "." + symbol, english);
    return withHint(message, "确认依赖的编译单元已参与合并", "Make sure the defining unit was merged into the table");
  }

  /**
   * 合并编译单元时同一公开名称的可抛出性不一致。
   *
   * @param unit 编译单元
   * @param symbol 符号名
   * @return 带有恢复建议的错误描述
   */
  public static String conflictingExternalSymbol(String unit, String symbol) {
    String english = "conflicting definitions of " + unit + "." + symbol;
    String message = bilingual("编译单元合并冲突：" + unit + "." + symbol + " 的定义不一致", english);
    return withHint(message, "同一单元只能被编译一次后再合并", "Compile each unit once before merging");
  }

  /**
   * 断言失败。
   *
   * @param message 源程序中的断言消息
   * @return 带有恢复建议的断言失败描述
   */
  public static String assertionFailed(String message) {
    String english = "assertion failed: " + message;
    String text = bilingual("断言失败：" + message, english);
    return withHint(text, "检查断言条件", "Review the asserted condition");
  }

  /**
   * 模式分派没有命中任何分支。
   *
   * @param scrutinees 被匹配值描述
   * @return 带有恢复建议的匹配失败描述
   */
  public static String noMatchingCase(String scrutinees) {
    String english = "no match case matched " + scrutinees;
    String message = bilingual("没有分支匹配：" + scrutinees, english);
    return withHint(message, "补充兜底分支", "Add a catch-all case");
  }

  /**
   * 顶层计算产生了未被捕获的异常。
   *
   * @param error 异常值描述
   * @return 带有恢复建议的错误描述
   */
  public static String uncaughtToplevelError(String error) {
    String english = "uncaught error at top level: " + error;
    String message = bilingual("顶层未捕获的异常：" + error, english);
    return withHint(message, "在顶层之前用 try/except 处理", "Handle the exception before it reaches the top level");
  }

  /**
   * 调用点只有值目标，但被调函数在错误槽中返回了异常。
   *
   * @param function 被调函数
   * @return 带有恢复建议的错误描述
   */
  public static String droppedError(String function) {
    String english = "error returned by " + function + " has no error target";
    String message = bilingual("函数 " + function + " 返回的异常没有错误目标接收", english);
    return withHint(message, "重新计算可抛出性后再降级", "Recompute throwability before lowering");
  }

  /**
   * 构造类型期望与实际不符的错误消息。
   *
   * @param expected 期望类型描述
   * @param actual 实际类型描述
   * @return 带有恢复建议的类型错误描述
   */
  public static String typeExpectedGot(String expected, String actual) {
    String english = "Expected " + expected + ", got " + actual;
    String message = bilingual("类型不匹配：期望 " + expected + "，实际 " + actual, english);
    return withHint(message, "检查数据来源或转换逻辑，确保类型一致", "Review data source or conversion to ensure types match");
  }

  /**
   * 构造除零算术错误消息。
   *
   * @return 带有恢复建议的除零错误描述
   */
  public static String arithmeticDivisionByZero() {
    String message = bilingual("算术错误：除数为 0", "division by zero");
    return withHint(message, "检查输入参数，确保除数非 0", "Check the divisor and ensure it is non-zero");
  }
}
