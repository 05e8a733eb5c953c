package metacpp.lowering;

/**
 * 降级或分析阶段的内部不变量被破坏。
 *
 * <p>这类错误意味着上游阶段存在缺陷，编译立即中止，不会产出部分结果。
 * 用户程序层面的异常永远不会以此类型出现，它们只作为错误槽中的值流动。</p>
 */
public class LoweringException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public LoweringException(String message) {
    super(message);
  }

  public LoweringException(String message, Throwable cause) {
    super(message, cause);
  }
}
