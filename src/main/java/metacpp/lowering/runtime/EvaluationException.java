package metacpp.lowering.runtime;

/**
 * 参考求值器的运行时失败：断言失败、没有匹配分支、顶层未捕获的异常，以及违反双通道约定的调用。
 */
public class EvaluationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}
