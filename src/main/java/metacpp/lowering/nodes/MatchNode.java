package metacpp.lowering.nodes;

import com.oracle.truffle.api.CompilerDirectives.TruffleBoundary;
import com.oracle.truffle.api.frame.VirtualFrame;
import com.oracle.truffle.api.nodes.ExplodeLoop;
import metacpp.lowering.core.Pattern;
import metacpp.lowering.runtime.ErrorMessages;
import metacpp.lowering.runtime.EvaluationException;
import metacpp.lowering.runtime.TypeValue;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 有序模式分派
 *
 * 按顺序尝试每个分支：全部模式匹配成功时，把捕获变量写入帧槽位并执行该分支的调用。
 * 同一捕获名在一个分支中出现多次时，各处绑定的值必须相等。
 */
public final class MatchNode extends LoweredExpressionNode {

  public static final class Case extends LoweredExpressionNode {
    private final Pattern[] patterns;
    private final Map<String, Integer> captureSlots;
    @Child private CallNode call;

    public Case(List<Pattern> patterns, Map<String, Integer> captureSlots, CallNode call) {
      this.patterns = patterns.toArray(new Pattern[0]);
      this.captureSlots = Map.copyOf(captureSlots);
      this.call = call;
    }

    /** 模式全部匹配时返回捕获结果，否则返回 {@code null}。 */
    @TruffleBoundary
    Map<String, Object> tryMatch(Object[] scrutinees) {
      if (scrutinees.length != patterns.length) {
        return null;
      }
      Map<String, Object> bindings = new HashMap<>();
      for (int i = 0; i < patterns.length; i++) {
        if (!matches(patterns[i], scrutinees[i], bindings)) {
          return null;
        }
      }
      return bindings;
    }

    @Override
    public Object executeGeneric(VirtualFrame frame) {
      return call.executeGeneric(frame);
    }

    void bind(VirtualFrame frame, Map<String, Object> bindings) {
      for (Map.Entry<String, Integer> e : captureSlots.entrySet()) {
        if (bindings.containsKey(e.getKey())) {
          frame.setObject(e.getValue(), bindings.get(e.getKey()));
        }
      }
    }
  }

  @Children private final LoweredExpressionNode[] scrutinees;
  @Children private final Case[] cases;

  public MatchNode(List<LoweredExpressionNode> scrutinees, List<Case> cases) {
    this.scrutinees = scrutinees.toArray(new LoweredExpressionNode[0]);
    this.cases = cases.toArray(new Case[0]);
  }

  @Override
  @ExplodeLoop
  public Object executeGeneric(VirtualFrame frame) {
    Object[] values = new Object[scrutinees.length];
    for (int i = 0; i < scrutinees.length; i++) {
      values[i] = scrutinees[i].executeGeneric(frame);
    }
    for (Case c : cases) {
      Map<String, Object> bindings = c.tryMatch(values);
      if (bindings != null) {
        c.bind(frame, bindings);
        return c.executeGeneric(frame);
      }
    }
    throw new EvaluationException(ErrorMessages.noMatchingCase(Arrays.toString(values)));
  }

  static boolean matches(Pattern pattern, Object value, Map<String, Object> bindings) {
    if (pattern instanceof Pattern.Capture capture) {
      if (bindings.containsKey(capture.name)) {
        return Objects.equals(bindings.get(capture.name), value);
      }
      bindings.put(capture.name, value);
      return true;
    }
    if (pattern instanceof Pattern.AtomicType atomic) {
      return value instanceof TypeValue.Atomic a && a.cppType.equals(atomic.cppType);
    }
    if (pattern instanceof Pattern.Wrapper wrapper) {
      return value instanceof TypeValue.Wrapped w
          && w.wrapper == wrapper.wrapper
          && matches(wrapper.inner, w.inner, bindings);
    }
    if (pattern instanceof Pattern.TemplateInstantiation template) {
      if (!(value instanceof TypeValue.Instantiation inst)
          || !inst.template.equals(template.template)
          || inst.args.size() != template.args.size()) {
        return false;
      }
      for (int i = 0; i < template.args.size(); i++) {
        if (!matches(template.args.get(i), inst.args.get(i), bindings)) {
          return false;
        }
      }
      return true;
    }
    return false;
  }
}
