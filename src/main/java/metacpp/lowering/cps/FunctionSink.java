package metacpp.lowering.cps;

import metacpp.lowering.core.IdentifierGenerator;
import metacpp.lowering.core.LoweredModel;

import java.util.ArrayList;
import java.util.List;

/** 一次降级调用内共享的标识符来源与合成函数收集器，只追加。 */
final class FunctionSink {
  private final IdentifierGenerator ids;
  private final List<LoweredModel.Function> functions = new ArrayList<>();

  FunctionSink(IdentifierGenerator ids) {
    this.ids = ids;
  }

  String newId() {
    return ids.next();
  }

  void write(LoweredModel.Function function) {
    functions.add(function);
  }

  List<LoweredModel.Function> functions() {
    return functions;
  }
}
