package metacpp.lowering.analysis;

import metacpp.lowering.LoweringException;
import metacpp.lowering.core.ExprType;
import metacpp.lowering.core.LoweredModel;
import metacpp.lowering.runtime.ErrorMessages;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 已编译单元导出名称的可抛出性：{@code (unit, symbol) -> mayRaise}。
 *
 * <p>合并两个表时同一键的值必须一致，否则视为同一单元被编译出两个不同版本，直接报错。</p>
 */
public final class ExternalMayRaiseTable {
  private final Map<Key, Boolean> entries = new LinkedHashMap<>();

  private record Key(String unit, String symbol) {}

  public static ExternalMayRaiseTable empty() {
    return new ExternalMayRaiseTable();
  }

  /**
   * 从已分析的降级模块构建：公开函数映射到其 mayRaise，公开自定义类型映射为 false。
   *
   * @param module 已完成后处理的模块
   * @return 只含该单元导出名称的表
   */
  public static ExternalMayRaiseTable fromUnit(LoweredModel.Module module) {
    ExternalMayRaiseTable table = new ExternalMayRaiseTable();
    for (String name : module.publicNames) {
      LoweredModel.Function function = module.function(name);
      if (function != null) {
        table.put(module.name, name, function.mayRaise);
        continue;
      }
      for (ExprType.CustomType type : module.customTypes) {
        if (type.name.equals(name)) {
          table.put(module.name, name, false);
        }
      }
    }
    return table;
  }

  /**
   * 登记一个外部名称。
   *
   * @throws LoweringException 如果已有同名条目且值不同
   */
  public void put(String unit, String symbol, boolean mayRaise) {
    Key key = new Key(unit, symbol);
    Boolean previous = entries.putIfAbsent(key, mayRaise);
    if (previous != null && previous != mayRaise) {
      throw new LoweringException(ErrorMessages.conflictingExternalSymbol(unit, symbol));
    }
  }

  /**
   * 合并为新表，本表与参数均不修改。
   *
   * @param other 另一张表
   * @return 合并结果
   * @throws LoweringException 如果两张表对同一名称给出不同的值
   */
  public ExternalMayRaiseTable merge(ExternalMayRaiseTable other) {
    ExternalMayRaiseTable merged = new ExternalMayRaiseTable();
    for (Map.Entry<Key, Boolean> e : entries.entrySet()) {
      merged.put(e.getKey().unit(), e.getKey().symbol(), e.getValue());
    }
    for (Map.Entry<Key, Boolean> e : other.entries.entrySet()) {
      merged.put(e.getKey().unit(), e.getKey().symbol(), e.getValue());
    }
    return merged;
  }

  public boolean contains(String unit, String symbol) {
    return entries.containsKey(new Key(unit, symbol));
  }

  /**
   * @throws LoweringException 如果名称未登记；上游符号解析应保证引用的外部名称都存在
   */
  public boolean mayRaise(String unit, String symbol) {
    Boolean value = entries.get(new Key(unit, symbol));
    if (value == null) {
      throw new LoweringException(ErrorMessages.unknownExternalSymbol(unit, symbol));
    }
    return value;
  }

  public int size() {
    return entries.size();
  }

  /** 表中出现过的单元名。 */
  public Set<String> units() {
    Set<String> units = new TreeSet<>();
    for (Key key : entries.keySet()) {
      units.add(key.unit());
    }
    return Collections.unmodifiableSet(units);
  }
}
